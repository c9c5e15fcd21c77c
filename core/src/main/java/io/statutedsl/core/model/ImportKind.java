package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Objects;

/**
 * Form of an {@code IMPORT} declaration. Paths are never resolved by the core.
 *
 * <ul>
 *   <li>{@link Simple}: {@code IMPORT "path"}</li>
 *   <li>{@link Aliased}: {@code IMPORT "path" AS alias}</li>
 *   <li>{@link Wildcard}: {@code IMPORT * FROM "path"}</li>
 *   <li>{@link Selective}: {@code IMPORT { a, b } FROM "path"}</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ImportKind.Simple.class, name = "Simple"),
    @JsonSubTypes.Type(value = ImportKind.Aliased.class, name = "Aliased"),
    @JsonSubTypes.Type(value = ImportKind.Wildcard.class, name = "Wildcard"),
    @JsonSubTypes.Type(value = ImportKind.Selective.class, name = "Selective")
})
public sealed interface ImportKind {

    enum Kind {
        SIMPLE,
        ALIASED,
        WILDCARD,
        SELECTIVE
    }

    Kind kind();

    record Simple() implements ImportKind {
        @Override
        public Kind kind() {
            return Kind.SIMPLE;
        }
    }

    record Aliased(String alias) implements ImportKind {
        public Aliased {
            Objects.requireNonNull(alias, "alias must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.ALIASED;
        }
    }

    record Wildcard() implements ImportKind {
        @Override
        public Kind kind() {
            return Kind.WILDCARD;
        }
    }

    record Selective(List<String> items) implements ImportKind {
        public Selective {
            Objects.requireNonNull(items, "items must not be null");
            if (items.isEmpty()) {
                throw new IllegalArgumentException("selective import requires at least one item");
            }
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.SELECTIVE;
        }
    }
}
