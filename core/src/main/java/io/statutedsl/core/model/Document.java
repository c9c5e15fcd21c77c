package io.statutedsl.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A parsed DSL source file: imports, an optional namespace, statutes in declaration order and
 * exported statute ids.
 *
 * @param imports   import declarations, in order
 * @param namespace declared namespace, or {@code null}
 * @param statutes  statutes, in order
 * @param exports   exported statute ids, in order
 */
public record Document(List<ImportDecl> imports, String namespace, List<Statute> statutes, List<String> exports) {

    public Document {
        imports = imports != null ? List.copyOf(imports) : List.of();
        statutes = statutes != null ? List.copyOf(statutes) : List.of();
        exports = exports != null ? List.copyOf(exports) : List.of();
    }

    /** A document holding only the given statutes. */
    public static Document of(Statute... statutes) {
        return new Document(List.of(), null, List.of(statutes), List.of());
    }

    /** Finds the first statute with the given id. */
    public Optional<Statute> find(String id) {
        for (Statute statute : statutes) {
            if (statute.id().equals(id)) {
                return Optional.of(statute);
            }
        }
        return Optional.empty();
    }
}
