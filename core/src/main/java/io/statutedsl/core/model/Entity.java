package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, insertion-ordered attribute bag evaluated against statutes.
 *
 * <p>Entities are built by callers; the evaluator only reads them. Serialized as a plain JSON
 * object of attribute name to {@link Value}.
 */
public final class Entity {

    private static final Entity EMPTY = new Entity(Map.of());

    private final Map<String, Value> attributes;

    private Entity(Map<String, Value> attributes) {
        this.attributes = attributes;
    }

    public static Entity empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Entity of(Map<String, Value> attributes) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        if (attributes.isEmpty()) {
            return EMPTY;
        }
        Map<String, Value> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            Objects.requireNonNull(key, "attribute name must not be null");
            Objects.requireNonNull(value, "attribute '" + key + "' must not be null");
            copy.put(key, value);
        });
        return new Entity(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the attribute value, if recorded. */
    public Optional<Value> get(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean contains(String name) {
        return attributes.containsKey(name);
    }

    public int size() {
        return attributes.size();
    }

    @JsonValue
    public Map<String, Value> attributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Entity other && attributes.equals(other.attributes));
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Entity" + attributes;
    }

    /** Builder for {@link Entity}; later puts replace earlier ones but keep the original position. */
    public static final class Builder {

        private final Map<String, Value> attributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, Value value) {
            attributes.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String name, long number) {
            return put(name, Value.of(number));
        }

        public Builder put(String name, BigDecimal number) {
            return put(name, Value.of(number));
        }

        public Builder put(String name, String text) {
            return put(name, Value.of(text));
        }

        public Builder put(String name, boolean flag) {
            return put(name, Value.of(flag));
        }

        public Builder put(String name, LocalDate date) {
            return put(name, Value.of(date));
        }

        /** Records the attribute as inapplicable. */
        public Builder absent(String name) {
            return put(name, Value.absent());
        }

        public Entity build() {
            return Entity.of(attributes);
        }
    }
}
