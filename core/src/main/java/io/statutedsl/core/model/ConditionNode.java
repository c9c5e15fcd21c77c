package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Objects;

/**
 * Condition expression tree produced by the condition parser.
 *
 * <p>Sealed hierarchy; consumers switch over {@link #kind()} so that adding a variant breaks
 * compilation of every switch that does not handle it. Nodes are built bottom-up and never
 * refer back to their parent, so a well-formed value is always a finite tree.
 *
 * <p>Thread-safe and immutable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConditionNode.Comparison.class, name = "Comparison"),
    @JsonSubTypes.Type(value = ConditionNode.Between.class, name = "Between"),
    @JsonSubTypes.Type(value = ConditionNode.InSet.class, name = "InSet"),
    @JsonSubTypes.Type(value = ConditionNode.HasAttribute.class, name = "HasAttribute"),
    @JsonSubTypes.Type(value = ConditionNode.Like.class, name = "Like"),
    @JsonSubTypes.Type(value = ConditionNode.And.class, name = "And"),
    @JsonSubTypes.Type(value = ConditionNode.Or.class, name = "Or"),
    @JsonSubTypes.Type(value = ConditionNode.Not.class, name = "Not")
})
public sealed interface ConditionNode {

    /** Variant tag. */
    enum Kind {
        COMPARISON,
        BETWEEN,
        IN_SET,
        HAS_ATTRIBUTE,
        LIKE,
        AND,
        OR,
        NOT
    }

    Kind kind();

    /** Conjoins two optional conditions; either side may be {@code null}. */
    static ConditionNode conjoin(ConditionNode left, ConditionNode right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return new And(left, right);
    }

    /** {@code field operator value}, e.g. {@code age >= 18}. */
    record Comparison(String field, ComparisonOp operator, Value value) implements ConditionNode {
        public Comparison {
            requireField(field);
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.COMPARISON;
        }
    }

    /** {@code field BETWEEN min AND max}, inclusive on both ends. */
    record Between(String field, Value min, Value max) implements ConditionNode {
        public Between {
            requireField(field);
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.BETWEEN;
        }
    }

    /** {@code field IN (v1, v2, ...)}. */
    record InSet(String field, List<Value> values) implements ConditionNode {
        public InSet {
            requireField(field);
            Objects.requireNonNull(values, "values must not be null");
            if (values.isEmpty()) {
                throw new IllegalArgumentException("IN requires at least one value");
            }
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.IN_SET;
        }
    }

    /** {@code HAS key}. */
    record HasAttribute(String key) implements ConditionNode {
        public HasAttribute {
            requireField(key);
        }

        @Override
        public Kind kind() {
            return Kind.HAS_ATTRIBUTE;
        }
    }

    /** {@code field LIKE "glob"}. */
    record Like(String field, String pattern) implements ConditionNode {
        public Like {
            requireField(field);
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.LIKE;
        }
    }

    record And(ConditionNode left, ConditionNode right) implements ConditionNode {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.AND;
        }
    }

    record Or(ConditionNode left, ConditionNode right) implements ConditionNode {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.OR;
        }
    }

    record Not(ConditionNode inner) implements ConditionNode {
        public Not {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NOT;
        }
    }

    private static void requireField(String field) {
        Objects.requireNonNull(field, "field must not be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("field must not be empty");
        }
    }
}
