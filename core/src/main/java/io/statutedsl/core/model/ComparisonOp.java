package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Comparison operators of a {@link ConditionNode.Comparison}. Serialized as their symbols. */
public enum ComparisonOp {
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** Whether the operator needs an ordering rather than just equality. */
    public boolean isOrdering() {
        return this != EQUAL && this != NOT_EQUAL;
    }

    /**
     * Applies the operator to a {@link Comparable#compareTo} result.
     *
     * @param cmp negative, zero or positive
     */
    public boolean test(int cmp) {
        return switch (this) {
            case GREATER_THAN -> cmp > 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
            case LESS_THAN -> cmp < 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
        };
    }

    /**
     * Resolves an operator from its source symbol.
     *
     * @throws IllegalArgumentException if the symbol is not a comparison operator
     */
    @JsonCreator
    public static ComparisonOp fromSymbol(String symbol) {
        for (ComparisonOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: '" + symbol + "'");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
