package io.statutedsl.core.analysis;

import io.statutedsl.core.model.ComparisonOp;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.model.Value;
import io.statutedsl.core.parser.ConditionParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Per-condition checks: invalid {@code BETWEEN} ranges, operator/value kind mismatches and,
 * optionally, conjunctions whose numeric or date bounds can never hold together.
 */
final class ConditionChecks {

    private final Statute statute;
    private final Consumer<Diagnostic> sink;
    private final boolean reportContradictions;

    ConditionChecks(Statute statute, Consumer<Diagnostic> sink, boolean reportContradictions) {
        this.statute = statute;
        this.sink = sink;
        this.reportContradictions = reportContradictions;
    }

    /** Runs every check over {@code condition}. */
    void check(ConditionNode condition) {
        typeCheck(condition);
        if (reportContradictions) {
            contradictions(condition);
        }
    }

    // ── Ranges and kinds ──

    private void typeCheck(ConditionNode node) {
        switch (node.kind()) {
            case COMPARISON -> {
                ConditionNode.Comparison c = (ConditionNode.Comparison) node;
                checkLiteral(c.field(), c.value());
                if (c.operator().isOrdering() && !c.value().isOrdered()) {
                    mismatch("operator '" + c.operator() + "' needs a number or date, but '" + c.field()
                            + "' is compared with " + describe(c.value()));
                }
            }
            case BETWEEN -> {
                ConditionNode.Between b = (ConditionNode.Between) node;
                checkLiteral(b.field(), b.min());
                checkLiteral(b.field(), b.max());
                if (!b.min().isOrdered() || !b.max().isOrdered()) {
                    mismatch("BETWEEN bounds of '" + b.field() + "' must be numbers or dates");
                } else if (b.min().kind() != b.max().kind()) {
                    mismatch("BETWEEN bounds of '" + b.field() + "' mix " + describe(b.min()) + " and "
                            + describe(b.max()));
                } else if (Value.compare(b.min(), b.max()) >= 0) {
                    sink.accept(Diagnostic.forStatute(
                            DiagnosticCode.INVALID_RANGE,
                            "invalid range for '" + b.field() + "': BETWEEN " + b.min() + " AND " + b.max()
                                    + " (min must be less than max)",
                            statute.id()));
                }
            }
            case IN_SET -> {
                ConditionNode.InSet in = (ConditionNode.InSet) node;
                Value.Kind first = in.values().get(0).kind();
                boolean mixed = false;
                for (Value value : in.values()) {
                    checkLiteral(in.field(), value);
                    mixed |= value.kind() != first;
                }
                if (mixed) {
                    mismatch("IN set of '" + in.field() + "' mixes value kinds");
                }
            }
            case LIKE -> {
                ConditionNode.Like like = (ConditionNode.Like) node;
                if (isNumericBuiltIn(like.field())) {
                    mismatch("LIKE needs a string attribute, but '" + like.field() + "' is numeric");
                }
                Value fallback = statute.defaults().get(like.field());
                if (fallback != null && fallback.kind() != Value.Kind.STRING) {
                    mismatch("LIKE on '" + like.field() + "' but its DEFAULT is " + describe(fallback));
                }
            }
            case HAS_ATTRIBUTE -> {
                // any attribute may be tested for presence
            }
            case AND -> {
                typeCheck(((ConditionNode.And) node).left());
                typeCheck(((ConditionNode.And) node).right());
            }
            case OR -> {
                typeCheck(((ConditionNode.Or) node).left());
                typeCheck(((ConditionNode.Or) node).right());
            }
            case NOT -> typeCheck(((ConditionNode.Not) node).inner());
            default -> throw new IllegalStateException("Unhandled condition kind: " + node.kind());
        }
    }

    /** Checks a literal against the field's built-in kind and its {@code DEFAULT} kind. */
    private void checkLiteral(String field, Value value) {
        if (value.kind() == Value.Kind.ABSENT) {
            mismatch("'" + field + "' is compared with an absent value");
            return;
        }
        if (isNumericBuiltIn(field) && value.kind() != Value.Kind.NUMBER) {
            mismatch("'" + field + "' is numeric but is compared with " + describe(value));
            return;
        }
        Value fallback = statute.defaults().get(field);
        if (fallback != null && fallback.kind() != value.kind()) {
            mismatch("'" + field + "' is compared with " + describe(value) + " but its DEFAULT is "
                    + describe(fallback));
        }
    }

    private void mismatch(String message) {
        sink.accept(Diagnostic.forStatute(DiagnosticCode.TYPE_MISMATCH, message, statute.id()));
    }

    private static boolean isNumericBuiltIn(String field) {
        return ConditionParser.BUILT_IN_FIELDS.contains(field);
    }

    private static String describe(Value value) {
        return switch (value.kind()) {
            case NUMBER -> "number " + value;
            case STRING -> "string " + value;
            case BOOLEAN -> "boolean " + value;
            case DATE -> "date " + value;
            case ABSENT -> "absent";
        };
    }

    // ── Contradictions ──

    private void contradictions(ConditionNode node) {
        switch (node.kind()) {
            case AND -> {
                List<ConditionNode> leaves = new ArrayList<>();
                flattenConjunction(node, leaves);
                checkBounds(leaves);
                for (ConditionNode leaf : leaves) {
                    contradictions(leaf);
                }
            }
            case OR -> {
                contradictions(((ConditionNode.Or) node).left());
                contradictions(((ConditionNode.Or) node).right());
            }
            case NOT -> contradictions(((ConditionNode.Not) node).inner());
            default -> {
                // leaves hold no conjunction
            }
        }
    }

    private static void flattenConjunction(ConditionNode node, List<ConditionNode> out) {
        if (node.kind() == ConditionNode.Kind.AND) {
            flattenConjunction(((ConditionNode.And) node).left(), out);
            flattenConjunction(((ConditionNode.And) node).right(), out);
        } else {
            out.add(node);
        }
    }

    private void checkBounds(List<ConditionNode> conjuncts) {
        Map<String, Interval> intervals = new LinkedHashMap<>();
        for (ConditionNode leaf : conjuncts) {
            if (leaf.kind() == ConditionNode.Kind.COMPARISON) {
                ConditionNode.Comparison c = (ConditionNode.Comparison) leaf;
                if (!c.value().isOrdered() || c.operator() == ComparisonOp.NOT_EQUAL) {
                    continue;
                }
                Interval interval = intervals.computeIfAbsent(key(c.field(), c.value()), k -> new Interval());
                switch (c.operator()) {
                    case GREATER_THAN -> interval.raiseLower(c.value(), false);
                    case GREATER_OR_EQUAL -> interval.raiseLower(c.value(), true);
                    case LESS_THAN -> interval.lowerUpper(c.value(), false);
                    case LESS_OR_EQUAL -> interval.lowerUpper(c.value(), true);
                    case EQUAL -> {
                        interval.raiseLower(c.value(), true);
                        interval.lowerUpper(c.value(), true);
                    }
                    default -> {
                        // NOT_EQUAL skipped above
                    }
                }
            } else if (leaf.kind() == ConditionNode.Kind.BETWEEN) {
                ConditionNode.Between b = (ConditionNode.Between) leaf;
                if (!Value.comparable(b.min(), b.max()) || Value.compare(b.min(), b.max()) >= 0) {
                    continue; // reported as INVALID_RANGE
                }
                Interval interval = intervals.computeIfAbsent(key(b.field(), b.min()), k -> new Interval());
                interval.raiseLower(b.min(), true);
                interval.lowerUpper(b.max(), true);
            }
        }
        intervals.forEach((key, interval) -> {
            if (interval.isEmpty()) {
                String field = key.substring(0, key.lastIndexOf('#'));
                sink.accept(Diagnostic.forStatute(
                        DiagnosticCode.CONTRADICTORY_CONDITION,
                        "conditions on '" + field + "' can never hold together (" + interval + ")",
                        statute.id()));
            }
        });
    }

    private static String key(String field, Value value) {
        return field + "#" + value.kind();
    }

    /** Accumulated bounds for one field; a bound is {@code null} when unconstrained. */
    private static final class Interval {

        private Value lower;
        private boolean lowerInclusive;
        private Value upper;
        private boolean upperInclusive;

        void raiseLower(Value value, boolean inclusive) {
            if (lower == null) {
                lower = value;
                lowerInclusive = inclusive;
                return;
            }
            int cmp = Value.compare(value, lower);
            if (cmp > 0 || (cmp == 0 && !inclusive)) {
                lower = value;
                lowerInclusive = inclusive;
            }
        }

        void lowerUpper(Value value, boolean inclusive) {
            if (upper == null) {
                upper = value;
                upperInclusive = inclusive;
                return;
            }
            int cmp = Value.compare(value, upper);
            if (cmp < 0 || (cmp == 0 && !inclusive)) {
                upper = value;
                upperInclusive = inclusive;
            }
        }

        boolean isEmpty() {
            if (lower == null || upper == null) {
                return false;
            }
            int cmp = Value.compare(lower, upper);
            return cmp > 0 || (cmp == 0 && !(lowerInclusive && upperInclusive));
        }

        @Override
        public String toString() {
            return (lowerInclusive ? ">= " : "> ") + lower + " and " + (upperInclusive ? "<= " : "< ") + upper;
        }
    }
}
