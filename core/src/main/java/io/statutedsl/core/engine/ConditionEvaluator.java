package io.statutedsl.core.engine;

import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Entity;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates condition trees against one entity using the connectives of {@link TruthTable}.
 *
 * <p>Leaf policy:
 *
 * <ul>
 *   <li>missing attribute with a {@code DEFAULT}: the default is used and recorded;</li>
 *   <li>missing attribute without a default: judicial discretion, never {@code false};</li>
 *   <li>attribute recorded as absent: Void;</li>
 *   <li>attribute of the wrong kind: judicial discretion (defaults never replace a present value
 *       and kinds are never coerced);</li>
 *   <li>{@code HAS}: true iff the attribute is present and not absent, defaults ignored.</li>
 * </ul>
 *
 * <p>Both sides of {@code AND}/{@code OR} are always evaluated. One instance serves one
 * evaluation call and is not thread-safe.
 */
public final class ConditionEvaluator {

    private final Entity entity;
    private final Map<String, Value> defaults;
    private final boolean globCaseSensitive;
    private final Set<String> defaultsApplied = new LinkedHashSet<>();

    public ConditionEvaluator(Entity entity, Map<String, Value> defaults, boolean globCaseSensitive) {
        this.entity = entity;
        this.defaults = defaults;
        this.globCaseSensitive = globCaseSensitive;
    }

    /** Fields whose default was substituted so far, in first-use order. */
    public List<String> defaultsApplied() {
        return new ArrayList<>(defaultsApplied);
    }

    public LegalResult<Boolean> evaluate(ConditionNode node) {
        return switch (node.kind()) {
            case COMPARISON -> comparison((ConditionNode.Comparison) node);
            case BETWEEN -> between((ConditionNode.Between) node);
            case IN_SET -> inSet((ConditionNode.InSet) node);
            case HAS_ATTRIBUTE -> has((ConditionNode.HasAttribute) node);
            case LIKE -> like((ConditionNode.Like) node);
            case AND -> {
                ConditionNode.And and = (ConditionNode.And) node;
                LegalResult<Boolean> left = evaluate(and.left());
                LegalResult<Boolean> right = evaluate(and.right());
                yield TruthTable.and(left, right);
            }
            case OR -> {
                ConditionNode.Or or = (ConditionNode.Or) node;
                LegalResult<Boolean> left = evaluate(or.left());
                LegalResult<Boolean> right = evaluate(or.right());
                yield TruthTable.or(left, right);
            }
            case NOT -> TruthTable.not(evaluate(((ConditionNode.Not) node).inner()));
        };
    }

    // ── Leaves ──

    private LegalResult<Boolean> comparison(ConditionNode.Comparison c) {
        Lookup lookup = lookup(c.field());
        if (lookup.result != null) {
            return lookup.result;
        }
        Value actual = lookup.value;
        if (c.operator().isOrdering()) {
            if (!Value.comparable(actual, c.value())) {
                return wrongKind(c.field(), actual, c.value().kind());
            }
            return TruthTable.of(c.operator().test(Value.compare(actual, c.value())));
        }
        if (actual.kind() != c.value().kind()) {
            return wrongKind(c.field(), actual, c.value().kind());
        }
        return TruthTable.of(c.operator().test(actual.equals(c.value()) ? 0 : 1));
    }

    private LegalResult<Boolean> between(ConditionNode.Between b) {
        Lookup lookup = lookup(b.field());
        if (lookup.result != null) {
            return lookup.result;
        }
        Value actual = lookup.value;
        if (!Value.comparable(actual, b.min()) || !Value.comparable(actual, b.max())) {
            return wrongKind(b.field(), actual, b.min().kind());
        }
        return TruthTable.of(Value.compare(actual, b.min()) >= 0 && Value.compare(actual, b.max()) <= 0);
    }

    private LegalResult<Boolean> inSet(ConditionNode.InSet in) {
        Lookup lookup = lookup(in.field());
        if (lookup.result != null) {
            return lookup.result;
        }
        Value actual = lookup.value;
        boolean kindMatches = false;
        for (Value candidate : in.values()) {
            if (candidate.kind() == actual.kind()) {
                kindMatches = true;
                if (candidate.equals(actual)) {
                    return TruthTable.of(true);
                }
            }
        }
        return kindMatches ? TruthTable.of(false) : wrongKind(in.field(), actual, in.values().get(0).kind());
    }

    private LegalResult<Boolean> has(ConditionNode.HasAttribute h) {
        Optional<Value> value = entity.get(h.key());
        return TruthTable.of(value.isPresent() && value.get().kind() != Value.Kind.ABSENT);
    }

    private LegalResult<Boolean> like(ConditionNode.Like like) {
        Lookup lookup = lookup(like.field());
        if (lookup.result != null) {
            return lookup.result;
        }
        Value actual = lookup.value;
        if (actual.kind() != Value.Kind.STRING) {
            return wrongKind(like.field(), actual, Value.Kind.STRING);
        }
        String text = ((Value.StringValue) actual).value();
        return TruthTable.of(GlobPattern.matches(like.pattern(), text, globCaseSensitive));
    }

    // ── Attribute resolution ──

    /** Either a usable value or an early result for the leaf. */
    private static final class Lookup {
        final Value value;
        final LegalResult<Boolean> result;

        Lookup(Value value, LegalResult<Boolean> result) {
            this.value = value;
            this.result = result;
        }
    }

    private Lookup lookup(String field) {
        Optional<Value> present = entity.get(field);
        if (present.isPresent()) {
            Value value = present.get();
            if (value.kind() == Value.Kind.ABSENT) {
                return new Lookup(null, LegalResult.voided("attribute '" + field + "' is inapplicable"));
            }
            return new Lookup(value, null);
        }
        Value fallback = defaults.get(field);
        if (fallback != null) {
            defaultsApplied.add(field);
            return new Lookup(fallback, null);
        }
        return new Lookup(
                null, LegalResult.discretion("missing attribute '" + field + "'", List.of(field)));
    }

    private static LegalResult<Boolean> wrongKind(String field, Value actual, Value.Kind expected) {
        return LegalResult.discretion(
                "attribute '" + field + "' is " + actual.kind() + " where " + expected + " was expected",
                List.of(field));
    }
}
