package io.statutedsl.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed statute: a named rule with preconditions, an effect, and optional discretion,
 * exception, default, temporal and dependency clauses.
 *
 * <p>{@code requires} and {@code supersedes} hold statute ids, never statute references, so the
 * ownership graph stays a tree even when the dependency relation is cyclic. Cycle detection is
 * the semantic analyzer's job.
 *
 * <p>Use {@link #builder(String, String)} to construct instances.
 *
 * @param id              statute id, unique within a registry (not enforced here)
 * @param title           human-readable title
 * @param version         version number (>= 1)
 * @param jurisdiction    jurisdiction code, or {@code null}
 * @param visibility      visibility outside the document
 * @param preconditions   conjunction of all {@code WHEN}/{@code UNLESS} clauses, or {@code null}
 * @param effect          effect applied when preconditions hold
 * @param discretionLogic guidance that forces human judgment, or {@code null}
 * @param exceptions      exception clauses, in declaration order
 * @param defaults        values substituted for missing entity attributes
 * @param effectiveDate   first day in force, or {@code null}
 * @param expiryDate      last day in force, or {@code null}
 * @param requires        ids of statutes this statute depends on
 * @param supersedes      ids of statutes this statute replaces
 * @param amendments      amendment history, in declaration order
 */
public record Statute(
        String id,
        String title,
        int version,
        String jurisdiction,
        Visibility visibility,
        ConditionNode preconditions,
        EffectNode effect,
        String discretionLogic,
        List<ExceptionClause> exceptions,
        Map<String, Value> defaults,
        LocalDate effectiveDate,
        LocalDate expiryDate,
        List<String> requires,
        List<String> supersedes,
        List<AmendmentRecord> amendments) {

    public Statute {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(effect, "effect must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("statute version must be >= 1, got: " + version);
        }
        visibility = visibility != null ? visibility : Visibility.PRIVATE;
        exceptions = exceptions != null ? List.copyOf(exceptions) : List.of();
        defaults = defaults == null || defaults.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        requires = requires != null ? List.copyOf(requires) : List.of();
        supersedes = supersedes != null ? List.copyOf(supersedes) : List.of();
        amendments = amendments != null ? List.copyOf(amendments) : List.of();
    }

    public static Builder builder(String id, String title) {
        return new Builder(id, title);
    }

    /** Whether the statute carries a {@code DISCRETION} clause. */
    public boolean hasDiscretion() {
        return discretionLogic != null && !discretionLogic.isBlank();
    }

    /** The exception conditions alone, in declaration order. */
    public List<ConditionNode> exceptionConditions() {
        List<ConditionNode> conditions = new ArrayList<>(exceptions.size());
        for (ExceptionClause clause : exceptions) {
            conditions.add(clause.condition());
        }
        return conditions;
    }

    /** Whether {@code date} lies within the inclusive effective/expiry window. */
    public boolean inForceOn(LocalDate date) {
        boolean started = effectiveDate == null || !date.isBefore(effectiveDate);
        boolean notExpired = expiryDate == null || !date.isAfter(expiryDate);
        return started && notExpired;
    }

    /** Returns a builder pre-populated with this statute's fields. */
    public Builder toBuilder() {
        Builder b = new Builder(id, title);
        b.version = version;
        b.jurisdiction = jurisdiction;
        b.visibility = visibility;
        b.preconditions = preconditions;
        b.effect = effect;
        b.discretionLogic = discretionLogic;
        b.exceptions.addAll(exceptions);
        b.defaults.putAll(defaults);
        b.effectiveDate = effectiveDate;
        b.expiryDate = expiryDate;
        b.requires.addAll(requires);
        b.supersedes.addAll(supersedes);
        b.amendments.addAll(amendments);
        return b;
    }

    /** Builder for {@link Statute}. Version defaults to 1 and visibility to private. */
    public static final class Builder {

        private final String id;
        private final String title;
        private int version = 1;
        private String jurisdiction;
        private Visibility visibility = Visibility.PRIVATE;
        private ConditionNode preconditions;
        private EffectNode effect;
        private String discretionLogic;
        private final List<ExceptionClause> exceptions = new ArrayList<>();
        private final Map<String, Value> defaults = new LinkedHashMap<>();
        private LocalDate effectiveDate;
        private LocalDate expiryDate;
        private final List<String> requires = new ArrayList<>();
        private final List<String> supersedes = new ArrayList<>();
        private final List<AmendmentRecord> amendments = new ArrayList<>();

        private Builder(String id, String title) {
            this.id = id;
            this.title = title;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        /** Replaces the preconditions. */
        public Builder preconditions(ConditionNode preconditions) {
            this.preconditions = preconditions;
            return this;
        }

        /** Conjoins {@code condition} onto the existing preconditions (left-to-right). */
        public Builder when(ConditionNode condition) {
            this.preconditions = ConditionNode.conjoin(preconditions, condition);
            return this;
        }

        public Builder effect(EffectNode effect) {
            this.effect = effect;
            return this;
        }

        public Builder discretion(String discretionLogic) {
            this.discretionLogic = discretionLogic;
            return this;
        }

        public Builder exception(ExceptionClause exception) {
            this.exceptions.add(exception);
            return this;
        }

        public Builder exception(ConditionNode condition) {
            return exception(new ExceptionClause(condition));
        }

        public Builder defaultValue(String field, Value value) {
            this.defaults.put(field, value);
            return this;
        }

        public Builder effectiveDate(LocalDate effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder expiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
            return this;
        }

        public Builder requires(String... ids) {
            Collections.addAll(this.requires, ids);
            return this;
        }

        public Builder supersedes(String... ids) {
            Collections.addAll(this.supersedes, ids);
            return this;
        }

        public Builder amendment(AmendmentRecord amendment) {
            this.amendments.add(amendment);
            return this;
        }

        /** Whether an effect has been set; the parser uses this to reject a second {@code THEN}. */
        public boolean hasEffect() {
            return effect != null;
        }

        public boolean hasDefault(String field) {
            return defaults.containsKey(field);
        }

        public Statute build() {
            return new Statute(
                    id,
                    title,
                    version,
                    jurisdiction,
                    visibility,
                    preconditions,
                    effect,
                    discretionLogic,
                    exceptions,
                    defaults,
                    effectiveDate,
                    expiryDate,
                    requires,
                    supersedes,
                    amendments);
        }
    }
}
