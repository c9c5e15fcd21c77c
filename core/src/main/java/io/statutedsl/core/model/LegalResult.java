package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Three-valued legal outcome.
 *
 * <ul>
 *   <li>{@link Deterministic}: the computation succeeded and the value is authoritative.</li>
 *   <li>{@link JudicialDiscretion}: human judgment is required; {@code factors} names what is
 *       missing or ambiguous.</li>
 *   <li>{@link Void}: the statute is logically inapplicable to the entity.</li>
 * </ul>
 *
 * <p>Consumers handle the three cases through {@link #fold} or a switch over {@link #outcome()}.
 * {@code Void} shadows {@link java.lang.Void}; refer to it as {@code LegalResult.Void}.
 *
 * @param <T> payload type of the deterministic case
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LegalResult.Deterministic.class, name = "Deterministic"),
    @JsonSubTypes.Type(value = LegalResult.JudicialDiscretion.class, name = "JudicialDiscretion"),
    @JsonSubTypes.Type(value = LegalResult.Void.class, name = "Void")
})
public sealed interface LegalResult<T> {

    enum Outcome {
        DETERMINISTIC,
        JUDICIAL_DISCRETION,
        VOID
    }

    Outcome outcome();

    static <T> LegalResult<T> deterministic(T value) {
        return new Deterministic<>(value);
    }

    static <T> LegalResult<T> discretion(String reasoning, List<String> factors) {
        return new JudicialDiscretion<>(reasoning, factors);
    }

    static <T> LegalResult<T> discretion(String reasoning) {
        return new JudicialDiscretion<>(reasoning, List.of());
    }

    static <T> LegalResult<T> voided(String reason) {
        return new Void<>(reason);
    }

    @JsonIgnore
    default boolean isDeterministic() {
        return outcome() == Outcome.DETERMINISTIC;
    }

    @JsonIgnore
    default boolean isDiscretion() {
        return outcome() == Outcome.JUDICIAL_DISCRETION;
    }

    @JsonIgnore
    default boolean isVoid() {
        return outcome() == Outcome.VOID;
    }

    /** Reduces the result to a single value, handling every case. */
    @SuppressWarnings("unchecked")
    default <R> R fold(
            Function<? super T, ? extends R> onDeterministic,
            Function<? super JudicialDiscretion<T>, ? extends R> onDiscretion,
            Function<? super Void<T>, ? extends R> onVoid) {
        return switch (outcome()) {
            case DETERMINISTIC -> onDeterministic.apply(((Deterministic<T>) this).value());
            case JUDICIAL_DISCRETION -> onDiscretion.apply((JudicialDiscretion<T>) this);
            case VOID -> onVoid.apply((Void<T>) this);
        };
    }

    /** Maps the deterministic payload; the other cases are carried over unchanged. */
    default <R> LegalResult<R> map(Function<? super T, ? extends R> mapper) {
        return fold(
                value -> new Deterministic<R>(mapper.apply(value)),
                discretion -> new JudicialDiscretion<R>(discretion.reasoning(), discretion.factors()),
                voided -> new Void<R>(voided.reason()));
    }

    record Deterministic<T>(T value) implements LegalResult<T> {
        public Deterministic {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Outcome outcome() {
            return Outcome.DETERMINISTIC;
        }
    }

    /**
     * Outcome requiring human judgment.
     *
     * @param reasoning why a person has to decide
     * @param factors   facts or guidance the decision depends on, without duplicates
     */
    record JudicialDiscretion<T>(String reasoning, List<String> factors) implements LegalResult<T> {
        public JudicialDiscretion {
            Objects.requireNonNull(reasoning, "reasoning must not be null");
            factors = factors != null ? List.copyOf(new LinkedHashSet<>(factors)) : List.of();
        }

        /** Combines two discretionary results, keeping the first reasoning and all factors. */
        public JudicialDiscretion<T> merge(JudicialDiscretion<?> other) {
            List<String> merged = new ArrayList<>(factors);
            merged.addAll(other.factors());
            return new JudicialDiscretion<>(reasoning, merged);
        }

        @Override
        public Outcome outcome() {
            return Outcome.JUDICIAL_DISCRETION;
        }
    }

    record Void<T>(String reason) implements LegalResult<T> {
        public Void {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public Outcome outcome() {
            return Outcome.VOID;
        }
    }
}
