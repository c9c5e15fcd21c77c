package io.statutedsl.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Payload of a deterministic evaluation: the effect that applies to the entity.
 *
 * @param statuteId       id of the evaluated statute
 * @param effect          the applied effect
 * @param defaultsApplied fields whose {@code DEFAULT} value was substituted, in first-use order
 */
public record EffectOutcome(String statuteId, EffectNode effect, List<String> defaultsApplied) {

    public EffectOutcome {
        Objects.requireNonNull(statuteId, "statuteId must not be null");
        Objects.requireNonNull(effect, "effect must not be null");
        defaultsApplied = defaultsApplied != null ? List.copyOf(defaultsApplied) : List.of();
    }

    @Override
    public String toString() {
        return effect.toString();
    }
}
