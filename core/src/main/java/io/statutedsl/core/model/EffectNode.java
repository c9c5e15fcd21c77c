package io.statutedsl.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The effect a statute applies when its preconditions hold.
 *
 * @param type        grant, revoke, obligation or prohibition
 * @param description human-readable description, e.g. "Full legal capacity"
 * @param parameters  optional named parameters in declaration order (never null)
 */
public record EffectNode(EffectType type, String description, Map<String, Value> parameters) {

    public EffectNode {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters == null || parameters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public EffectNode(EffectType type, String description) {
        this(type, description, Map.of());
    }

    public static EffectNode grant(String description) {
        return new EffectNode(EffectType.GRANT, description);
    }

    public static EffectNode revoke(String description) {
        return new EffectNode(EffectType.REVOKE, description);
    }

    public static EffectNode obligation(String description) {
        return new EffectNode(EffectType.OBLIGATION, description);
    }

    public static EffectNode prohibition(String description) {
        return new EffectNode(EffectType.PROHIBITION, description);
    }

    @Override
    public String toString() {
        return type.tag() + "(\"" + description + "\")";
    }
}
