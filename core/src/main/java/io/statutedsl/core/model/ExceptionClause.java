package io.statutedsl.core.model;

import java.util.Objects;

/**
 * An {@code EXCEPTION WHEN condition ["description"]} clause. When the condition holds the
 * statute is void for the entity.
 *
 * @param condition   condition that triggers the exception
 * @param description optional explanation, or {@code null}
 */
public record ExceptionClause(ConditionNode condition, String description) {

    public ExceptionClause {
        Objects.requireNonNull(condition, "condition must not be null");
    }

    public ExceptionClause(ConditionNode condition) {
        this(condition, null);
    }
}
