package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** A condition that is well-formed token-wise but meaningless, e.g. {@code LIKE} with a number. */
public final class InvalidConditionException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    public InvalidConditionException(String message, SourceLocation location) {
        super(message, DiagnosticCode.INVALID_CONDITION, location, Phase.PARSE);
    }
}
