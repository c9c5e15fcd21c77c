package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** Missing, duplicated or malformed {@code THEN} effect. */
public final class InvalidEffectException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    public InvalidEffectException(String message, SourceLocation location) {
        super(message, DiagnosticCode.INVALID_EFFECT, location, Phase.PARSE);
    }
}
