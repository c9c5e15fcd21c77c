package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** A {@code VERSION} below 1 or too large to represent. */
public final class InvalidVersionException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    public InvalidVersionException(String message, SourceLocation location) {
        super(message, DiagnosticCode.INVALID_VERSION, location, Phase.PARSE);
    }
}
