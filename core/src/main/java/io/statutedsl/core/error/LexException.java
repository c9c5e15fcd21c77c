package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** Invalid character, bad escape, unterminated string or comment, or malformed date literal. */
public final class LexException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    public LexException(String message, DiagnosticCode code, SourceLocation location) {
        super(message, code, location, Phase.LEX);
    }
}
