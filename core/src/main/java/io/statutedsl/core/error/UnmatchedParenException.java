package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** A {@code (} without its closing {@code )}. The location is that of the opening paren. */
public final class UnmatchedParenException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    public UnmatchedParenException(SourceLocation openLocation, String found) {
        super(
                "unmatched '(' opened at " + openLocation + ", found " + found,
                DiagnosticCode.UNMATCHED_PAREN,
                openLocation,
                Phase.PARSE);
    }

    public SourceLocation openLocation() {
        return location();
    }
}
