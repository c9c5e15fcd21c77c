package io.statutedsl.core.error;

import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/** Input ended while a construct was still open. */
public final class UnexpectedEofException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    private final String expected;

    public UnexpectedEofException(String expected, SourceLocation location) {
        super("unexpected end of input, expected " + expected, DiagnosticCode.UNEXPECTED_EOF, location, Phase.PARSE);
        this.expected = expected;
    }

    public String expected() {
        return expected;
    }
}
