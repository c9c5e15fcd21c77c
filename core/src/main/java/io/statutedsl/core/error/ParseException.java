package io.statutedsl.core.error;

import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/**
 * A token other than the expected one. Carries what was expected, what was found and, when
 * the found text is close to a keyword, a "did you mean" suggestion.
 */
public final class ParseException extends DslSyntaxException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;
    private final String suggestion;

    public ParseException(String expected, String found, SourceLocation location, String suggestion) {
        super("expected " + expected + ", found " + found, DiagnosticCode.UNEXPECTED_TOKEN, location, Phase.PARSE);
        this.expected = expected;
        this.found = found;
        this.suggestion = suggestion;
    }

    public ParseException(String expected, String found, SourceLocation location) {
        this(expected, found, location, null);
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    /** Suggested replacement, or {@code null}. */
    public String suggestion() {
        return suggestion;
    }

    @Override
    public Diagnostic toDiagnostic() {
        Diagnostic diagnostic = super.toDiagnostic();
        return suggestion != null ? diagnostic.withSuggestion(suggestion) : diagnostic;
    }
}
