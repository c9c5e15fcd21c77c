package io.statutedsl.core.error;

import io.statutedsl.core.model.Diagnostic;
import java.util.List;

/**
 * Thrown by the strict parse entry points when the source produced at least one error
 * diagnostic. Carries every diagnostic, so callers can still report all problems at once.
 */
public final class DocumentParseException extends DslException {

    private static final long serialVersionUID = 1L;

    private final transient List<Diagnostic> diagnostics;

    public DocumentParseException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics), null, Phase.PARSE);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    static String summarize(List<Diagnostic> diagnostics) {
        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        String first = diagnostics.stream()
                .filter(Diagnostic::isError)
                .findFirst()
                .map(Diagnostic::render)
                .orElse("no errors");
        return errors == 1 ? first : errors + " errors; first: " + first;
    }
}
