package io.statutedsl.core.error;

import io.statutedsl.core.model.Diagnostic;
import java.util.List;

/** Thrown by semantic validation when the analyzed statutes have error diagnostics. */
public final class SemanticException extends DslException {

    private static final long serialVersionUID = 1L;

    private final transient List<Diagnostic> diagnostics;

    public SemanticException(List<Diagnostic> diagnostics) {
        super(DocumentParseException.summarize(diagnostics), firstStatuteId(diagnostics), Phase.ANALYSIS);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    private static String firstStatuteId(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError() && d.statuteId() != null) {
                return d.statuteId();
            }
        }
        return null;
    }
}
