package io.statutedsl.core.error;

import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.SourceLocation;

/**
 * Abstract parent for lexical and syntactic errors at a known source location. The lexer and
 * parsers throw these internally to unwind to a recovery point, where they are converted into
 * {@link Diagnostic}s with {@link #toDiagnostic()}.
 */
public abstract class DslSyntaxException extends DslException {

    private static final long serialVersionUID = 1L;

    private final DiagnosticCode code;
    private final SourceLocation location;

    protected DslSyntaxException(String message, DiagnosticCode code, SourceLocation location, Phase phase) {
        super(message, null, phase);
        this.code = code;
        this.location = location;
    }

    /** Diagnostic code this error reports as. */
    public DiagnosticCode code() {
        return code;
    }

    /** Where the error was detected. */
    public SourceLocation location() {
        return location;
    }

    /** Converts the error into a diagnostic; subclasses add suggestions where they have one. */
    public Diagnostic toDiagnostic() {
        return Diagnostic.at(code, getMessage(), location);
    }
}
