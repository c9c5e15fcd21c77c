package io.statutedsl.core.error;

/**
 * Abstract base for all statute DSL exceptions. Never thrown directly: use the concrete
 * subclasses under {@link DslSyntaxException}, or {@link DocumentParseException},
 * {@link SemanticException} and {@link ConfigLoadException}.
 */
public abstract class DslException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LEX,
        PARSE,
        ANALYSIS,
        CONFIG
    }

    private final String statuteId;
    private final Phase phase;

    protected DslException(String message, String statuteId, Phase phase) {
        super(message);
        this.statuteId = statuteId;
        this.phase = phase;
    }

    protected DslException(String message, Throwable cause, String statuteId, Phase phase) {
        super(message, cause);
        this.statuteId = statuteId;
        this.phase = phase;
    }

    /** The statute that triggered the error, or {@code null} if not yet identified. */
    public String statuteId() {
        return statuteId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
