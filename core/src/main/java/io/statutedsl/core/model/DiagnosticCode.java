package io.statutedsl.core.model;

/**
 * Stable diagnostic codes, grouped by the phase that reports them.
 */
public enum DiagnosticCode {

    // ── Lexical ──
    INVALID_CHARACTER(Phase.LEX, Severity.ERROR),
    UNTERMINATED_STRING(Phase.LEX, Severity.ERROR),
    INVALID_ESCAPE(Phase.LEX, Severity.ERROR),
    UNTERMINATED_COMMENT(Phase.LEX, Severity.ERROR),
    INVALID_DATE(Phase.LEX, Severity.ERROR),

    // ── Syntactic ──
    UNEXPECTED_TOKEN(Phase.PARSE, Severity.ERROR),
    UNMATCHED_PAREN(Phase.PARSE, Severity.ERROR),
    UNEXPECTED_EOF(Phase.PARSE, Severity.ERROR),
    INVALID_CONDITION(Phase.PARSE, Severity.ERROR),
    INVALID_EFFECT(Phase.PARSE, Severity.ERROR),
    INVALID_VERSION(Phase.PARSE, Severity.ERROR),

    // ── Semantic ──
    CIRCULAR_DEPENDENCY(Phase.ANALYSIS, Severity.ERROR),
    UNDEFINED_REFERENCE(Phase.ANALYSIS, Severity.ERROR),
    SELF_REFERENCE(Phase.ANALYSIS, Severity.ERROR),
    INVALID_RANGE(Phase.ANALYSIS, Severity.ERROR),
    TYPE_MISMATCH(Phase.ANALYSIS, Severity.ERROR),
    DUPLICATE_ID(Phase.ANALYSIS, Severity.ERROR),
    INVALID_DATE_RANGE(Phase.ANALYSIS, Severity.ERROR),
    CONTRADICTORY_CONDITION(Phase.ANALYSIS, Severity.WARNING),
    UNDEFINED_EXPORT(Phase.ANALYSIS, Severity.ERROR),
    AMENDMENT_ORDER(Phase.ANALYSIS, Severity.WARNING);

    /** Pipeline phase reporting a code. */
    public enum Phase {
        LEX,
        PARSE,
        ANALYSIS
    }

    private final Phase phase;
    private final Severity defaultSeverity;

    DiagnosticCode(Phase phase, Severity defaultSeverity) {
        this.phase = phase;
        this.defaultSeverity = defaultSeverity;
    }

    public Phase phase() {
        return phase;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
