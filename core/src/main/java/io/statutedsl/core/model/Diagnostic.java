package io.statutedsl.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * A problem found while lexing, parsing or analyzing DSL source. Diagnostics are collected into
 * lists so that every problem can be shown in one pass.
 *
 * @param code       stable code
 * @param severity   error or warning
 * @param message    human-readable message
 * @param location   source position, or {@code null} for semantic diagnostics on ASTs without one
 * @param statuteId  statute the diagnostic concerns, or {@code null}
 * @param suggestion "did you mean" replacement, or {@code null}
 * @param relatedIds other statute ids involved (e.g. the members of a cycle, in path order)
 */
public record Diagnostic(
        DiagnosticCode code,
        Severity severity,
        String message,
        SourceLocation location,
        String statuteId,
        String suggestion,
        List<String> relatedIds) {

    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        relatedIds = relatedIds != null ? List.copyOf(relatedIds) : List.of();
    }

    /** Diagnostic at a source location with the code's default severity. */
    public static Diagnostic at(DiagnosticCode code, String message, SourceLocation location) {
        return new Diagnostic(code, code.defaultSeverity(), message, location, null, null, List.of());
    }

    /** Diagnostic about a statute with the code's default severity. */
    public static Diagnostic forStatute(DiagnosticCode code, String message, String statuteId) {
        return new Diagnostic(code, code.defaultSeverity(), message, null, statuteId, null, List.of());
    }

    public Diagnostic withSuggestion(String suggestion) {
        return new Diagnostic(code, severity, message, location, statuteId, suggestion, relatedIds);
    }

    public Diagnostic withStatuteId(String statuteId) {
        return new Diagnostic(code, severity, message, location, statuteId, suggestion, relatedIds);
    }

    public Diagnostic withLocation(SourceLocation location) {
        return new Diagnostic(code, severity, message, location, statuteId, suggestion, relatedIds);
    }

    public Diagnostic withRelatedIds(List<String> relatedIds) {
        return new Diagnostic(code, severity, message, location, statuteId, suggestion, relatedIds);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** One-line rendering, e.g. {@code error[UNDEFINED_REFERENCE] 3:5: ... (did you mean 'x'?)}. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity == Severity.ERROR ? "error" : "warning");
        sb.append('[').append(code).append(']');
        if (location != null) {
            sb.append(' ').append(location);
        }
        sb.append(": ").append(message);
        if (suggestion != null) {
            sb.append(" (did you mean '").append(suggestion).append("'?)");
        }
        return sb.toString();
    }

    /** Whether any diagnostic in the list is an error. */
    public static boolean hasErrors(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                return true;
            }
        }
        return false;
    }
}
