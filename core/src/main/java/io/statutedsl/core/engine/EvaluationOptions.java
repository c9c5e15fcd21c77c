package io.statutedsl.core.engine;

import java.time.LocalDate;

/**
 * Per-call evaluation options.
 *
 * @param asOf              date the statute must be in force on, or {@code null} to skip the check
 * @param globCaseSensitive whether {@code LIKE} patterns match case-sensitively
 */
public record EvaluationOptions(LocalDate asOf, boolean globCaseSensitive) {

    public static final EvaluationOptions DEFAULT = new EvaluationOptions(null, true);

    public static EvaluationOptions asOf(LocalDate date) {
        return new EvaluationOptions(date, true);
    }

    public EvaluationOptions withAsOf(LocalDate date) {
        return new EvaluationOptions(date, globCaseSensitive);
    }

    public EvaluationOptions withGlobCaseSensitive(boolean caseSensitive) {
        return new EvaluationOptions(asOf, caseSensitive);
    }
}
