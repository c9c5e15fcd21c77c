package io.statutedsl.core.config;

import io.statutedsl.core.engine.EvaluationOptions;
import io.statutedsl.core.printer.KeywordCase;
import io.statutedsl.core.printer.PrinterConfig;
import java.util.Objects;

/**
 * Settings for the DSL pipeline, grouped by stage. Built via {@link #builder()}, or loaded from
 * YAML by {@link ConfigLoader}.
 *
 * @param caseInsensitiveKeywords lexer: accept {@code when} as {@code WHEN}
 * @param indentWidth             printer: spaces per indentation level
 * @param keywordCase             printer: keyword casing
 * @param includeComments         printer: emit comment headers
 * @param suggestionDistance      analyzer and parser: maximum edit distance for "did you mean"
 * @param reportContradictions    analyzer: warn about contradictory conjunctions
 * @param globCaseSensitive       evaluator: case-sensitive {@code LIKE} matching
 */
public record DslConfig(
        boolean caseInsensitiveKeywords,
        int indentWidth,
        KeywordCase keywordCase,
        boolean includeComments,
        int suggestionDistance,
        boolean reportContradictions,
        boolean globCaseSensitive) {

    public static final DslConfig DEFAULT = builder().build();

    public DslConfig {
        Objects.requireNonNull(keywordCase, "keywordCase must not be null");
        if (suggestionDistance < 0) {
            throw new IllegalArgumentException("suggestionDistance must not be negative, got: " + suggestionDistance);
        }
        if (indentWidth < 0 || indentWidth > 16) {
            throw new IllegalArgumentException("indentWidth must be between 0 and 16, got: " + indentWidth);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Printer settings as a {@link PrinterConfig}. */
    public PrinterConfig printerConfig() {
        return new PrinterConfig(indentWidth, keywordCase, includeComments);
    }

    /** Evaluator settings as {@link EvaluationOptions} without an as-of date. */
    public EvaluationOptions evaluationOptions() {
        return new EvaluationOptions(null, globCaseSensitive);
    }

    /** Builder for {@link DslConfig}. Every field has a default. */
    public static final class Builder {

        private boolean caseInsensitiveKeywords = false;
        private int indentWidth = 4;
        private KeywordCase keywordCase = KeywordCase.UPPER;
        private boolean includeComments = false;
        private int suggestionDistance = 2;
        private boolean reportContradictions = true;
        private boolean globCaseSensitive = true;

        Builder() {}

        public Builder caseInsensitiveKeywords(boolean caseInsensitiveKeywords) {
            this.caseInsensitiveKeywords = caseInsensitiveKeywords;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder keywordCase(KeywordCase keywordCase) {
            this.keywordCase = keywordCase;
            return this;
        }

        public Builder includeComments(boolean includeComments) {
            this.includeComments = includeComments;
            return this;
        }

        public Builder suggestionDistance(int suggestionDistance) {
            this.suggestionDistance = suggestionDistance;
            return this;
        }

        public Builder reportContradictions(boolean reportContradictions) {
            this.reportContradictions = reportContradictions;
            return this;
        }

        public Builder globCaseSensitive(boolean globCaseSensitive) {
            this.globCaseSensitive = globCaseSensitive;
            return this;
        }

        public DslConfig build() {
            return new DslConfig(
                    caseInsensitiveKeywords,
                    indentWidth,
                    keywordCase,
                    includeComments,
                    suggestionDistance,
                    reportContradictions,
                    globCaseSensitive);
        }
    }
}
