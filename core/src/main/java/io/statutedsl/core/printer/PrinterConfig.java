package io.statutedsl.core.printer;

import java.util.Objects;

/**
 * Formatting options for {@link DslPrinter}.
 *
 * <p>Lower-case keywords only re-parse with a lexer configured for case-insensitive keywords.
 *
 * @param indentWidth     spaces per indentation level (0..16)
 * @param keywordCase     keyword casing
 * @param includeComments whether to emit a comment header with the title and jurisdiction
 */
public record PrinterConfig(int indentWidth, KeywordCase keywordCase, boolean includeComments) {

    public static final PrinterConfig DEFAULT = new PrinterConfig(4, KeywordCase.UPPER, false);

    public PrinterConfig {
        if (indentWidth < 0 || indentWidth > 16) {
            throw new IllegalArgumentException("indentWidth must be between 0 and 16, got: " + indentWidth);
        }
        Objects.requireNonNull(keywordCase, "keywordCase must not be null");
    }

    /** Two-space indentation without comments. */
    public static PrinterConfig compact() {
        return new PrinterConfig(2, KeywordCase.UPPER, false);
    }

    /** Default indentation with comment headers. */
    public static PrinterConfig verbose() {
        return new PrinterConfig(4, KeywordCase.UPPER, true);
    }

    public PrinterConfig withIndentWidth(int indentWidth) {
        return new PrinterConfig(indentWidth, keywordCase, includeComments);
    }

    public PrinterConfig withKeywordCase(KeywordCase keywordCase) {
        return new PrinterConfig(indentWidth, keywordCase, includeComments);
    }

    public PrinterConfig withComments(boolean includeComments) {
        return new PrinterConfig(indentWidth, keywordCase, includeComments);
    }
}
