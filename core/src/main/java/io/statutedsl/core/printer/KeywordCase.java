package io.statutedsl.core.printer;

import java.util.Locale;

/** Casing applied to keywords by the printer. */
public enum KeywordCase {
    UPPER,
    LOWER;

    String apply(String keyword) {
        return this == UPPER ? keyword.toUpperCase(Locale.ROOT) : keyword.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code upper} / {@code lower} in any casing.
     *
     * @throws IllegalArgumentException for any other text
     */
    public static KeywordCase parse(String text) {
        for (KeywordCase c : values()) {
            if (c.name().equalsIgnoreCase(text.trim())) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown keyword case: '" + text + "' (expected 'upper' or 'lower')");
    }
}
