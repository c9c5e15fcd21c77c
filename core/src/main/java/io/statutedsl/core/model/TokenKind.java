package io.statutedsl.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Kinds of lexical tokens. Keyword kinds are spelled exactly as their source text.
 */
public enum TokenKind {

    // ── Keywords ──
    STATUTE,
    WHEN,
    UNLESS,
    THEN,
    AND,
    OR,
    NOT,
    HAS,
    BETWEEN,
    IN,
    LIKE,
    DISCRETION,
    EXCEPTION,
    DEFAULT,
    REQUIRES,
    SUPERSEDES,
    AMENDMENT,
    IMPORT,
    EXPORT,
    NAMESPACE,
    PUBLIC,
    PRIVATE,
    AS,
    FROM,
    GRANT,
    REVOKE,
    OBLIGATION,
    PROHIBITION,
    JURISDICTION,
    VERSION,
    EFFECTIVE_DATE,
    EXPIRY_DATE,

    // ── Literals ──
    IDENTIFIER,
    STRING,
    INTEGER,
    DATE,
    OPERATOR,

    // ── Punctuation ──
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    COLON,
    ASSIGN,
    STAR,

    // ── Synthetic ──
    ERROR,
    EOF;

    private static final Set<TokenKind> KEYWORDS = EnumSet.range(STATUTE, EXPIRY_DATE);

    private static final Map<String, TokenKind> BY_SPELLING;

    static {
        Map<String, TokenKind> spellings = new HashMap<>();
        for (TokenKind kind : KEYWORDS) {
            spellings.put(kind.name(), kind);
        }
        BY_SPELLING = Collections.unmodifiableMap(spellings);
    }

    /** Returns {@code true} for reserved words. */
    public boolean isKeyword() {
        return KEYWORDS.contains(this);
    }

    /** Returns {@code true} for the keywords that open a statute clause. */
    public boolean isClauseKeyword() {
        return switch (this) {
            case JURISDICTION, VERSION, EFFECTIVE_DATE, EXPIRY_DATE, WHEN, UNLESS, THEN, DISCRETION,
                    EXCEPTION, DEFAULT, REQUIRES, SUPERSEDES, AMENDMENT -> true;
            default -> false;
        };
    }

    /**
     * Looks up a keyword by its spelling.
     *
     * @param word            the identifier text
     * @param caseInsensitive whether {@code when} should match {@code WHEN}
     * @return the keyword kind, or {@code null} if the word is not reserved
     */
    public static TokenKind keyword(String word, boolean caseInsensitive) {
        String key = caseInsensitive ? word.toUpperCase(Locale.ROOT) : word;
        return BY_SPELLING.get(key);
    }
}
