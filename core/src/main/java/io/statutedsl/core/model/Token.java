package io.statutedsl.core.model;

import java.util.Objects;

/**
 * A lexical token.
 *
 * <p>{@code text} is the decoded value for literals (string contents without quotes and with
 * escapes resolved), the operator symbol for {@link TokenKind#OPERATOR}, and the raw source
 * spelling otherwise.
 *
 * @param kind     the token kind
 * @param text     token text as described above
 * @param location position of the first character of the token
 */
public record Token(TokenKind kind, String text, SourceLocation location) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /** Human-readable rendering for diagnostics ("'WHEN'", "identifier 'age'", "end of input"). */
    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case IDENTIFIER -> "identifier '" + text + "'";
            case STRING -> "string \"" + text + "\"";
            case INTEGER -> "number " + text;
            case DATE -> "date " + text;
            case ERROR -> "invalid input '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
