package io.statutedsl.core.parser;

import io.statutedsl.core.error.DslSyntaxException;
import io.statutedsl.core.error.ParseException;
import io.statutedsl.core.error.UnexpectedEofException;
import io.statutedsl.core.model.Token;
import io.statutedsl.core.model.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Forward cursor over a token list. {@link TokenKind#ERROR} tokens are dropped on construction:
 * the lexer has already reported them.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int index;

    public TokenCursor(List<Token> tokens) {
        List<Token> kept = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (!token.is(TokenKind.ERROR)) {
                kept.add(token);
            }
        }
        if (kept.isEmpty() || !kept.get(kept.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = kept;
    }

    public Token peek() {
        return tokens.get(index);
    }

    /** Looks {@code ahead} tokens past the current one, clamped to EOF. */
    public Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    public boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    public boolean atEnd() {
        return check(TokenKind.EOF);
    }

    /** Consumes and returns the current token; EOF is never consumed. */
    public Token advance() {
        Token current = peek();
        if (!current.is(TokenKind.EOF)) {
            index++;
        }
        return current;
    }

    /** Consumes the current token if it has the given kind. */
    public boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes a token of the given kind or fails.
     *
     * @param what description of the expected token for the error message
     * @throws UnexpectedEofException at end of input
     * @throws ParseException         on any other token
     */
    public Token expect(TokenKind kind, String what) {
        if (check(kind)) {
            return advance();
        }
        throw unexpected(what);
    }

    /** Builds the error for an unexpected current token, without consuming it. */
    public DslSyntaxException unexpected(String what) {
        return unexpected(what, null);
    }

    /** As {@link #unexpected(String)}, with a "did you mean" suggestion. */
    public DslSyntaxException unexpected(String what, String suggestion) {
        Token found = peek();
        if (found.is(TokenKind.EOF)) {
            return new UnexpectedEofException(what, found.location());
        }
        return new ParseException(what, found.describe(), found.location(), suggestion);
    }

    /** Skips tokens until one of {@code kinds} or EOF is current. */
    public void skipUntil(Set<TokenKind> kinds) {
        while (!atEnd() && !kinds.contains(peek().kind())) {
            index++;
        }
    }

    /** Opaque position for progress checks during recovery. */
    public int mark() {
        return index;
    }
}
