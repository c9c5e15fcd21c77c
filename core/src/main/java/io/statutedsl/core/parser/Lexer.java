package io.statutedsl.core.parser;

import io.statutedsl.core.error.LexException;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.LexResult;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Token;
import io.statutedsl.core.model.TokenKind;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts DSL source text into tokens.
 *
 * <p>Lexing never aborts. Malformed input produces a diagnostic and, where no token can be
 * salvaged, an {@link TokenKind#ERROR} token so that the parser can carry on:
 *
 * <ul>
 *   <li>runs of invalid characters become one {@code ERROR} token;</li>
 *   <li>an unterminated string ends at the end of its line and is still emitted as a string;</li>
 *   <li>an unknown escape keeps the escaped character literally;</li>
 *   <li>a {@code YYYY-MM-DD} literal that is not a calendar date becomes an {@code ERROR} token;</li>
 *   <li>an unterminated block comment swallows the rest of the input.</li>
 * </ul>
 *
 * <p>Block comments nest. The token list always ends with {@link TokenKind#EOF}.
 *
 * <p>Instances are immutable and thread-safe; each {@link #tokenize} call keeps its state in a
 * private scanner.
 */
public final class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final boolean caseInsensitiveKeywords;

    public Lexer() {
        this(false);
    }

    /** @param caseInsensitiveKeywords whether {@code when} lexes as {@code WHEN} */
    public Lexer(boolean caseInsensitiveKeywords) {
        this.caseInsensitiveKeywords = caseInsensitiveKeywords;
    }

    public boolean caseInsensitiveKeywords() {
        return caseInsensitiveKeywords;
    }

    /** Tokenizes {@code source}. Never throws for any input text. */
    public LexResult tokenize(String source) {
        Scanner scanner = new Scanner(source);
        scanner.run();
        LOG.debug("lex.completed tokens={} diagnostics={}", scanner.tokens.size(), scanner.diagnostics.size());
        return new LexResult(scanner.tokens, scanner.diagnostics);
    }

    private final class Scanner {

        private final String src;
        private final List<Token> tokens = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private int pos;
        // UTF-8 length of src[0, pos)
        private int byteOffset;
        private int tokenStart;
        private int line = 1;
        private int column = 1;

        Scanner(String src) {
            this.src = src;
        }

        void run() {
            while (true) {
                skipTrivia();
                if (atEnd()) {
                    break;
                }
                SourceLocation start = location();
                tokenStart = pos;
                try {
                    scanToken(start);
                } catch (LexException e) {
                    diagnostics.add(e.toDiagnostic());
                    tokens.add(new Token(TokenKind.ERROR, src.substring(tokenStart, pos), start));
                }
            }
            tokens.add(new Token(TokenKind.EOF, "", location()));
        }

        private void scanToken(SourceLocation start) {
            char c = peek();
            if (isIdentStart(c)) {
                scanWord(start);
            } else if (isDigit(c)) {
                scanNumberOrDate(start);
            } else if (c == '"') {
                scanString(start);
            } else {
                scanSymbol(start);
            }
        }

        // ── Trivia ──

        private void skipTrivia() {
            while (!atEnd()) {
                char c = peek();
                if (Character.isWhitespace(c)) {
                    advance();
                } else if (c == '/' && peekAt(1) == '/') {
                    while (!atEnd() && peek() != '\n') {
                        advance();
                    }
                } else if (c == '/' && peekAt(1) == '*') {
                    skipBlockComment();
                } else {
                    return;
                }
            }
        }

        private void skipBlockComment() {
            SourceLocation start = location();
            advance();
            advance();
            int depth = 1;
            while (!atEnd()) {
                if (peek() == '/' && peekAt(1) == '*') {
                    advance();
                    advance();
                    depth++;
                } else if (peek() == '*' && peekAt(1) == '/') {
                    advance();
                    advance();
                    if (--depth == 0) {
                        return;
                    }
                } else {
                    advance();
                }
            }
            diagnostics.add(Diagnostic.at(
                    DiagnosticCode.UNTERMINATED_COMMENT, "unterminated block comment opened at " + start, start));
        }

        // ── Words ──

        private void scanWord(SourceLocation start) {
            int from = pos;
            while (!atEnd() && isIdentPart(peek())) {
                advance();
            }
            String text = src.substring(from, pos);
            TokenKind keyword = TokenKind.keyword(text, caseInsensitiveKeywords);
            tokens.add(new Token(keyword != null ? keyword : TokenKind.IDENTIFIER, text, start));
        }

        // ── Numbers and dates ──

        private void scanNumberOrDate(SourceLocation start) {
            if (looksLikeDate()) {
                String text = src.substring(pos, pos + 10);
                for (int i = 0; i < 10; i++) {
                    advance();
                }
                try {
                    LocalDate.parse(text);
                } catch (DateTimeException e) {
                    throw new LexException(
                            "invalid date literal '" + text + "'", DiagnosticCode.INVALID_DATE, start);
                }
                tokens.add(new Token(TokenKind.DATE, text, start));
                return;
            }
            int from = pos;
            while (!atEnd() && isDigit(peek())) {
                advance();
            }
            tokens.add(new Token(TokenKind.INTEGER, src.substring(from, pos), start));
        }

        private boolean looksLikeDate() {
            if (pos + 10 > src.length()) {
                return false;
            }
            for (int i = 0; i < 10; i++) {
                char c = src.charAt(pos + i);
                boolean ok = (i == 4 || i == 7) ? c == '-' : isDigit(c);
                if (!ok) {
                    return false;
                }
            }
            // "2024-01-015" is not a date followed by a digit
            return pos + 10 == src.length() || !isIdentPart(src.charAt(pos + 10));
        }

        // ── Strings ──

        private void scanString(SourceLocation start) {
            advance(); // opening quote
            StringBuilder value = new StringBuilder();
            while (true) {
                if (atEnd() || peek() == '\n') {
                    diagnostics.add(Diagnostic.at(
                            DiagnosticCode.UNTERMINATED_STRING, "unterminated string literal", start));
                    break;
                }
                char c = advance();
                if (c == '"') {
                    break;
                }
                if (c == '\\') {
                    readEscape(value);
                } else {
                    value.append(c);
                }
            }
            tokens.add(new Token(TokenKind.STRING, value.toString(), start));
        }

        private void readEscape(StringBuilder value) {
            SourceLocation at = location();
            if (atEnd()) {
                return;
            }
            char e = advance();
            switch (e) {
                case '"' -> value.append('"');
                case '\\' -> value.append('\\');
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case 'u' -> readUnicodeEscape(value, at);
                default -> {
                    diagnostics.add(Diagnostic.at(
                            DiagnosticCode.INVALID_ESCAPE, "invalid escape sequence '\\" + e + "'", at));
                    value.append(e);
                }
            }
        }

        private void readUnicodeEscape(StringBuilder value, SourceLocation at) {
            int code = 0;
            for (int i = 0; i < 4; i++) {
                int digit = atEnd() ? -1 : Character.digit(peek(), 16);
                if (digit < 0) {
                    diagnostics.add(Diagnostic.at(
                            DiagnosticCode.INVALID_ESCAPE, "\\u must be followed by four hex digits", at));
                    return;
                }
                advance();
                code = code * 16 + digit;
            }
            value.append((char) code);
        }

        // ── Operators and punctuation ──

        private void scanSymbol(SourceLocation start) {
            char c = advance();
            switch (c) {
                case '(' -> add(TokenKind.LEFT_PAREN, "(", start);
                case ')' -> add(TokenKind.RIGHT_PAREN, ")", start);
                case '{' -> add(TokenKind.LEFT_BRACE, "{", start);
                case '}' -> add(TokenKind.RIGHT_BRACE, "}", start);
                case ',' -> add(TokenKind.COMMA, ",", start);
                case ':' -> add(TokenKind.COLON, ":", start);
                case '*' -> add(TokenKind.STAR, "*", start);
                case '>', '<' -> add(TokenKind.OPERATOR, match('=') ? c + "=" : String.valueOf(c), start);
                case '=' -> {
                    if (match('=')) {
                        add(TokenKind.OPERATOR, "==", start);
                    } else {
                        add(TokenKind.ASSIGN, "=", start);
                    }
                }
                case '!' -> {
                    if (!match('=')) {
                        throw new LexException("unexpected character '!'", DiagnosticCode.INVALID_CHARACTER, start);
                    }
                    add(TokenKind.OPERATOR, "!=", start);
                }
                default -> {
                    while (!atEnd() && isInvalidStart(peek())) {
                        advance();
                    }
                    String run = src.substring(tokenStart, pos);
                    String what = run.length() == 1 ? "unexpected character '" : "unexpected characters '";
                    throw new LexException(what + run + "'", DiagnosticCode.INVALID_CHARACTER, start);
                }
            }
        }

        private boolean isInvalidStart(char c) {
            return !Character.isWhitespace(c)
                    && !isIdentStart(c)
                    && !isDigit(c)
                    && "\"(){},:*<>=!/".indexOf(c) < 0;
        }

        private void add(TokenKind kind, String text, SourceLocation start) {
            tokens.add(new Token(kind, text, start));
        }

        // ── Cursor ──

        private boolean atEnd() {
            return pos >= src.length();
        }

        private char peek() {
            return src.charAt(pos);
        }

        private char peekAt(int ahead) {
            int i = pos + ahead;
            return i < src.length() ? src.charAt(i) : '\0';
        }

        private boolean match(char expected) {
            if (!atEnd() && peek() == expected) {
                advance();
                return true;
            }
            return false;
        }

        private char advance() {
            char c = src.charAt(pos++);
            byteOffset += utf8Length(c);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private SourceLocation location() {
            return new SourceLocation(line, column, byteOffset);
        }
    }

    static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    /** A surrogate pair encodes as four bytes, counted on its high half. */
    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        if (Character.isHighSurrogate(c)) {
            return 4;
        }
        return Character.isLowSurrogate(c) ? 0 : 3;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
