package io.statutedsl.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.LexResult;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Token;
import io.statutedsl.core.model.TokenKind;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Lexer")
class LexerTest {

    private final Lexer lexer = new Lexer();

    private static List<TokenKind> kinds(LexResult result) {
        return result.tokens().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        @DisplayName("statute header → keyword, identifier, punctuation, string")
        void statuteHeader() {
            LexResult result = lexer.tokenize("STATUTE adult-rights: \"Adult Rights Act\" {");

            assertThat(kinds(result))
                    .containsExactly(
                            TokenKind.STATUTE,
                            TokenKind.IDENTIFIER,
                            TokenKind.COLON,
                            TokenKind.STRING,
                            TokenKind.LEFT_BRACE,
                            TokenKind.EOF);
            assertThat(result.tokens().get(1).text()).isEqualTo("adult-rights");
            assertThat(result.tokens().get(3).text()).isEqualTo("Adult Rights Act");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("comparison operators and assignment")
        void operators() {
            LexResult result = lexer.tokenize("> >= < <= == != =");

            assertThat(result.tokens())
                    .extracting(Token::text)
                    .containsExactly(">", ">=", "<", "<=", "==", "!=", "=", "");
            assertThat(kinds(result).subList(0, 6)).containsOnly(TokenKind.OPERATOR);
            assertThat(result.tokens().get(6).kind()).isEqualTo(TokenKind.ASSIGN);
        }

        @Test
        @DisplayName("dates are distinct from integers")
        void datesAndIntegers() {
            LexResult result = lexer.tokenize("2024-01-15 18");

            assertThat(kinds(result)).containsExactly(TokenKind.DATE, TokenKind.INTEGER, TokenKind.EOF);
            assertThat(result.tokens().get(0).text()).isEqualTo("2024-01-15");
        }

        @Test
        @DisplayName("identifiers may contain dashes, dots and underscores")
        void identifiers() {
            LexResult result = lexer.tokenize("us.ca.tax adult-rights _x1");

            assertThat(kinds(result))
                    .containsExactly(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF);
        }

        @Test
        @DisplayName("locations are 1-based line/column with a 0-based offset")
        void locations() {
            LexResult result = lexer.tokenize("WHEN\n  AGE");

            assertThat(result.tokens().get(0).location()).isEqualTo(SourceLocation.START);
            assertThat(result.tokens().get(1).location()).isEqualTo(new SourceLocation(2, 3, 7));
        }

        @Test
        @DisplayName("offsets count UTF-8 bytes while columns count characters")
        void utf8Offsets() {
            LexResult result = lexer.tokenize("\"\u00e9\" age \"\uD83D\uDE00\" x");

            assertThat(result.tokens().get(1).text()).isEqualTo("age");
            assertThat(result.tokens().get(1).location()).isEqualTo(new SourceLocation(1, 5, 5));
            assertThat(result.tokens().get(3).text()).isEqualTo("x");
            assertThat(result.tokens().get(3).location()).isEqualTo(new SourceLocation(1, 14, 16));
        }

        @Test
        @DisplayName("invalid characters after multi-byte text keep their own text")
        void invalidAfterMultiByte() {
            LexResult result = lexer.tokenize("\"\u00e9\u00e9\" @# age");

            assertThat(result.tokens().get(1).kind()).isEqualTo(TokenKind.ERROR);
            assertThat(result.tokens().get(1).text()).isEqualTo("@#");
            assertThat(result.diagnostics().get(0).location()).isEqualTo(new SourceLocation(1, 6, 7));
        }

        @Test
        @DisplayName("keywords are case-sensitive by default")
        void caseSensitiveKeywords() {
            assertThat(kinds(lexer.tokenize("when"))).containsExactly(TokenKind.IDENTIFIER, TokenKind.EOF);
            assertThat(kinds(new Lexer(true).tokenize("when Then")))
                    .containsExactly(TokenKind.WHEN, TokenKind.THEN, TokenKind.EOF);
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("line comments and nested block comments are skipped")
        void skipped() {
            LexResult result = lexer.tokenize("// heading\nWHEN /* a /* b */ c */ THEN");

            assertThat(kinds(result)).containsExactly(TokenKind.WHEN, TokenKind.THEN, TokenKind.EOF);
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("unterminated block comment → diagnostic at the opening")
        void unterminated() {
            LexResult result = lexer.tokenize("WHEN /* open /* nested */");

            assertThat(kinds(result)).containsExactly(TokenKind.WHEN, TokenKind.EOF);
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.code()).isEqualTo(DiagnosticCode.UNTERMINATED_COMMENT);
                        assertThat(d.location()).isEqualTo(new SourceLocation(1, 6, 5));
                    });
        }
    }

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        @DisplayName("escape sequences are decoded")
        void escapes() {
            LexResult result = lexer.tokenize("\"a\\\"b\\n\\t\\\\\\u0041\"");

            assertThat(result.tokens().get(0).text()).isEqualTo("a\"b\n\t\\A");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("unknown escape keeps the character and reports INVALID_ESCAPE")
        void invalidEscape() {
            LexResult result = lexer.tokenize("\"a\\qb\"");

            assertThat(result.tokens().get(0).kind()).isEqualTo(TokenKind.STRING);
            assertThat(result.tokens().get(0).text()).isEqualTo("aqb");
            assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.INVALID_ESCAPE);
        }

        @Test
        @DisplayName("unterminated string ends at the line break")
        void unterminated() {
            LexResult result = lexer.tokenize("\"abc\nWHEN");

            assertThat(kinds(result)).containsExactly(TokenKind.STRING, TokenKind.WHEN, TokenKind.EOF);
            assertThat(result.tokens().get(0).text()).isEqualTo("abc");
            assertThat(result.diagnostics())
                    .extracting(Diagnostic::code)
                    .containsExactly(DiagnosticCode.UNTERMINATED_STRING);
        }
    }

    @Nested
    @DisplayName("Error tolerance")
    class ErrorTolerance {

        @Test
        @DisplayName("run of invalid characters → one ERROR token and one diagnostic")
        void invalidCharacters() {
            LexResult result = lexer.tokenize("AGE @# 18");

            assertThat(kinds(result))
                    .containsExactly(TokenKind.IDENTIFIER, TokenKind.ERROR, TokenKind.INTEGER, TokenKind.EOF);
            assertThat(result.tokens().get(1).text()).isEqualTo("@#");
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.code()).isEqualTo(DiagnosticCode.INVALID_CHARACTER);
                        assertThat(d.location()).isEqualTo(new SourceLocation(1, 5, 4));
                    });
        }

        @Test
        @DisplayName("lone '!' is an invalid character")
        void loneBang() {
            LexResult result = lexer.tokenize("a ! b");

            assertThat(kinds(result))
                    .containsExactly(TokenKind.IDENTIFIER, TokenKind.ERROR, TokenKind.IDENTIFIER, TokenKind.EOF);
            assertThat(result.hasErrors()).isTrue();
        }

        @Test
        @DisplayName("impossible calendar date → ERROR token with INVALID_DATE")
        void invalidDate() {
            LexResult result = lexer.tokenize("2024-02-30");

            assertThat(kinds(result)).containsExactly(TokenKind.ERROR, TokenKind.EOF);
            assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.INVALID_DATE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "\"", "/*", "\\", "@@@", "\"\\u12", "2024-13-01-", "}{)(", "STATUTE \u0000"})
        @DisplayName("never throws and always ends with EOF")
        void total(String source) {
            assertThatCode(() -> lexer.tokenize(source)).doesNotThrowAnyException();
            List<Token> tokens = lexer.tokenize(source).tokens();
            assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
        }
    }
}
