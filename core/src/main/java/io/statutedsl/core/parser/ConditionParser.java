package io.statutedsl.core.parser;

import io.statutedsl.core.error.InvalidConditionException;
import io.statutedsl.core.error.UnmatchedParenException;
import io.statutedsl.core.model.ComparisonOp;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Token;
import io.statutedsl.core.model.TokenKind;
import io.statutedsl.core.model.Value;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for condition expressions.
 *
 * <pre>
 * condition  = or_expr ;
 * or_expr    = and_expr { "OR" and_expr } ;
 * and_expr   = unary { "AND" unary } ;
 * unary      = "NOT" unary | "(" condition ")" | primary ;
 * primary    = comparison | between | in_set | has | like ;
 * </pre>
 *
 * <p>{@code AND}/{@code OR} chains fold left. The {@code AND} of a {@code BETWEEN} belongs to the
 * {@code BETWEEN}. Errors are thrown as {@link io.statutedsl.core.error.DslSyntaxException}s; the
 * caller decides how to recover. A tree deeper than {@link #MAX_DEPTH}, counting {@code NOT},
 * parentheses and folded chains, is rejected with an {@link InvalidConditionException}.
 */
public final class ConditionParser {

    /** Fields recognised case-insensitively and normalised to lower case. */
    public static final Set<String> BUILT_IN_FIELDS = Set.of("age", "income");

    private static final List<String> CONDITION_KEYWORDS = List.of("BETWEEN", "IN", "LIKE");

    /** Deepest condition tree accepted; deeper input is reported instead of parsed. */
    public static final int MAX_DEPTH = 256;

    private final TokenCursor cursor;
    private final int suggestionDistance;

    // open NOT and paren levels on the parser's own stack
    private int nesting;
    // tree depth of the node most recently returned by parseUnary, parseAnd or parseOr
    private int depth;

    public ConditionParser(TokenCursor cursor, int suggestionDistance) {
        this.cursor = cursor;
        this.suggestionDistance = suggestionDistance;
    }

    public ConditionNode parseCondition() {
        nesting = 0;
        return parseOr();
    }

    private ConditionNode parseOr() {
        ConditionNode left = parseAnd();
        int leftDepth = depth;
        while (cursor.check(TokenKind.OR)) {
            SourceLocation at = cursor.advance().location();
            ConditionNode right = parseAnd();
            leftDepth = folded(leftDepth, depth, at);
            left = new ConditionNode.Or(left, right);
        }
        depth = leftDepth;
        return left;
    }

    private ConditionNode parseAnd() {
        ConditionNode left = parseUnary();
        int leftDepth = depth;
        while (cursor.check(TokenKind.AND)) {
            SourceLocation at = cursor.advance().location();
            ConditionNode right = parseUnary();
            leftDepth = folded(leftDepth, depth, at);
            left = new ConditionNode.And(left, right);
        }
        depth = leftDepth;
        return left;
    }

    private ConditionNode parseUnary() {
        if (cursor.check(TokenKind.NOT)) {
            SourceLocation at = cursor.advance().location();
            enter(at);
            try {
                ConditionNode inner = parseUnary();
                depth = folded(depth, 0, at);
                return new ConditionNode.Not(inner);
            } finally {
                nesting--;
            }
        }
        if (cursor.check(TokenKind.LEFT_PAREN)) {
            SourceLocation open = cursor.advance().location();
            enter(open);
            try {
                ConditionNode inner = parseOr();
                if (!cursor.match(TokenKind.RIGHT_PAREN)) {
                    throw new UnmatchedParenException(open, cursor.peek().describe());
                }
                return inner;
            } finally {
                nesting--;
            }
        }
        ConditionNode primary = parsePrimary();
        depth = 1;
        return primary;
    }

    private void enter(SourceLocation at) {
        if (++nesting > MAX_DEPTH) {
            throw tooDeep(at);
        }
    }

    private static int folded(int leftDepth, int rightDepth, SourceLocation at) {
        int result = Math.max(leftDepth, rightDepth) + 1;
        if (result > MAX_DEPTH) {
            throw tooDeep(at);
        }
        return result;
    }

    private static InvalidConditionException tooDeep(SourceLocation at) {
        return new InvalidConditionException("condition nested deeper than " + MAX_DEPTH + " levels", at);
    }

    private ConditionNode parsePrimary() {
        if (cursor.match(TokenKind.HAS)) {
            Token key = cursor.expect(TokenKind.IDENTIFIER, "attribute name after HAS");
            return new ConditionNode.HasAttribute(normalizeField(key.text()));
        }
        if (!cursor.check(TokenKind.IDENTIFIER)) {
            throw cursor.unexpected("condition");
        }
        String field = normalizeField(cursor.advance().text());
        Token next = cursor.peek();
        switch (next.kind()) {
            case OPERATOR -> {
                cursor.advance();
                return new ConditionNode.Comparison(field, ComparisonOp.fromSymbol(next.text()), parseValue());
            }
            case BETWEEN -> {
                cursor.advance();
                return parseBetween(field);
            }
            case IN -> {
                cursor.advance();
                return parseInSet(field);
            }
            case LIKE -> {
                cursor.advance();
                Token pattern = cursor.peek();
                if (!pattern.is(TokenKind.STRING)) {
                    if (pattern.is(TokenKind.EOF)) {
                        throw cursor.unexpected("string pattern after LIKE");
                    }
                    throw new InvalidConditionException(
                            "LIKE requires a string pattern, found " + pattern.describe(), pattern.location());
                }
                cursor.advance();
                return new ConditionNode.Like(field, pattern.text());
            }
            default -> {
                String suggestion = next.is(TokenKind.IDENTIFIER)
                        ? Suggestions.closest(next.text(), CONDITION_KEYWORDS, suggestionDistance, true)
                        : null;
                throw cursor.unexpected("comparison operator, BETWEEN, IN or LIKE after '" + field + "'", suggestion);
            }
        }
    }

    private ConditionNode parseBetween(String field) {
        Token minToken = cursor.peek();
        Value min = parseValue();
        cursor.expect(TokenKind.AND, "AND between BETWEEN bounds");
        Token maxToken = cursor.peek();
        Value max = parseValue();
        requireOrdered(min, minToken);
        requireOrdered(max, maxToken);
        return new ConditionNode.Between(field, min, max);
    }

    private void requireOrdered(Value bound, Token token) {
        if (!bound.isOrdered()) {
            throw new InvalidConditionException(
                    "BETWEEN bounds must be numbers or dates, found " + token.describe(), token.location());
        }
    }

    private ConditionNode parseInSet(String field) {
        if (!cursor.check(TokenKind.LEFT_PAREN)) {
            throw cursor.unexpected("'(' after IN");
        }
        SourceLocation open = cursor.advance().location();
        List<Value> values = new ArrayList<>();
        values.add(parseValue());
        while (cursor.match(TokenKind.COMMA)) {
            values.add(parseValue());
        }
        if (!cursor.match(TokenKind.RIGHT_PAREN)) {
            throw new UnmatchedParenException(open, cursor.peek().describe());
        }
        return new ConditionNode.InSet(field, values);
    }

    /**
     * Parses a literal: integer, string, date, {@code true} or {@code false}.
     */
    public Value parseValue() {
        Token token = cursor.peek();
        switch (token.kind()) {
            case INTEGER -> {
                cursor.advance();
                return Value.of(new BigDecimal(token.text()));
            }
            case STRING -> {
                cursor.advance();
                return Value.of(token.text());
            }
            case DATE -> {
                cursor.advance();
                return Value.of(LocalDate.parse(token.text()));
            }
            case IDENTIFIER -> {
                String lower = token.text().toLowerCase(Locale.ROOT);
                if ("true".equals(lower) || "false".equals(lower)) {
                    cursor.advance();
                    return Value.of("true".equals(lower));
                }
                throw cursor.unexpected("value (number, string, date, true or false)");
            }
            default -> throw cursor.unexpected("value (number, string, date, true or false)");
        }
    }

    /** Lower-cases built-in field names; other attribute keys keep their spelling. */
    public static String normalizeField(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return BUILT_IN_FIELDS.contains(lower) ? lower : name;
    }
}
