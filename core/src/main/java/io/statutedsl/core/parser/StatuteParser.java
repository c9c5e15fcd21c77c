package io.statutedsl.core.parser;

import io.statutedsl.core.config.DslConfig;
import io.statutedsl.core.error.DocumentParseException;
import io.statutedsl.core.error.DslSyntaxException;
import io.statutedsl.core.error.InvalidEffectException;
import io.statutedsl.core.error.InvalidVersionException;
import io.statutedsl.core.model.AmendmentRecord;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.EffectNode;
import io.statutedsl.core.model.EffectType;
import io.statutedsl.core.model.ExceptionClause;
import io.statutedsl.core.model.ImportDecl;
import io.statutedsl.core.model.LexResult;
import io.statutedsl.core.model.ParseResult;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.model.Token;
import io.statutedsl.core.model.TokenKind;
import io.statutedsl.core.model.Value;
import io.statutedsl.core.model.Visibility;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses statutes and whole documents.
 *
 * <p>{@link #parse(String)} is lenient: it never throws, collects every lexical and syntactic
 * diagnostic, and returns the statutes that parsed cleanly. A malformed statute is dropped and
 * parsing resumes at the next {@code STATUTE}, {@code PUBLIC}, {@code PRIVATE} or
 * {@code EXPORT} keyword. {@link #parseDocument(String)} and {@link #parseStatute(String)} are
 * strict and throw {@link DocumentParseException} when any error was found.
 *
 * <p>Thread-safe: every call uses its own cursor.
 */
public final class StatuteParser {

    private static final Logger LOG = LoggerFactory.getLogger(StatuteParser.class);

    private static final Set<TokenKind> RECOVERY_POINTS =
            EnumSet.of(TokenKind.STATUTE, TokenKind.PUBLIC, TokenKind.PRIVATE, TokenKind.EXPORT);

    // Suggestion candidates are lists: on equal distance the earlier keyword wins.
    private static final List<String> TOP_LEVEL_KEYWORDS = List.of("STATUTE", "PUBLIC", "PRIVATE", "EXPORT");

    private static final List<String> CLAUSE_KEYWORDS = EnumSet.allOf(TokenKind.class).stream()
            .filter(TokenKind::isClauseKeyword)
            .map(TokenKind::name)
            .collect(Collectors.toUnmodifiableList());

    private static final List<String> EFFECT_KEYWORDS = List.of("GRANT", "REVOKE", "OBLIGATION", "PROHIBITION");

    private final Lexer lexer;
    private final int suggestionDistance;

    public StatuteParser() {
        this(DslConfig.DEFAULT);
    }

    public StatuteParser(DslConfig config) {
        this.lexer = new Lexer(config.caseInsensitiveKeywords());
        this.suggestionDistance = config.suggestionDistance();
    }

    /** Lenient document parse. Never throws for any input text. */
    public ParseResult parse(String source) {
        LexResult lexed = lexer.tokenize(source);
        Session session = new Session(new TokenCursor(lexed.tokens()), lexed.diagnostics());
        Document document = session.document();
        LOG.debug(
                "parse.completed statutes={} diagnostics={}",
                document.statutes().size(),
                session.diagnostics.size());
        return new ParseResult(document, session.diagnostics, session.locations);
    }

    /**
     * Strict document parse.
     *
     * @throws DocumentParseException if any error diagnostic was produced
     */
    public Document parseDocument(String source) {
        ParseResult result = parse(source);
        if (result.hasErrors()) {
            throw new DocumentParseException(result.diagnostics());
        }
        return result.document();
    }

    /**
     * Strict parse of exactly one statute, optionally preceded by {@code PUBLIC} or
     * {@code PRIVATE}.
     *
     * @throws DocumentParseException if any error diagnostic was produced
     */
    public Statute parseStatute(String source) {
        LexResult lexed = lexer.tokenize(source);
        Session session = new Session(new TokenCursor(lexed.tokens()), lexed.diagnostics());
        Statute statute = null;
        try {
            statute = session.topLevelStatute();
            session.cursor.expect(TokenKind.EOF, "end of input after statute");
        } catch (DslSyntaxException e) {
            session.record(e, statute != null ? statute.id() : session.currentStatuteId);
        }
        if (statute == null || Diagnostic.hasErrors(session.diagnostics)) {
            throw new DocumentParseException(session.diagnostics);
        }
        LOG.debug("parse.statute statute_id={}", statute.id());
        return statute;
    }

    /** Mutable state of one parse call. */
    private final class Session {

        private final TokenCursor cursor;
        private final ConditionParser conditions;
        private final List<Diagnostic> diagnostics;
        private final Map<String, SourceLocation> locations = new LinkedHashMap<>();
        private String currentStatuteId;

        Session(TokenCursor cursor, List<Diagnostic> lexDiagnostics) {
            this.cursor = cursor;
            this.conditions = new ConditionParser(cursor, suggestionDistance);
            this.diagnostics = new ArrayList<>(lexDiagnostics);
        }

        // ── Document ──

        Document document() {
            List<ImportDecl> imports = new ArrayList<>();
            String namespace = null;
            List<Statute> statutes = new ArrayList<>();
            List<String> exports = new ArrayList<>();

            while (cursor.check(TokenKind.IMPORT)) {
                int start = cursor.mark();
                try {
                    imports.add(importDecl());
                } catch (DslSyntaxException e) {
                    record(e, null);
                    recover(start, EnumSet.of(
                            TokenKind.IMPORT, TokenKind.NAMESPACE, TokenKind.STATUTE, TokenKind.PUBLIC,
                            TokenKind.PRIVATE, TokenKind.EXPORT));
                }
            }
            if (cursor.check(TokenKind.NAMESPACE)) {
                int start = cursor.mark();
                try {
                    cursor.advance();
                    namespace = cursor.expect(TokenKind.IDENTIFIER, "namespace name").text();
                } catch (DslSyntaxException e) {
                    record(e, null);
                    recover(start, RECOVERY_POINTS);
                }
            }
            while (!cursor.atEnd()) {
                int start = cursor.mark();
                currentStatuteId = null;
                try {
                    if (cursor.check(TokenKind.EXPORT)) {
                        cursor.advance();
                        exports.addAll(identifierList("exported statute id"));
                    } else if (cursor.check(TokenKind.STATUTE)
                            || cursor.check(TokenKind.PUBLIC)
                            || cursor.check(TokenKind.PRIVATE)) {
                        statutes.add(topLevelStatute());
                    } else {
                        Token found = cursor.peek();
                        String suggestion = found.is(TokenKind.IDENTIFIER)
                                ? Suggestions.closest(found.text(), TOP_LEVEL_KEYWORDS, suggestionDistance, true)
                                : null;
                        throw cursor.unexpected("STATUTE, PUBLIC, PRIVATE or EXPORT", suggestion);
                    }
                } catch (DslSyntaxException e) {
                    record(e, currentStatuteId);
                    recover(start, RECOVERY_POINTS);
                }
            }
            return new Document(imports, namespace, statutes, exports);
        }

        private ImportDecl importDecl() {
            cursor.expect(TokenKind.IMPORT, "IMPORT");
            if (cursor.match(TokenKind.STAR)) {
                cursor.expect(TokenKind.FROM, "FROM after 'IMPORT *'");
                return ImportDecl.wildcard(cursor.expect(TokenKind.STRING, "import path").text());
            }
            if (cursor.match(TokenKind.LEFT_BRACE)) {
                List<String> items = identifierList("imported statute id");
                cursor.expect(TokenKind.RIGHT_BRACE, "'}' after imported ids");
                cursor.expect(TokenKind.FROM, "FROM after selective import");
                return ImportDecl.selective(cursor.expect(TokenKind.STRING, "import path").text(), items);
            }
            String path = cursor.expect(TokenKind.STRING, "import path, '*' or '{'").text();
            if (cursor.match(TokenKind.AS)) {
                return ImportDecl.aliased(path, cursor.expect(TokenKind.IDENTIFIER, "import alias").text());
            }
            return ImportDecl.simple(path);
        }

        // ── Statute ──

        Statute topLevelStatute() {
            Visibility visibility = Visibility.PRIVATE;
            if (cursor.match(TokenKind.PUBLIC)) {
                visibility = Visibility.PUBLIC;
            } else if (cursor.match(TokenKind.PRIVATE)) {
                visibility = Visibility.PRIVATE;
            }
            Token keyword = cursor.expect(TokenKind.STATUTE, "STATUTE");
            String id = cursor.expect(TokenKind.IDENTIFIER, "statute id").text();
            currentStatuteId = id;
            cursor.expect(TokenKind.COLON, "':' after statute id");
            String title = cursor.expect(TokenKind.STRING, "statute title").text();
            cursor.expect(TokenKind.LEFT_BRACE, "'{' to open the statute body");

            Statute.Builder builder = Statute.builder(id, title).visibility(visibility);
            while (!cursor.check(TokenKind.RIGHT_BRACE)) {
                clause(builder);
            }
            cursor.advance();
            if (!builder.hasEffect()) {
                throw new InvalidEffectException("statute '" + id + "' has no THEN clause", keyword.location());
            }
            locations.putIfAbsent(id, keyword.location());
            return builder.build();
        }

        private void clause(Statute.Builder builder) {
            Token token = cursor.peek();
            switch (token.kind()) {
                case JURISDICTION -> {
                    cursor.advance();
                    builder.jurisdiction(cursor.expect(TokenKind.STRING, "jurisdiction string").text());
                }
                case VERSION -> {
                    cursor.advance();
                    builder.version(version());
                }
                case EFFECTIVE_DATE -> {
                    cursor.advance();
                    builder.effectiveDate(date("effective date"));
                }
                case EXPIRY_DATE -> {
                    cursor.advance();
                    builder.expiryDate(date("expiry date"));
                }
                case WHEN -> {
                    cursor.advance();
                    builder.when(conditions.parseCondition());
                }
                case UNLESS -> {
                    cursor.advance();
                    builder.when(new ConditionNode.Not(conditions.parseCondition()));
                }
                case THEN -> {
                    cursor.advance();
                    if (builder.hasEffect()) {
                        throw new InvalidEffectException("a statute takes exactly one THEN clause", token.location());
                    }
                    builder.effect(effect());
                }
                case DISCRETION -> {
                    cursor.advance();
                    builder.discretion(cursor.expect(TokenKind.STRING, "discretion guidance string").text());
                }
                case EXCEPTION -> {
                    cursor.advance();
                    cursor.expect(TokenKind.WHEN, "WHEN after EXCEPTION");
                    ConditionNode condition = conditions.parseCondition();
                    String description = cursor.check(TokenKind.STRING) ? cursor.advance().text() : null;
                    builder.exception(new ExceptionClause(condition, description));
                }
                case DEFAULT -> {
                    cursor.advance();
                    String field = ConditionParser.normalizeField(
                            cursor.expect(TokenKind.IDENTIFIER, "attribute name after DEFAULT").text());
                    cursor.expect(TokenKind.ASSIGN, "'=' after DEFAULT attribute");
                    builder.defaultValue(field, conditions.parseValue());
                }
                case REQUIRES -> {
                    cursor.advance();
                    builder.requires(identifierList("required statute id").toArray(new String[0]));
                }
                case SUPERSEDES -> {
                    cursor.advance();
                    builder.supersedes(identifierList("superseded statute id").toArray(new String[0]));
                }
                case AMENDMENT -> {
                    cursor.advance();
                    builder.amendment(amendment());
                }
                default -> {
                    String suggestion = token.is(TokenKind.IDENTIFIER)
                            ? Suggestions.closest(token.text(), CLAUSE_KEYWORDS, suggestionDistance, true)
                            : null;
                    throw cursor.unexpected("statute clause or '}'", suggestion);
                }
            }
        }

        private EffectNode effect() {
            Token token = cursor.peek();
            EffectType type = EffectType.fromKeyword(token.kind());
            if (type == null) {
                if (token.is(TokenKind.EOF)) {
                    throw cursor.unexpected("effect after THEN");
                }
                String suggestion = token.is(TokenKind.IDENTIFIER)
                        ? Suggestions.closest(token.text(), EFFECT_KEYWORDS, suggestionDistance, true)
                        : null;
                String message = "expected GRANT, REVOKE, OBLIGATION or PROHIBITION after THEN, found "
                        + token.describe()
                        + (suggestion != null ? " (did you mean '" + suggestion + "'?)" : "");
                throw new InvalidEffectException(message, token.location());
            }
            cursor.advance();
            String description = cursor.expect(TokenKind.STRING, "effect description").text();
            Map<String, Value> parameters = new LinkedHashMap<>();
            if (cursor.match(TokenKind.LEFT_BRACE)) {
                do {
                    String key = cursor.expect(TokenKind.IDENTIFIER, "effect parameter name").text();
                    cursor.expect(TokenKind.COLON, "':' after effect parameter name");
                    parameters.put(key, conditions.parseValue());
                } while (cursor.match(TokenKind.COMMA));
                cursor.expect(TokenKind.RIGHT_BRACE, "'}' to close effect parameters");
            }
            return new EffectNode(type, description, parameters);
        }

        private AmendmentRecord amendment() {
            String target = cursor.expect(TokenKind.IDENTIFIER, "amended statute id").text();
            cursor.expect(TokenKind.VERSION, "VERSION after amended statute id");
            int version = version();
            LocalDate effective = null;
            if (cursor.match(TokenKind.EFFECTIVE_DATE)) {
                effective = date("amendment effective date");
            }
            String description = cursor.expect(TokenKind.STRING, "amendment description").text();
            return new AmendmentRecord(target, version, effective, description);
        }

        // ── Shared pieces ──

        private int version() {
            Token token = cursor.expect(TokenKind.INTEGER, "version number");
            int version;
            try {
                version = Integer.parseInt(token.text());
            } catch (NumberFormatException e) {
                throw new InvalidVersionException("version number too large: " + token.text(), token.location());
            }
            if (version < 1) {
                throw new InvalidVersionException("version must be >= 1, got " + version, token.location());
            }
            return version;
        }

        private LocalDate date(String what) {
            return LocalDate.parse(cursor.expect(TokenKind.DATE, what + " (YYYY-MM-DD)").text());
        }

        private List<String> identifierList(String what) {
            List<String> ids = new ArrayList<>();
            ids.add(cursor.expect(TokenKind.IDENTIFIER, what).text());
            while (cursor.match(TokenKind.COMMA)) {
                ids.add(cursor.expect(TokenKind.IDENTIFIER, what).text());
            }
            return ids;
        }

        // ── Recovery ──

        void record(DslSyntaxException e, String statuteId) {
            Diagnostic diagnostic = e.toDiagnostic();
            if (statuteId != null) {
                diagnostic = diagnostic.withStatuteId(statuteId);
            }
            diagnostics.add(diagnostic);
            LOG.debug(
                    "parse.recovered code={} location={} statute_id={} message={}",
                    e.code(),
                    e.location(),
                    statuteId,
                    e.getMessage());
        }

        private void recover(int start, Set<TokenKind> stopAt) {
            if (cursor.mark() == start) {
                cursor.advance();
            }
            cursor.skipUntil(stopAt);
        }
    }
}
