package io.statutedsl.core.engine;

import io.statutedsl.core.analysis.SemanticAnalyzer;
import io.statutedsl.core.config.DslConfig;
import io.statutedsl.core.error.DocumentParseException;
import io.statutedsl.core.error.DslSyntaxException;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.EffectOutcome;
import io.statutedsl.core.model.Entity;
import io.statutedsl.core.model.LexResult;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.ParseResult;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.model.TokenKind;
import io.statutedsl.core.parser.ConditionParser;
import io.statutedsl.core.parser.Lexer;
import io.statutedsl.core.parser.StatuteParser;
import io.statutedsl.core.parser.TokenCursor;
import io.statutedsl.core.printer.DslPrinter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point bundling the pipeline stages behind one configuration:
 * {@link #tokenize}, {@link #parseStatute}, {@link #parseDocument}, {@link #format},
 * {@link #analyze} and {@link #evaluate}.
 *
 * <p>Every operation is a pure function of its arguments and the configuration. Instances are
 * immutable and thread-safe.
 *
 * <pre>{@code
 * LegalDsl dsl = new LegalDsl();
 * Statute statute = dsl.parseStatute(
 *         "STATUTE adult-rights: \"Adult Rights Act\" { WHEN AGE >= 18 THEN GRANT \"Full legal capacity\" }");
 * LegalResult<EffectOutcome> result = dsl.evaluate(statute, Entity.builder().put("age", 20).build());
 * }</pre>
 */
public final class LegalDsl {

    private final DslConfig config;
    private final Lexer lexer;
    private final StatuteParser parser;
    private final DslPrinter printer;
    private final SemanticAnalyzer analyzer;
    private final StatuteEvaluator evaluator;

    public LegalDsl() {
        this(DslConfig.DEFAULT);
    }

    public LegalDsl(DslConfig config) {
        this.config = config;
        this.lexer = new Lexer(config.caseInsensitiveKeywords());
        this.parser = new StatuteParser(config);
        this.printer = new DslPrinter(config.printerConfig());
        this.analyzer = new SemanticAnalyzer(config);
        this.evaluator = new StatuteEvaluator(config.evaluationOptions());
    }

    public DslConfig config() {
        return config;
    }

    // ── Lexing and parsing ──

    public LexResult tokenize(String source) {
        return lexer.tokenize(source);
    }

    /** Lenient parse: best-effort document plus every diagnostic. Never throws. */
    public ParseResult parse(String source) {
        return parser.parse(source);
    }

    /** @throws DocumentParseException if the source holds errors */
    public Statute parseStatute(String source) {
        return parser.parseStatute(source);
    }

    /** @throws DocumentParseException if the source holds errors */
    public Document parseDocument(String source) {
        return parser.parseDocument(source);
    }

    /**
     * Parses a standalone condition expression such as {@code AGE >= 18 AND HAS citizen}.
     *
     * @throws DocumentParseException if the source holds errors
     */
    public ConditionNode parseCondition(String source) {
        LexResult lexed = lexer.tokenize(source);
        List<Diagnostic> diagnostics = new ArrayList<>(lexed.diagnostics());
        ConditionNode condition = null;
        try {
            TokenCursor cursor = new TokenCursor(lexed.tokens());
            condition = new ConditionParser(cursor, config.suggestionDistance()).parseCondition();
            cursor.expect(TokenKind.EOF, "end of condition");
        } catch (DslSyntaxException e) {
            diagnostics.add(e.toDiagnostic());
        }
        if (condition == null || Diagnostic.hasErrors(diagnostics)) {
            throw new DocumentParseException(diagnostics);
        }
        return condition;
    }

    // ── Printing ──

    public String format(Statute statute) {
        return printer.format(statute);
    }

    public String format(Document document) {
        return printer.format(document);
    }

    public String format(ConditionNode condition) {
        return printer.formatCondition(condition);
    }

    // ── Analysis ──

    public List<Diagnostic> analyze(Document document) {
        return analyzer.analyze(document);
    }

    public List<Diagnostic> analyze(List<Document> documents) {
        return analyzer.analyze(documents);
    }

    // ── Evaluation ──

    public LegalResult<EffectOutcome> evaluate(Statute statute, Entity entity) {
        return evaluator.evaluate(statute, entity);
    }

    /** Evaluates as of a date: a statute outside its effective window is Void. */
    public LegalResult<EffectOutcome> evaluate(Statute statute, Entity entity, LocalDate asOf) {
        return evaluator.evaluate(statute, entity, config.evaluationOptions().withAsOf(asOf));
    }
}
