package io.statutedsl.core.printer;

import io.statutedsl.core.model.AmendmentRecord;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.EffectNode;
import io.statutedsl.core.model.ExceptionClause;
import io.statutedsl.core.model.ImportDecl;
import io.statutedsl.core.model.ImportKind;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.model.Value;
import io.statutedsl.core.model.Visibility;
import io.statutedsl.core.parser.ConditionParser;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders ASTs back to DSL source.
 *
 * <p>Output re-parses to an equal AST: {@code parse(format(parse(s))).equals(parse(s))}.
 * Parentheses are emitted only where precedence or left-folding requires them, so
 * {@code a OR (b OR c)} keeps its parentheses while {@code (a OR b) OR c} prints flat.
 *
 * <p>Clauses are printed in a fixed order: {@code JURISDICTION VERSION EFFECTIVE_DATE
 * EXPIRY_DATE REQUIRES SUPERSEDES WHEN THEN DEFAULT EXCEPTION AMENDMENT DISCRETION}. All
 * preconditions are printed as a single {@code WHEN}.
 */
public final class DslPrinter {

    private final PrinterConfig config;
    private final String indent;

    public DslPrinter() {
        this(PrinterConfig.DEFAULT);
    }

    public DslPrinter(PrinterConfig config) {
        this.config = config;
        this.indent = " ".repeat(config.indentWidth());
    }

    public PrinterConfig config() {
        return config;
    }

    /** Formats a whole document: imports, namespace, statutes, then exports. */
    public String format(Document document) {
        StringBuilder out = new StringBuilder();
        for (ImportDecl decl : document.imports()) {
            out.append(formatImport(decl)).append('\n');
        }
        if (document.namespace() != null) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(kw("NAMESPACE")).append(' ').append(document.namespace()).append('\n');
        }
        for (Statute statute : document.statutes()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(format(statute));
        }
        if (!document.exports().isEmpty()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(kw("EXPORT")).append(' ').append(String.join(", ", document.exports())).append('\n');
        }
        return out.toString();
    }

    /** Formats one statute, ending with a newline. */
    public String format(Statute statute) {
        StringBuilder out = new StringBuilder();
        if (config.includeComments()) {
            out.append("// Statute: ").append(oneLine(statute.title())).append('\n');
            if (statute.jurisdiction() != null) {
                out.append("// Jurisdiction: ").append(oneLine(statute.jurisdiction())).append('\n');
            }
        }
        if (statute.visibility() == Visibility.PUBLIC) {
            out.append(kw("PUBLIC")).append(' ');
        }
        out.append(kw("STATUTE"))
                .append(' ')
                .append(statute.id())
                .append(": ")
                .append(quote(statute.title()))
                .append(" {\n");

        if (statute.jurisdiction() != null) {
            line(out, kw("JURISDICTION") + " " + quote(statute.jurisdiction()));
        }
        if (statute.version() > 1) {
            line(out, kw("VERSION") + " " + statute.version());
        }
        if (statute.effectiveDate() != null) {
            line(out, kw("EFFECTIVE_DATE") + " " + statute.effectiveDate());
        }
        if (statute.expiryDate() != null) {
            line(out, kw("EXPIRY_DATE") + " " + statute.expiryDate());
        }
        if (!statute.requires().isEmpty()) {
            line(out, kw("REQUIRES") + " " + String.join(", ", statute.requires()));
        }
        if (!statute.supersedes().isEmpty()) {
            line(out, kw("SUPERSEDES") + " " + String.join(", ", statute.supersedes()));
        }
        if (statute.preconditions() != null) {
            line(out, kw("WHEN") + " " + formatCondition(statute.preconditions()));
        }
        line(out, kw("THEN") + " " + formatEffect(statute.effect()));
        for (Map.Entry<String, Value> entry : statute.defaults().entrySet()) {
            line(out, kw("DEFAULT") + " " + field(entry.getKey()) + " = " + formatValue(entry.getValue()));
        }
        for (ExceptionClause exception : statute.exceptions()) {
            String text = kw("EXCEPTION") + " " + kw("WHEN") + " " + formatCondition(exception.condition());
            if (exception.description() != null) {
                text += " " + quote(exception.description());
            }
            line(out, text);
        }
        for (AmendmentRecord amendment : statute.amendments()) {
            StringBuilder text = new StringBuilder(kw("AMENDMENT"))
                    .append(' ')
                    .append(amendment.targetId())
                    .append(' ')
                    .append(kw("VERSION"))
                    .append(' ')
                    .append(amendment.version());
            if (amendment.effectiveDate() != null) {
                text.append(' ').append(kw("EFFECTIVE_DATE")).append(' ').append(amendment.effectiveDate());
            }
            text.append(' ').append(quote(amendment.description()));
            line(out, text.toString());
        }
        if (statute.discretionLogic() != null) {
            line(out, kw("DISCRETION") + " " + quote(statute.discretionLogic()));
        }
        out.append("}\n");
        return out.toString();
    }

    /** Formats a condition with the minimum parentheses that preserve its shape. */
    public String formatCondition(ConditionNode node) {
        switch (node.kind()) {
            case COMPARISON -> {
                ConditionNode.Comparison c = (ConditionNode.Comparison) node;
                return field(c.field()) + " " + c.operator().symbol() + " " + formatValue(c.value());
            }
            case BETWEEN -> {
                ConditionNode.Between b = (ConditionNode.Between) node;
                return field(b.field()) + " " + kw("BETWEEN") + " " + formatValue(b.min()) + " " + kw("AND") + " "
                        + formatValue(b.max());
            }
            case IN_SET -> {
                ConditionNode.InSet in = (ConditionNode.InSet) node;
                StringBuilder sb = new StringBuilder(field(in.field())).append(' ').append(kw("IN")).append(" (");
                List<Value> values = in.values();
                for (int i = 0; i < values.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(formatValue(values.get(i)));
                }
                return sb.append(')').toString();
            }
            case HAS_ATTRIBUTE -> {
                return kw("HAS") + " " + field(((ConditionNode.HasAttribute) node).key());
            }
            case LIKE -> {
                ConditionNode.Like like = (ConditionNode.Like) node;
                return field(like.field()) + " " + kw("LIKE") + " " + quote(like.pattern());
            }
            case AND -> {
                ConditionNode.And and = (ConditionNode.And) node;
                String left = wrapIf(and.left(), and.left().kind() == ConditionNode.Kind.OR);
                String right = wrapIf(and.right(), isBinary(and.right()));
                return left + " " + kw("AND") + " " + right;
            }
            case OR -> {
                ConditionNode.Or or = (ConditionNode.Or) node;
                String right = wrapIf(or.right(), or.right().kind() == ConditionNode.Kind.OR);
                return formatCondition(or.left()) + " " + kw("OR") + " " + right;
            }
            case NOT -> {
                ConditionNode inner = ((ConditionNode.Not) node).inner();
                return kw("NOT") + " " + wrapIf(inner, isBinary(inner));
            }
            default -> throw new IllegalStateException("Unhandled condition kind: " + node.kind());
        }
    }

    /** Formats an effect, e.g. {@code GRANT "Full legal capacity" { limit: 100 }}. */
    public String formatEffect(EffectNode effect) {
        StringBuilder sb = new StringBuilder(kw(effect.type().keyword().name()))
                .append(' ')
                .append(quote(effect.description()));
        if (!effect.parameters().isEmpty()) {
            sb.append(" { ");
            boolean first = true;
            for (Map.Entry<String, Value> entry : effect.parameters().entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append(": ").append(formatValue(entry.getValue()));
                first = false;
            }
            sb.append(" }");
        }
        return sb.toString();
    }

    /** Formats a literal. {@link Value.AbsentValue} has no source form. */
    public String formatValue(Value value) {
        return switch (value.kind()) {
            case NUMBER -> ((Value.NumberValue) value).value().toPlainString();
            case STRING -> quote(((Value.StringValue) value).value());
            case BOOLEAN -> Boolean.toString(((Value.BooleanValue) value).value());
            case DATE -> ((Value.DateValue) value).value().toString();
            case ABSENT -> throw new IllegalArgumentException("absent values cannot be written as DSL literals");
        };
    }

    private String formatImport(ImportDecl decl) {
        ImportKind kind = decl.kind();
        return switch (kind.kind()) {
            case SIMPLE -> kw("IMPORT") + " " + quote(decl.path());
            case ALIASED -> kw("IMPORT") + " " + quote(decl.path()) + " " + kw("AS") + " "
                    + ((ImportKind.Aliased) kind).alias();
            case WILDCARD -> kw("IMPORT") + " * " + kw("FROM") + " " + quote(decl.path());
            case SELECTIVE -> kw("IMPORT") + " { " + String.join(", ", ((ImportKind.Selective) kind).items())
                    + " } " + kw("FROM") + " " + quote(decl.path());
        };
    }

    private String wrapIf(ConditionNode node, boolean parenthesize) {
        String text = formatCondition(node);
        return parenthesize ? "(" + text + ")" : text;
    }

    private static boolean isBinary(ConditionNode node) {
        return node.kind() == ConditionNode.Kind.AND || node.kind() == ConditionNode.Kind.OR;
    }

    private void line(StringBuilder out, String text) {
        out.append(indent).append(text).append('\n');
    }

    private String kw(String keyword) {
        return config.keywordCase().apply(keyword);
    }

    /** Built-in fields print upper-case, like the keywords around them. */
    private static String field(String name) {
        return ConditionParser.BUILT_IN_FIELDS.contains(name) ? name.toUpperCase(Locale.ROOT) : name;
    }

    private static String oneLine(String text) {
        return text.replace('\n', ' ').replace('\r', ' ');
    }

    /** Quotes and escapes a string literal. */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
