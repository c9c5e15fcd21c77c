package io.statutedsl.core.analysis;

import io.statutedsl.core.config.DslConfig;
import io.statutedsl.core.error.SemanticException;
import io.statutedsl.core.model.AmendmentRecord;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.ExceptionClause;
import io.statutedsl.core.model.ParseResult;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.parser.Suggestions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-statute validation over one document or a set of documents.
 *
 * <p>Checks run independently and every problem is reported:
 *
 * <ul>
 *   <li>duplicate statute ids ({@code DUPLICATE_ID});</li>
 *   <li>{@code REQUIRES}, {@code SUPERSEDES} and amendment targets that do not exist
 *       ({@code UNDEFINED_REFERENCE}, with a "did you mean" suggestion);</li>
 *   <li>statutes requiring or superseding themselves ({@code SELF_REFERENCE});</li>
 *   <li>cycles in the requires/supersedes graph ({@code CIRCULAR_DEPENDENCY}, one per cycle);</li>
 *   <li>condition ranges, kinds and contradictions (see {@link ConditionChecks});</li>
 *   <li>effective date after expiry date ({@code INVALID_DATE_RANGE});</li>
 *   <li>amendment versions that do not increase ({@code AMENDMENT_ORDER});</li>
 *   <li>exports naming statutes the document does not declare ({@code UNDEFINED_EXPORT}).</li>
 * </ul>
 *
 * <p>A reference {@code ns.id} resolves to statute {@code id} of a document declaring
 * {@code NAMESPACE ns}. {@link #analyze} never throws; {@link #requireValid} turns error
 * diagnostics into a {@link SemanticException}. Inputs are immutable, so concurrent analysis is
 * safe.
 */
public final class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final int suggestionDistance;
    private final boolean reportContradictions;

    public SemanticAnalyzer() {
        this(DslConfig.DEFAULT);
    }

    public SemanticAnalyzer(DslConfig config) {
        this.suggestionDistance = config.suggestionDistance();
        this.reportContradictions = config.reportContradictions();
    }

    public List<Diagnostic> analyze(Document document) {
        return analyze(List.of(document));
    }

    /**
     * Analyzes a parse result and attaches each statute's source location to the diagnostics
     * that concern it.
     */
    public List<Diagnostic> analyze(ParseResult parsed) {
        List<Diagnostic> diagnostics = analyze(parsed.document());
        Map<String, SourceLocation> locations = parsed.statuteLocations();
        List<Diagnostic> located = new ArrayList<>(diagnostics.size());
        for (Diagnostic d : diagnostics) {
            SourceLocation at = d.statuteId() != null ? locations.get(d.statuteId()) : null;
            located.add(d.location() == null && at != null ? d.withLocation(at) : d);
        }
        return located;
    }

    /** Analyzes a set of documents as one registry. */
    public List<Diagnostic> analyze(List<Document> documents) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        References references = new References(documents);
        int statuteCount = 0;

        Set<String> seenIds = new HashSet<>();
        for (Document document : documents) {
            for (Statute statute : document.statutes()) {
                statuteCount++;
                if (!seenIds.add(statute.id())) {
                    diagnostics.add(Diagnostic.forStatute(
                            DiagnosticCode.DUPLICATE_ID, "duplicate statute id '" + statute.id() + "'", statute.id()));
                }
                checkStatute(statute, references, diagnostics);
            }
            checkExports(document, diagnostics);
        }
        checkCycles(documents, references, diagnostics);

        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        if (errors > 0) {
            LOG.warn(
                    "analysis.completed statutes={} errors={} warnings={}",
                    statuteCount,
                    errors,
                    diagnostics.size() - errors);
        } else {
            LOG.debug("analysis.completed statutes={} errors=0 warnings={}", statuteCount, diagnostics.size());
        }
        return List.copyOf(diagnostics);
    }

    /**
     * Analyzes and fails on any error diagnostic.
     *
     * @return the warnings, if any
     * @throws SemanticException if an error diagnostic was produced
     */
    public List<Diagnostic> requireValid(List<Document> documents) {
        List<Diagnostic> diagnostics = analyze(documents);
        if (Diagnostic.hasErrors(diagnostics)) {
            throw new SemanticException(diagnostics);
        }
        return diagnostics;
    }

    public List<Diagnostic> requireValid(Document document) {
        return requireValid(List.of(document));
    }

    // ── Per statute ──

    private void checkStatute(Statute statute, References references, List<Diagnostic> out) {
        String id = statute.id();
        checkReferences(statute, statute.requires(), "requires", references, out);
        checkReferences(statute, statute.supersedes(), "supersedes", references, out);
        for (AmendmentRecord amendment : statute.amendments()) {
            if (!references.resolves(amendment.targetId())) {
                out.add(undefined(statute, amendment.targetId(), "amends", references));
            }
        }

        if (statute.effectiveDate() != null
                && statute.expiryDate() != null
                && statute.effectiveDate().isAfter(statute.expiryDate())) {
            out.add(Diagnostic.forStatute(
                    DiagnosticCode.INVALID_DATE_RANGE,
                    "statute '" + id + "' takes effect on " + statute.effectiveDate() + " after it expires on "
                            + statute.expiryDate(),
                    id));
        }

        Map<String, Integer> lastVersion = new HashMap<>();
        for (AmendmentRecord amendment : statute.amendments()) {
            Integer previous = lastVersion.put(amendment.targetId(), amendment.version());
            if (previous != null && amendment.version() <= previous) {
                out.add(Diagnostic.forStatute(
                        DiagnosticCode.AMENDMENT_ORDER,
                        "amendment of '" + amendment.targetId() + "' to version " + amendment.version()
                                + " does not follow version " + previous,
                        id));
            }
        }

        ConditionChecks checks = new ConditionChecks(statute, out::add, reportContradictions);
        if (statute.preconditions() != null) {
            checks.check(statute.preconditions());
        }
        for (ExceptionClause exception : statute.exceptions()) {
            ConditionNode condition = exception.condition();
            checks.check(condition);
        }
    }

    private void checkReferences(
            Statute statute, List<String> targets, String relation, References references, List<Diagnostic> out) {
        for (String target : targets) {
            if (target.equals(statute.id()) || statute.id().equals(references.resolve(target))) {
                out.add(Diagnostic.forStatute(
                                DiagnosticCode.SELF_REFERENCE,
                                "statute '" + statute.id() + "' " + relation + " itself",
                                statute.id())
                        .withRelatedIds(List.of(statute.id())));
            } else if (!references.resolves(target)) {
                out.add(undefined(statute, target, relation, references));
            }
        }
    }

    private Diagnostic undefined(Statute statute, String target, String relation, References references) {
        Diagnostic diagnostic = Diagnostic.forStatute(
                        DiagnosticCode.UNDEFINED_REFERENCE,
                        "statute '" + statute.id() + "' " + relation + " undefined statute '" + target + "'",
                        statute.id())
                .withRelatedIds(List.of(target));
        String suggestion = Suggestions.closest(target, references.knownIds(), suggestionDistance, false);
        return suggestion != null ? diagnostic.withSuggestion(suggestion) : diagnostic;
    }

    private static void checkExports(Document document, List<Diagnostic> out) {
        Set<String> declared = new HashSet<>();
        for (Statute statute : document.statutes()) {
            declared.add(statute.id());
        }
        for (String export : document.exports()) {
            if (!declared.contains(export)) {
                out.add(Diagnostic.forStatute(
                                DiagnosticCode.UNDEFINED_EXPORT,
                                "export of undefined statute '" + export + "'",
                                null)
                        .withRelatedIds(List.of(export)));
            }
        }
    }

    // ── Cycles ──

    private static void checkCycles(List<Document> documents, References references, List<Diagnostic> out) {
        DependencyGraph graph = new DependencyGraph();
        for (Document document : documents) {
            for (Statute statute : document.statutes()) {
                graph.addNode(statute.id());
                for (String target : statute.requires()) {
                    String resolved = references.resolve(target);
                    if (resolved != null) {
                        graph.addEdge(statute.id(), resolved);
                    }
                }
                for (String target : statute.supersedes()) {
                    String resolved = references.resolve(target);
                    if (resolved != null) {
                        graph.addEdge(statute.id(), resolved);
                    }
                }
            }
        }
        for (List<String> cycle : graph.findCycles()) {
            String path = String.join(" -> ", cycle) + " -> " + cycle.get(0);
            out.add(Diagnostic.forStatute(
                            DiagnosticCode.CIRCULAR_DEPENDENCY, "circular dependency: " + path, cycle.get(0))
                    .withRelatedIds(cycle));
        }
    }

    /** Resolves plain and namespace-qualified statute references. */
    private static final class References {

        private final Set<String> plainIds = new LinkedHashSet<>();
        private final Map<String, String> qualified = new HashMap<>();

        References(List<Document> documents) {
            for (Document document : documents) {
                for (Statute statute : document.statutes()) {
                    plainIds.add(statute.id());
                    if (document.namespace() != null) {
                        qualified.putIfAbsent(document.namespace() + "." + statute.id(), statute.id());
                    }
                }
            }
        }

        boolean resolves(String reference) {
            return resolve(reference) != null;
        }

        /** Returns the plain statute id a reference denotes, or {@code null}. */
        String resolve(String reference) {
            if (plainIds.contains(reference)) {
                return reference;
            }
            return qualified.get(reference);
        }

        Set<String> knownIds() {
            Set<String> all = new LinkedHashSet<>(plainIds);
            all.addAll(qualified.keySet());
            return all;
        }
    }
}
