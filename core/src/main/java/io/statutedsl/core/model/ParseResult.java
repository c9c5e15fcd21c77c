package io.statutedsl.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of lenient parsing: a best-effort document, every lexical and syntactic diagnostic, and
 * the source location of each parsed statute's {@code STATUTE} keyword keyed by statute id.
 *
 * <p>Statutes that failed to parse are absent from the document; their problems are in
 * {@code diagnostics}.
 */
public record ParseResult(Document document, List<Diagnostic> diagnostics, Map<String, SourceLocation> statuteLocations) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
        statuteLocations = Collections.unmodifiableMap(new LinkedHashMap<>(statuteLocations));
    }

    public boolean hasErrors() {
        return Diagnostic.hasErrors(diagnostics);
    }
}
