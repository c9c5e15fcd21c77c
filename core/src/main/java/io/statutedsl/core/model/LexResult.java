package io.statutedsl.core.model;

import java.util.List;

/**
 * Output of tokenization: tokens (always ending with {@link TokenKind#EOF}) and lexical
 * diagnostics.
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return Diagnostic.hasErrors(diagnostics);
    }
}
