package io.statutedsl.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code IMPORT} declaration.
 *
 * @param path the quoted path, unresolved
 * @param kind import form
 */
public record ImportDecl(String path, ImportKind kind) {

    public ImportDecl {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ImportDecl simple(String path) {
        return new ImportDecl(path, new ImportKind.Simple());
    }

    public static ImportDecl aliased(String path, String alias) {
        return new ImportDecl(path, new ImportKind.Aliased(alias));
    }

    public static ImportDecl wildcard(String path) {
        return new ImportDecl(path, new ImportKind.Wildcard());
    }

    public static ImportDecl selective(String path, List<String> items) {
        return new ImportDecl(path, new ImportKind.Selective(items));
    }
}
