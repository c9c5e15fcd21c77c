package io.statutedsl.core.testkit;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Loads {@code .legal} fixtures from {@code src/test/resources/statutes/}. */
public final class Fixtures {

    /** Fixtures that parse without errors. */
    public static final List<String> VALID = List.of(
            "adult-rights.legal",
            "full-document.legal",
            "complex-conditions.legal",
            "escapes-and-amendments.legal");

    public static final String ADULT_RIGHTS_SOURCE =
            "STATUTE adult-rights: \"Adult Rights Act\" { WHEN AGE >= 18 THEN GRANT \"Full legal capacity\" }";

    private Fixtures() {}

    public static String statute(String name) {
        return resource("/statutes/" + name);
    }

    public static String resource(String path) {
        try (InputStream in = Fixtures.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
