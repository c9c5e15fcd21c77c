package io.statutedsl.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.statutedsl.core.error.ConfigLoadException;
import io.statutedsl.core.error.DslException;
import io.statutedsl.core.printer.KeywordCase;
import io.statutedsl.core.printer.PrinterConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping, defaults for missing keys, environment overrides
 * and descriptive failures.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("statute-dsl.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    private static Path fixture() throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/statute-dsl.yaml")
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("full config → every key mapped")
        void fullConfig() throws Exception {
            DslConfig config = ConfigLoader.load(fixture(), NO_ENV);

            assertThat(config.caseInsensitiveKeywords()).isTrue();
            assertThat(config.indentWidth()).isEqualTo(2);
            assertThat(config.keywordCase()).isEqualTo(KeywordCase.LOWER);
            assertThat(config.includeComments()).isTrue();
            assertThat(config.suggestionDistance()).isEqualTo(3);
            assertThat(config.reportContradictions()).isFalse();
            assertThat(config.globCaseSensitive()).isFalse();
        }

        @Test
        @DisplayName("partial config → remaining keys keep their defaults")
        void partialConfig() throws Exception {
            DslConfig config = ConfigLoader.load(write("printer:\n  indent-width: 8\n"), NO_ENV);

            assertThat(config).isEqualTo(DslConfig.builder().indentWidth(8).build());
        }

        @Test
        @DisplayName("empty file → defaults")
        void emptyFile() throws Exception {
            assertThat(ConfigLoader.load(write(""), NO_ENV)).isEqualTo(DslConfig.DEFAULT);
        }

        @Test
        @DisplayName("quoted scalars are accepted")
        void quotedScalars() throws Exception {
            DslConfig config = ConfigLoader.load(
                    write("lexer:\n  case-insensitive-keywords: \"TRUE\"\nanalyzer:\n  suggestion-distance: \"1\"\n"),
                    NO_ENV);

            assertThat(config.caseInsensitiveKeywords()).isTrue();
            assertThat(config.suggestionDistance()).isEqualTo(1);
        }

        @Test
        @DisplayName("configuration derives printer and evaluator settings")
        void derived() throws Exception {
            DslConfig config = ConfigLoader.load(fixture(), NO_ENV);

            assertThat(config.printerConfig()).isEqualTo(new PrinterConfig(2, KeywordCase.LOWER, true));
            assertThat(config.evaluationOptions().globCaseSensitive()).isFalse();
            assertThat(config.evaluationOptions().asOf()).isNull();
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("env vars override YAML values")
        void overrides() throws Exception {
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_INDENT_WIDTH, " 6 ",
                    ConfigLoader.ENV_KEYWORD_CASE, "UPPER",
                    ConfigLoader.ENV_REPORT_CONTRADICTIONS, "true",
                    ConfigLoader.ENV_GLOB_CASE_SENSITIVE, "True");

            DslConfig config = ConfigLoader.load(fixture(), env::get);

            assertThat(config.indentWidth()).isEqualTo(6);
            assertThat(config.keywordCase()).isEqualTo(KeywordCase.UPPER);
            assertThat(config.reportContradictions()).isTrue();
            assertThat(config.globCaseSensitive()).isTrue();
            assertThat(config.suggestionDistance()).isEqualTo(3);
        }

        @Test
        @DisplayName("blank env vars count as unset")
        void blankIgnored() throws Exception {
            Map<String, String> env = Map.of(ConfigLoader.ENV_SUGGESTION_DISTANCE, "   ");

            assertThat(ConfigLoader.load(fixture(), env::get).suggestionDistance()).isEqualTo(3);
        }

        @Test
        @DisplayName("environment alone")
        void environmentOnly() {
            DslConfig config = ConfigLoader.fromEnvironment(
                    Map.of(ConfigLoader.ENV_CASE_INSENSITIVE_KEYWORDS, "true")::get);

            assertThat(config).isEqualTo(DslConfig.builder().caseInsensitiveKeywords(true).build());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("missing file")
        void missingFile() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration file not found: ")
                    .satisfies(e -> assertThat(((DslException) e).phase()).isEqualTo(DslException.Phase.CONFIG));
        }

        @Test
        @DisplayName("malformed YAML")
        void malformedYaml() throws Exception {
            Path file = write("printer: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("non-boolean flag")
        void badBoolean() throws Exception {
            Path file = write("evaluator:\n  glob-case-sensitive: maybe\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("evaluator.glob-case-sensitive must be 'true' or 'false', got: 'maybe'");
        }

        @Test
        @DisplayName("non-integer env var")
        void badInteger() throws Exception {
            Map<String, String> env = Map.of(ConfigLoader.ENV_INDENT_WIDTH, "wide");

            assertThatThrownBy(() -> ConfigLoader.load(fixture(), env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH);
        }

        @Test
        @DisplayName("out-of-range values")
        void outOfRange() throws Exception {
            Path file = write("printer:\n  indent-width: 40\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid configuration: indentWidth");
        }

        @Test
        @DisplayName("unknown keyword case")
        void unknownKeywordCase() throws Exception {
            Path file = write("printer:\n  keyword-case: title\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("printer.keyword-case: Unknown keyword case");
        }
    }
}
