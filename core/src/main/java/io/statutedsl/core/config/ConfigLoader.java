package io.statutedsl.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.statutedsl.core.error.ConfigLoadException;
import io.statutedsl.core.printer.KeywordCase;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link DslConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>Expected layout (every key optional):
 *
 * <pre>
 * lexer:
 *   case-insensitive-keywords: false
 * printer:
 *   indent-width: 4
 *   keyword-case: upper
 *   include-comments: false
 * analyzer:
 *   suggestion-distance: 2
 *   report-contradictions: true
 * evaluator:
 *   glob-case-sensitive: true
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only if
 * it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_CASE_INSENSITIVE_KEYWORDS = "STATUTE_DSL_CASE_INSENSITIVE_KEYWORDS";
    static final String ENV_INDENT_WIDTH = "STATUTE_DSL_INDENT_WIDTH";
    static final String ENV_KEYWORD_CASE = "STATUTE_DSL_KEYWORD_CASE";
    static final String ENV_SUGGESTION_DISTANCE = "STATUTE_DSL_SUGGESTION_DISTANCE";
    static final String ENV_REPORT_CONTRADICTIONS = "STATUTE_DSL_REPORT_CONTRADICTIONS";
    static final String ENV_GLOB_CASE_SENSITIVE = "STATUTE_DSL_GLOB_CASE_SENSITIVE";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static DslConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from {@code envLookup}, which
     * returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static DslConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            DslConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            LOG.debug("config.loaded path={} config={}", configPath, config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Builds configuration from defaults plus environment variables only. */
    public static DslConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static DslConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        DslConfig.Builder builder = DslConfig.builder();

        // --- YAML mapping ---

        JsonNode lexer = root.path("lexer");
        if (lexer.has("case-insensitive-keywords")) {
            builder.caseInsensitiveKeywords(yamlBool(lexer, "lexer.case-insensitive-keywords"));
        }

        JsonNode printer = root.path("printer");
        if (printer.has("indent-width")) builder.indentWidth(yamlInt(printer, "printer.indent-width"));
        if (printer.has("keyword-case")) {
            builder.keywordCase(keywordCase(printer.get("keyword-case").asText(), "printer.keyword-case"));
        }
        if (printer.has("include-comments")) builder.includeComments(yamlBool(printer, "printer.include-comments"));

        JsonNode analyzer = root.path("analyzer");
        if (analyzer.has("suggestion-distance")) {
            builder.suggestionDistance(yamlInt(analyzer, "analyzer.suggestion-distance"));
        }
        if (analyzer.has("report-contradictions")) {
            builder.reportContradictions(yamlBool(analyzer, "analyzer.report-contradictions"));
        }

        JsonNode evaluator = root.path("evaluator");
        if (evaluator.has("glob-case-sensitive")) {
            builder.globCaseSensitive(yamlBool(evaluator, "evaluator.glob-case-sensitive"));
        }

        // --- Environment variable overlay ---

        envBool(envLookup, ENV_CASE_INSENSITIVE_KEYWORDS, builder::caseInsensitiveKeywords);
        envInt(envLookup, ENV_INDENT_WIDTH, builder::indentWidth);
        if (isSet(envLookup, ENV_KEYWORD_CASE)) {
            builder.keywordCase(keywordCase(envLookup.apply(ENV_KEYWORD_CASE), ENV_KEYWORD_CASE));
        }
        envInt(envLookup, ENV_SUGGESTION_DISTANCE, builder::suggestionDistance);
        envBool(envLookup, ENV_REPORT_CONTRADICTIONS, builder::reportContradictions);
        envBool(envLookup, ENV_GLOB_CASE_SENSITIVE, builder::globCaseSensitive);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, Consumer<Integer> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseInt(envLookup.apply(envVar).trim(), envVar));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseBool(envLookup.apply(envVar).trim(), envVar));
        }
    }

    // --- Value helpers ---

    private static int yamlInt(JsonNode section, String key) {
        JsonNode node = section.get(leaf(key));
        if (node.isInt()) {
            return node.asInt();
        }
        return parseInt(node.asText(), key);
    }

    private static boolean yamlBool(JsonNode section, String key) {
        JsonNode node = section.get(leaf(key));
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return parseBool(node.asText(), key);
    }

    private static String leaf(String key) {
        return key.substring(key.indexOf('.') + 1);
    }

    private static int parseInt(String text, String source) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(source + " must be an integer, got: '" + text + "'", e);
        }
    }

    private static boolean parseBool(String text, String source) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new ConfigLoadException(source + " must be 'true' or 'false', got: '" + text + "'");
    }

    private static KeywordCase keywordCase(String text, String source) {
        try {
            return KeywordCase.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(source + ": " + e.getMessage(), e);
        }
    }
}
