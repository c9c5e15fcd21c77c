package io.statutedsl.core.serial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.EffectOutcome;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.Statute;
import java.io.UncheckedIOException;

/**
 * Structural JSON and YAML serialization of ASTs, entities, diagnostics and results.
 *
 * <p>Polymorphic types carry a {@code type} property ({@code Comparison}, {@code And},
 * {@code Grant}, {@code Deterministic}, ...), operators are written as their symbols and dates
 * as ISO-8601 strings. Serialization is lossless: reading back what was written yields an equal
 * value.
 *
 * <p>Jackson failures surface as {@link UncheckedIOException}.
 */
public final class AstMapper {

    private static final TypeReference<LegalResult<EffectOutcome>> RESULT_TYPE = new TypeReference<>() {};

    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));

    private AstMapper() {
        // utility class
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /** The shared JSON mapper. Do not reconfigure it. */
    public static ObjectMapper json() {
        return JSON;
    }

    /** The shared YAML mapper. Do not reconfigure it. */
    public static ObjectMapper yaml() {
        return YAML;
    }

    public static String toJson(Object value) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON for " + value.getClass().getSimpleName(), e);
        }
    }

    public static String toYaml(Object value) {
        try {
            return YAML.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write YAML for " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return JSON.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
    }

    public static <T> T fromYaml(String yaml, Class<T> type) {
        try {
            return YAML.readValue(yaml, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read " + type.getSimpleName() + " from YAML", e);
        }
    }

    public static Statute statuteFromJson(String json) {
        return fromJson(json, Statute.class);
    }

    public static Document documentFromJson(String json) {
        return fromJson(json, Document.class);
    }

    public static Document documentFromYaml(String yaml) {
        return fromYaml(yaml, Document.class);
    }

    /** Reads an evaluation result written by {@link #toJson}. */
    public static LegalResult<EffectOutcome> resultFromJson(String json) {
        try {
            return JSON.readValue(json, RESULT_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read LegalResult from JSON", e);
        }
    }
}
