package io.statutedsl.core.serial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.statutedsl.core.engine.StatuteEvaluator;
import io.statutedsl.core.model.ComparisonOp;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.Diagnostic;
import io.statutedsl.core.model.DiagnosticCode;
import io.statutedsl.core.model.Document;
import io.statutedsl.core.model.EffectOutcome;
import io.statutedsl.core.model.Entity;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.SourceLocation;
import io.statutedsl.core.model.Statute;
import io.statutedsl.core.model.Value;
import io.statutedsl.core.parser.StatuteParser;
import io.statutedsl.core.testkit.Fixtures;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("AstMapper")
class AstMapperTest {

    private final StatuteParser parser = new StatuteParser();

    static List<String> fixtures() {
        return Fixtures.VALID;
    }

    private static JsonNode tree(String json) throws Exception {
        return AstMapper.json().readTree(json);
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("io.statutedsl.core.serial.AstMapperTest#fixtures")
        @DisplayName("JSON reads back to an equal document")
        void jsonRoundTrip(String fixture) {
            Document document = parser.parseDocument(Fixtures.statute(fixture));

            assertThat(AstMapper.documentFromJson(AstMapper.toJson(document))).isEqualTo(document);
        }

        @Test
        @DisplayName("YAML reads back to an equal document")
        void yamlRoundTrip() {
            Document document = parser.parseDocument(Fixtures.statute("full-document.legal"));

            assertThat(AstMapper.documentFromYaml(AstMapper.toYaml(document))).isEqualTo(document);
        }

        @Test
        @DisplayName("tags, operators and dates use their source spellings")
        void shape() throws Exception {
            Statute statute = parser.parseStatute(
                    "STATUTE s: \"S\" { EFFECTIVE_DATE 2024-01-01 WHEN AGE >= 18 AND NOT HAS x THEN GRANT \"g\" }");

            JsonNode json = tree(AstMapper.toJson(statute));

            assertThat(json.get("effectiveDate").asText()).isEqualTo("2024-01-01");
            JsonNode when = json.get("preconditions");
            assertThat(when.get("type").asText()).isEqualTo("And");
            assertThat(when.get("left").get("type").asText()).isEqualTo("Comparison");
            assertThat(when.get("left").get("operator").asText()).isEqualTo(">=");
            assertThat(when.get("left").get("value").get("type").asText()).isEqualTo("number");
            assertThat(when.get("left").get("value").get("value").asInt()).isEqualTo(18);
            assertThat(when.get("right").get("type").asText()).isEqualTo("Not");
            assertThat(json.get("effect").get("type").asText()).isEqualTo("Grant");
            assertThat(json.get("visibility").asText()).isEqualTo("PRIVATE");
        }

        @Test
        @DisplayName("a single condition node reads back")
        void condition() {
            ConditionNode node = new ConditionNode.InSet(
                    "filed", List.of(Value.of(LocalDate.of(2024, 1, 1)), Value.of(LocalDate.of(2024, 2, 1))));

            assertThat(AstMapper.fromJson(AstMapper.toJson(node), ConditionNode.class)).isEqualTo(node);
        }

        @Test
        @DisplayName("a statute reads back from JSON")
        void statute() {
            Statute statute = parser.parseStatute(Fixtures.ADULT_RIGHTS_SOURCE);

            assertThat(AstMapper.statuteFromJson(AstMapper.toJson(statute))).isEqualTo(statute);
        }
    }

    @Nested
    @DisplayName("Entities and results")
    class EntitiesAndResults {

        @Test
        @DisplayName("entities serialize as a plain object of typed values")
        void entity() throws Exception {
            Entity entity = Entity.builder()
                    .put("age", 20)
                    .put("citizen", true)
                    .put("born", LocalDate.of(2004, 5, 1))
                    .absent("spouse")
                    .build();

            String json = AstMapper.toJson(entity);

            assertThat(tree(json).get("age").get("type").asText()).isEqualTo("number");
            assertThat(tree(json).get("spouse").get("type").asText()).isEqualTo("absent");
            assertThat(AstMapper.fromJson(json, Entity.class)).isEqualTo(entity);
        }

        @Test
        @DisplayName("entities load from YAML")
        void entityFromYaml() {
            String yaml = """
                    age:
                      type: number
                      value: 42
                    name:
                      type: string
                      value: Ada
                    """;

            assertThat(AstMapper.fromYaml(yaml, Entity.class))
                    .isEqualTo(Entity.builder().put("age", 42).put("name", "Ada").build());
        }

        @Test
        @DisplayName("evaluation results of every outcome read back")
        void results() throws Exception {
            Statute statute = parser.parseStatute(Fixtures.ADULT_RIGHTS_SOURCE);
            StatuteEvaluator evaluator = new StatuteEvaluator();
            List<LegalResult<EffectOutcome>> results = List.of(
                    evaluator.evaluate(statute, Entity.builder().put("age", 20).build()),
                    evaluator.evaluate(statute, Entity.empty()),
                    evaluator.evaluate(statute, Entity.builder().put("age", 16).build()));

            for (LegalResult<EffectOutcome> result : results) {
                assertThat(AstMapper.resultFromJson(AstMapper.toJson(result))).isEqualTo(result);
            }
            assertThat(tree(AstMapper.toJson(results.get(1))).get("type").asText()).isEqualTo("JudicialDiscretion");
            assertThat(tree(AstMapper.toJson(results.get(2))).get("reason").asText())
                    .isEqualTo("preconditions not met");
        }

        @Test
        @DisplayName("diagnostics serialize with their location")
        void diagnostics() throws Exception {
            Diagnostic diagnostic = Diagnostic.at(
                            DiagnosticCode.UNEXPECTED_TOKEN, "expected value", new SourceLocation(2, 5, 12))
                    .withSuggestion("WHEN");

            JsonNode json = tree(AstMapper.toJson(diagnostic));

            assertThat(json.get("code").asText()).isEqualTo("UNEXPECTED_TOKEN");
            assertThat(json.get("severity").asText()).isEqualTo("ERROR");
            assertThat(json.get("location").get("line").asInt()).isEqualTo(2);
            assertThat(json.get("suggestion").asText()).isEqualTo("WHEN");
            assertThat(json.has("error")).isFalse();
        }
    }

    @Test
    @DisplayName("malformed input → UncheckedIOException")
    void malformed() {
        assertThatThrownBy(() -> AstMapper.documentFromJson("{ not json"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Document");
        assertThatThrownBy(() -> AstMapper.fromJson(
                        "{\"type\":\"Comparison\",\"field\":\"a\",\"operator\":\"=~\",\"value\":{\"type\":\"number\",\"value\":1}}",
                        ConditionNode.class))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("operators serialize as symbols")
    void operatorSymbols() {
        assertThat(AstMapper.toJson(ComparisonOp.NOT_EQUAL)).isEqualTo("\"!=\"");
    }
}
