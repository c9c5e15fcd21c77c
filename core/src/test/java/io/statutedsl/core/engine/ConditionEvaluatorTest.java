package io.statutedsl.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.statutedsl.core.model.ComparisonOp;
import io.statutedsl.core.model.ConditionNode;
import io.statutedsl.core.model.ConditionNode.And;
import io.statutedsl.core.model.ConditionNode.Between;
import io.statutedsl.core.model.ConditionNode.Comparison;
import io.statutedsl.core.model.ConditionNode.HasAttribute;
import io.statutedsl.core.model.ConditionNode.InSet;
import io.statutedsl.core.model.ConditionNode.Like;
import io.statutedsl.core.model.ConditionNode.Not;
import io.statutedsl.core.model.ConditionNode.Or;
import io.statutedsl.core.model.Entity;
import io.statutedsl.core.model.LegalResult;
import io.statutedsl.core.model.Value;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionEvaluator")
class ConditionEvaluatorTest {

    private static final ConditionNode ADULT = new Comparison("age", ComparisonOp.GREATER_OR_EQUAL, Value.of(18));

    private static LegalResult<Boolean> eval(ConditionNode node, Entity entity) {
        return new ConditionEvaluator(entity, Map.of(), true).evaluate(node);
    }

    private static void assertDeterministic(LegalResult<Boolean> result, boolean expected) {
        assertThat(result).isEqualTo(LegalResult.deterministic(expected));
    }

    private static LegalResult.JudicialDiscretion<Boolean> discretion(LegalResult<Boolean> result) {
        assertThat(result.isDiscretion()).as("expected discretion but got %s", result).isTrue();
        return (LegalResult.JudicialDiscretion<Boolean>) result;
    }

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        @DisplayName("ordering on numbers")
        void numbers() {
            assertDeterministic(eval(ADULT, Entity.builder().put("age", 20).build()), true);
            assertDeterministic(eval(ADULT, Entity.builder().put("age", 18).build()), true);
            assertDeterministic(eval(ADULT, Entity.builder().put("age", 16).build()), false);
        }

        @Test
        @DisplayName("numbers compare by value, not scale")
        void scale() {
            Entity entity = Entity.builder().put("age", new BigDecimal("18.00")).build();

            assertDeterministic(eval(new Comparison("age", ComparisonOp.EQUAL, Value.of(18)), entity), true);
        }

        @Test
        @DisplayName("ordering on dates")
        void dates() {
            ConditionNode early = new Comparison("filed", ComparisonOp.LESS_OR_EQUAL, Value.of(LocalDate.of(2024, 4, 15)));

            assertDeterministic(eval(early, Entity.builder().put("filed", LocalDate.of(2024, 4, 1)).build()), true);
            assertDeterministic(eval(early, Entity.builder().put("filed", LocalDate.of(2024, 5, 1)).build()), false);
        }

        @Test
        @DisplayName("equality on strings and booleans")
        void equality() {
            Entity entity = Entity.builder().put("status", "active").put("citizen", true).build();

            assertDeterministic(eval(new Comparison("status", ComparisonOp.EQUAL, Value.of("active")), entity), true);
            assertDeterministic(eval(new Comparison("status", ComparisonOp.NOT_EQUAL, Value.of("active")), entity), false);
            assertDeterministic(eval(new Comparison("citizen", ComparisonOp.EQUAL, Value.of(false)), entity), false);
        }

        @Test
        @DisplayName("wrong kind → discretion, never coerced")
        void wrongKind() {
            Entity entity = Entity.builder().put("age", "twenty").build();

            LegalResult.JudicialDiscretion<Boolean> result = discretion(eval(ADULT, entity));
            assertThat(result.reasoning()).isEqualTo("attribute 'age' is STRING where NUMBER was expected");
            assertThat(result.factors()).containsExactly("age");

            discretion(eval(new Comparison("flag", ComparisonOp.EQUAL, Value.of("true")),
                    Entity.builder().put("flag", true).build()));
        }
    }

    @Nested
    @DisplayName("Missing and absent attributes")
    class Missing {

        @Test
        @DisplayName("missing attribute → discretion naming it")
        void missing() {
            LegalResult.JudicialDiscretion<Boolean> result = discretion(eval(ADULT, Entity.empty()));

            assertThat(result.reasoning()).isEqualTo("missing attribute 'age'");
            assertThat(result.factors()).containsExactly("age");
        }

        @Test
        @DisplayName("absent attribute → Void")
        void absent() {
            LegalResult<Boolean> result = eval(ADULT, Entity.builder().absent("age").build());

            assertThat(result).isEqualTo(LegalResult.voided("attribute 'age' is inapplicable"));
        }

        @Test
        @DisplayName("DEFAULT fills a missing attribute and is recorded")
        void defaultApplied() {
            ConditionEvaluator evaluator = new ConditionEvaluator(Entity.empty(), Map.of("age", Value.of(30)), true);

            assertDeterministic(evaluator.evaluate(ADULT), true);
            assertThat(evaluator.defaultsApplied()).containsExactly("age");
        }

        @Test
        @DisplayName("DEFAULT never replaces a present value")
        void defaultNotUsedWhenPresent() {
            ConditionEvaluator evaluator = new ConditionEvaluator(
                    Entity.builder().put("age", "unknown").build(), Map.of("age", Value.of(30)), true);

            discretion(evaluator.evaluate(ADULT));
            assertThat(evaluator.defaultsApplied()).isEmpty();
        }

        @Test
        @DisplayName("DEFAULT does not override absent")
        void defaultNotUsedWhenAbsent() {
            ConditionEvaluator evaluator = new ConditionEvaluator(
                    Entity.builder().absent("age").build(), Map.of("age", Value.of(30)), true);

            assertThat(evaluator.evaluate(ADULT).isVoid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Other primaries")
    class OtherPrimaries {

        @Test
        @DisplayName("BETWEEN is inclusive")
        void between() {
            ConditionNode working = new Between("age", Value.of(18), Value.of(65));

            assertDeterministic(eval(working, Entity.builder().put("age", 18).build()), true);
            assertDeterministic(eval(working, Entity.builder().put("age", 65).build()), true);
            assertDeterministic(eval(working, Entity.builder().put("age", 66).build()), false);
            discretion(eval(working, Entity.builder().put("age", "x").build()));
        }

        @Test
        @DisplayName("IN matches any value of the attribute's kind")
        void inSet() {
            ConditionNode region = new InSet("region", List.of(Value.of("AT"), Value.of("MT"), Value.of(3)));

            assertDeterministic(eval(region, Entity.builder().put("region", "MT").build()), true);
            assertDeterministic(eval(region, Entity.builder().put("region", "DE").build()), false);
            assertDeterministic(eval(region, Entity.builder().put("region", 3).build()), true);
            discretion(eval(region, Entity.builder().put("region", true).build()));
        }

        @Test
        @DisplayName("HAS ignores defaults and absent attributes")
        void has() {
            ConditionNode hasIncome = new HasAttribute("income");
            ConditionEvaluator withDefault =
                    new ConditionEvaluator(Entity.empty(), Map.of("income", Value.of(0)), true);

            assertDeterministic(eval(hasIncome, Entity.builder().put("income", 0).build()), true);
            assertDeterministic(eval(hasIncome, Entity.builder().absent("income").build()), false);
            assertDeterministic(withDefault.evaluate(hasIncome), false);
            assertThat(withDefault.defaultsApplied()).isEmpty();
        }

        @Test
        @DisplayName("LIKE matches globs against strings")
        void like() {
            ConditionNode pattern = new Like("name", "J?hn*");

            assertDeterministic(eval(pattern, Entity.builder().put("name", "Johnny").build()), true);
            assertDeterministic(eval(pattern, Entity.builder().put("name", "john").build()), false);
            assertDeterministic(
                    new ConditionEvaluator(Entity.builder().put("name", "john").build(), Map.of(), false)
                            .evaluate(pattern),
                    true);
            discretion(eval(pattern, Entity.builder().put("name", 5).build()));
        }
    }

    @Nested
    @DisplayName("Connectives")
    class Connectives {

        private final ConditionNode citizen = new Comparison("citizen", ComparisonOp.EQUAL, Value.of(true));

        @Test
        @DisplayName("AND with a known false short of discretion is false")
        void andFalseBeatsMissing() {
            assertDeterministic(eval(new And(ADULT, citizen), Entity.builder().put("age", 10).build()), false);
        }

        @Test
        @DisplayName("AND with true and missing is discretion")
        void andDiscretion() {
            discretion(eval(new And(ADULT, citizen), Entity.builder().put("age", 30).build()));
        }

        @Test
        @DisplayName("OR with a known true ignores missing")
        void orTrue() {
            assertDeterministic(eval(new Or(citizen, ADULT), Entity.builder().put("age", 30).build()), true);
        }

        @Test
        @DisplayName("discretion factors accumulate across the tree")
        void factors() {
            LegalResult.JudicialDiscretion<Boolean> result =
                    discretion(eval(new And(ADULT, new Or(citizen, new HasAttribute("x"))), Entity.empty()));

            assertThat(result.factors()).containsExactly("age", "citizen");
        }

        @Test
        @DisplayName("NOT of a missing attribute stays discretion")
        void notMissing() {
            discretion(eval(new Not(ADULT), Entity.empty()));
        }

        @Test
        @DisplayName("both sides are evaluated, so defaults on the right are recorded")
        void bothSidesEvaluated() {
            ConditionEvaluator evaluator = new ConditionEvaluator(
                    Entity.builder().put("citizen", true).build(), Map.of("age", Value.of(40)), true);

            assertDeterministic(evaluator.evaluate(new Or(citizen, ADULT)), true);
            assertThat(evaluator.defaultsApplied()).containsExactly("age");
        }
    }
}
