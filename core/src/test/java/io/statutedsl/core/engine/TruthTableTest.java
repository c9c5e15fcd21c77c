package io.statutedsl.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.statutedsl.core.model.LegalResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TruthTable")
class TruthTableTest {

    private static final LegalResult<Boolean> T = TruthTable.of(true);
    private static final LegalResult<Boolean> F = TruthTable.of(false);
    private static final LegalResult<Boolean> D = LegalResult.discretion("missing attribute 'x'", List.of("x"));
    private static final LegalResult<Boolean> D2 = LegalResult.discretion("missing attribute 'y'", List.of("y", "x"));
    private static final LegalResult<Boolean> V = LegalResult.voided("attribute 'v' is inapplicable");

    @Nested
    @DisplayName("AND")
    class And {

        @Test
        @DisplayName("Void dominates")
        void voidDominates() {
            assertThat(TruthTable.and(V, T)).isSameAs(V);
            assertThat(TruthTable.and(F, V)).isSameAs(V);
            assertThat(TruthTable.and(D, V)).isSameAs(V);
        }

        @Test
        @DisplayName("false beats discretion")
        void falseBeatsDiscretion() {
            assertThat(TruthTable.and(D, F)).isEqualTo(F);
            assertThat(TruthTable.and(F, D)).isEqualTo(F);
        }

        @Test
        @DisplayName("discretion beats true")
        void discretionBeatsTrue() {
            assertThat(TruthTable.and(T, D)).isSameAs(D);
            assertThat(TruthTable.and(D, T)).isSameAs(D);
        }

        @Test
        @DisplayName("true only when both sides are true")
        void bothTrue() {
            assertThat(TruthTable.and(T, T)).isEqualTo(T);
            assertThat(TruthTable.and(T, F)).isEqualTo(F);
        }

        @Test
        @DisplayName("two discretions merge factors, left first")
        void merge() {
            LegalResult<Boolean> merged = TruthTable.and(D, D2);

            assertThat(merged).isInstanceOf(LegalResult.JudicialDiscretion.class);
            LegalResult.JudicialDiscretion<Boolean> discretion = (LegalResult.JudicialDiscretion<Boolean>) merged;
            assertThat(discretion.reasoning()).isEqualTo("missing attribute 'x'");
            assertThat(discretion.factors()).containsExactly("x", "y");
        }
    }

    @Nested
    @DisplayName("OR")
    class Or {

        @Test
        @DisplayName("true wins over everything")
        void trueWins() {
            assertThat(TruthTable.or(V, T)).isEqualTo(T);
            assertThat(TruthTable.or(D, T)).isEqualTo(T);
            assertThat(TruthTable.or(T, F)).isEqualTo(T);
        }

        @Test
        @DisplayName("discretion beats Void and false")
        void discretion() {
            assertThat(TruthTable.or(D, V)).isSameAs(D);
            assertThat(TruthTable.or(F, D)).isSameAs(D);
        }

        @Test
        @DisplayName("Void only when both sides are Void")
        void voidBothSides() {
            assertThat(TruthTable.or(V, V)).isSameAs(V);
            assertThat(TruthTable.or(V, F)).isEqualTo(F);
            assertThat(TruthTable.or(F, V)).isEqualTo(F);
        }

        @Test
        @DisplayName("false when both sides are false")
        void bothFalse() {
            assertThat(TruthTable.or(F, F)).isEqualTo(F);
        }
    }

    @Test
    @DisplayName("NOT flips deterministic values and passes the rest through")
    void not() {
        assertThat(TruthTable.not(T)).isEqualTo(F);
        assertThat(TruthTable.not(F)).isEqualTo(T);
        assertThat(TruthTable.not(D)).isSameAs(D);
        assertThat(TruthTable.not(V)).isSameAs(V);
    }

    @Test
    @DisplayName("isTrue and isFalse only see deterministic values")
    void predicates() {
        assertThat(TruthTable.isTrue(T)).isTrue();
        assertThat(TruthTable.isFalse(F)).isTrue();
        assertThat(TruthTable.isTrue(D)).isFalse();
        assertThat(TruthTable.isFalse(D)).isFalse();
        assertThat(TruthTable.isFalse(V)).isFalse();
    }
}
