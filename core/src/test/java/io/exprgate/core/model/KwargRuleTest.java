package io.exprgate.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprgate.core.error.RuleSchemaException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KwargRule")
class KwargRuleTest {

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("allowed values must match the declared type")
        void allowedMustMatchType() {
            assertThatThrownBy(() -> KwargRule.oneOf(KwargType.INT, List.of(1L, "two")))
                    .isInstanceOf(RuleSchemaException.class)
                    .hasMessage("Allowed value two does not match declared kwarg type 'int'");
        }

        @Test
        @DisplayName("float rules may enumerate integers")
        void floatAllowsIntegers() {
            assertThat(KwargRule.oneOf(KwargType.FLOAT, List.of(1L, 0.5)).allowed()).containsExactly(1L, 0.5);
        }

        @Test
        @DisplayName("bounds need a numeric type")
        void boundsNeedNumericType() {
            assertThatThrownBy(() -> KwargRule.range(KwargType.STR, 0.0, 1.0))
                    .isInstanceOf(RuleSchemaException.class);
            assertThatThrownBy(() -> KwargRule.range(KwargType.BOOL, null, 1.0))
                    .isInstanceOf(RuleSchemaException.class);
        }

        @Test
        @DisplayName("min must not exceed max")
        void minNotAboveMax() {
            assertThatThrownBy(() -> KwargRule.range(KwargType.FLOAT, 2.0, 1.0))
                    .isInstanceOf(RuleSchemaException.class)
                    .hasMessage("min_val 2.0 exceeds max_val 1.0");
        }

        @Test
        @DisplayName("allowed list is copied and unmodifiable")
        void allowedIsImmutable() {
            KwargRule rule = KwargRule.oneOf(KwargType.STR, List.of("a"));

            assertThatThrownBy(() -> rule.allowed().add("b")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("checks")
    class Checks {

        @Test
        @DisplayName("inclusive and exclusive bounds")
        void bounds() {
            KwargRule inclusive = KwargRule.range(KwargType.FLOAT, 0.0, 1.0);
            KwargRule exclusive = new KwargRule(KwargType.FLOAT, List.of(), 0.0, 1.0, false, false);

            assertThat(inclusive.inRange(0.0)).isTrue();
            assertThat(inclusive.inRange(1.0)).isTrue();
            assertThat(exclusive.inRange(0.0)).isFalse();
            assertThat(exclusive.inRange(1.0)).isFalse();
            assertThat(exclusive.inRange(0.5)).isTrue();
            assertThat(exclusive.describeBounds()).isEqualTo("(0.0, 1.0)");
        }

        @Test
        @DisplayName("open-ended bounds")
        void openEnded() {
            KwargRule rule = KwargRule.range(KwargType.NUMBER, null, 10.0);

            assertThat(rule.inRange(-1e9)).isTrue();
            assertThat(rule.inRange(10.5)).isFalse();
            assertThat(rule.describeBounds()).isEqualTo("(-inf, 10.0]");
        }

        @Test
        @DisplayName("numbers are compared by value")
        void numericPermits() {
            KwargRule rule = KwargRule.oneOf(KwargType.FLOAT, List.of(3.0));

            assertThat(rule.permits(3L)).isTrue();
            assertThat(rule.permits(3.5)).isFalse();
        }

        @Test
        @DisplayName("booleans never equal numbers")
        void booleansAreNotNumbers() {
            KwargRule rule = KwargRule.oneOf(KwargType.ANY, List.of(1L, "x"));

            assertThat(rule.permits(true)).isFalse();
            assertThat(rule.permits("x")).isTrue();
        }
    }

    @Test
    @DisplayName("type ids round-trip and unknown ids fail")
    void typeIds() {
        assertThat(KwargType.fromId("float")).isEqualTo(KwargType.FLOAT);
        assertThat(KwargType.FLOAT.accepts(LiteralKind.INT)).isTrue();
        assertThat(KwargType.INT.accepts(LiteralKind.FLOAT)).isFalse();
        assertThat(KwargType.NUMBER.accepts(LiteralKind.BOOL)).isFalse();
        assertThatThrownBy(() -> KwargType.fromId("double"))
                .isInstanceOf(RuleSchemaException.class)
                .hasMessageStartingWith("Unknown kwarg type 'double'");
    }
}
