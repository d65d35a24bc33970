package com.tradeexecutor.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tradeexecutor.domain.enums.ConditionOperator;
import com.tradeexecutor.domain.enums.EntryLogic;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.StrategyCondition;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.marketdata.indicator.IndicatorCalculator;
import com.tradeexecutor.monitor.ConditionEvaluator;
import com.tradeexecutor.monitor.ConditionEvaluator.ConditionResult;
import com.tradeexecutor.monitor.ConditionEvaluator.Evaluation;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for ConditionEvaluator operators, comparison values and AND/OR combination. */
class ConditionEvaluatorTest {

    private IndicatorCalculator indicatorCalculator;
    private ConditionEvaluator evaluator;
    private MarketSnapshot snapshot;

    @BeforeEach
    void setUp() {
        indicatorCalculator = mock(IndicatorCalculator.class);
        evaluator = new ConditionEvaluator(indicatorCalculator);
        snapshot = MarketSnapshot.builder().symbol("EURUSD").timeframe(Timeframe.H1).build();
    }

    private void indicator(String name, int barsAgo, double value) {
        when(indicatorCalculator.value(any(), eq(name), anyMap(), eq(barsAgo))).thenReturn(OptionalDouble.of(value));
    }

    private static StrategyCondition condition(String indicator, ConditionOperator operator, String value) {
        return StrategyCondition.builder()
                .id("c-" + indicator)
                .indicator(indicator)
                .params(Map.of("period", 14.0))
                .operator(operator)
                .value(value)
                .build();
    }

    // ========================
    // OPERATORS
    // ========================

    @Nested
    @DisplayName("Operators")
    class Operators {

        @ParameterizedTest(name = "RSI {0} {1} {2} -> {3}")
        @CsvSource({
            "25, LESS_THAN, 30, true",
            "30, LESS_THAN, 30, false",
            "30, LESS_OR_EQUAL, 30, true",
            "35, GREATER_THAN, 30, true",
            "30, GREATER_OR_EQUAL, 30, true",
            "30.00005, EQUALS, 30, true",
            "30.001, EQUALS, 30, false"
        })
        void comparisonOperators(double current, ConditionOperator operator, String value, boolean expected) {
            indicator("RSI", 0, current);

            ConditionResult result = evaluator.evaluate(condition("RSI", operator, value), snapshot);

            assertThat(result.met()).isEqualTo(expected);
            assertThat(result.currentValue()).isEqualTo(current);
        }

        @Test
        @DisplayName("CROSSES_ABOVE needs the previous bar at or below and the current bar above")
        void crossesAbove() {
            indicator("EMA", 1, 1.0840);
            indicator("EMA", 0, 1.0860);
            indicator("PRICE", 1, 1.0850);
            indicator("PRICE", 0, 1.0850);

            ConditionResult result = evaluator.evaluate(condition("EMA", ConditionOperator.CROSSES_ABOVE, "price"), snapshot);

            assertThat(result.met()).isTrue();
        }

        @Test
        @DisplayName("CROSSES_BELOW is not met when already below on the previous bar")
        void crossesBelowAlreadyBelow() {
            indicator("MACD", 1, -0.2);
            indicator("MACD", 0, -0.3);

            ConditionResult result = evaluator.evaluate(condition("MACD", ConditionOperator.CROSSES_BELOW, "0"), snapshot);

            assertThat(result.met()).isFalse();
        }

        @Test
        @DisplayName("An indicator reference such as EMA_50 is resolved with its period")
        void indicatorReference() {
            indicator("SMA", 0, 1.09);
            when(indicatorCalculator.value(any(), eq("EMA"), eq(Map.of("period", 50.0)), eq(0)))
                    .thenReturn(OptionalDouble.of(1.08));

            ConditionResult result = evaluator.evaluate(condition("SMA", ConditionOperator.GREATER_THAN, "ema_50"), snapshot);

            assertThat(result.met()).isTrue();
        }

        @Test
        @DisplayName("An uncomputable indicator is not met and reports NaN")
        void unavailableIndicator() {
            when(indicatorCalculator.value(any(), eq("ADX"), anyMap(), eq(0))).thenReturn(OptionalDouble.empty());

            ConditionResult result = evaluator.evaluate(condition("ADX", ConditionOperator.GREATER_THAN, "25"), snapshot);

            assertThat(result.met()).isFalse();
            assertThat(result.currentValue()).isNaN();
            assertThat(result.reason()).isEqualTo("ADX unavailable");
        }

        @Test
        @DisplayName("A disabled condition is never met")
        void disabledCondition() {
            StrategyCondition disabled = StrategyCondition.builder()
                    .indicator("RSI").operator(ConditionOperator.LESS_THAN).value("30").enabled(false).build();

            assertThat(evaluator.evaluate(disabled, snapshot).met()).isFalse();
        }
    }

    // ========================
    // ENTRY LOGIC
    // ========================

    @Nested
    @DisplayName("Entry logic")
    class Logic {

        private final StrategyCondition rsiBelow30 = condition("RSI", ConditionOperator.LESS_THAN, "30");
        private final StrategyCondition adxAbove25 = condition("ADX", ConditionOperator.GREATER_THAN, "25");

        @ParameterizedTest(name = "{0}: rsi={1}, adx={2} -> {3}")
        @CsvSource({
            "AND, 20, 30, true",
            "AND, 20, 10, false",
            "AND, 40, 30, false",
            "AND, 40, 10, false",
            "OR, 20, 30, true",
            "OR, 20, 10, true",
            "OR, 40, 30, true",
            "OR, 40, 10, false"
        })
        void truthTable(EntryLogic logic, double rsi, double adx, boolean expected) {
            indicator("RSI", 0, rsi);
            indicator("ADX", 0, adx);

            Evaluation evaluation = evaluator.evaluate(List.of(rsiBelow30, adxAbove25), logic, snapshot);

            assertThat(evaluation.met()).isEqualTo(expected);
            assertThat(evaluation.results()).hasSize(2);
        }

        @Test
        @DisplayName("An empty condition list never fires")
        void emptyNeverFires() {
            assertThat(evaluator.evaluate(List.of(), EntryLogic.OR, snapshot).met()).isFalse();
            assertThat(evaluator.evaluate(null, EntryLogic.AND, snapshot).met()).isFalse();
        }

        @Test
        @DisplayName("Met reasons list only the conditions that passed")
        void metReasons() {
            indicator("RSI", 0, 20);
            indicator("ADX", 0, 10);

            Evaluation evaluation = evaluator.evaluate(List.of(rsiBelow30, adxAbove25), EntryLogic.OR, snapshot);

            assertThat(evaluation.metReasons()).singleElement().asString().startsWith("met RSI(");
        }
    }
}
