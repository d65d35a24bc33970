package com.tradeexecutor.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradeexecutor.domain.enums.StopLossType;
import com.tradeexecutor.domain.enums.TakeProfitType;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.PartialExitRule;
import com.tradeexecutor.domain.model.StopLossRule;
import com.tradeexecutor.domain.model.TakeProfitRule;
import com.tradeexecutor.domain.model.TrailingStopRule;
import com.tradeexecutor.monitor.ExitRuleCalculator;
import com.tradeexecutor.monitor.ExitRuleCalculator.ExitLevels;
import java.math.BigDecimal;
import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExitRuleCalculatorTest {

    private final ExitRuleCalculator calculator = new ExitRuleCalculator();

    private static ExitRules rules(StopLossType slType, double slValue, TakeProfitType tpType, double tpValue) {
        return ExitRules.builder()
                .stopLoss(StopLossRule.builder().type(slType).value(slValue).build())
                .takeProfit(TakeProfitRule.builder().type(tpType).value(tpValue).build())
                .build();
    }

    private static OpenPosition position(TradeSide side, String open, String current, String stopLoss, String volume) {
        return OpenPosition.builder()
                .ticket("1")
                .symbol("EURUSD")
                .side(side)
                .openPrice(new BigDecimal(open))
                .currentPrice(new BigDecimal(current))
                .stopLoss(stopLoss != null ? new BigDecimal(stopLoss) : null)
                .volume(new BigDecimal(volume))
                .build();
    }

    // ========================
    // ENTRY LEVELS
    // ========================

    @Nested
    @DisplayName("Entry levels")
    class EntryLevels {

        @Test
        @DisplayName("BUY with a 20 pip stop and 2R target")
        void buyFixedStopRatioTarget() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.BUY, 1.08500,
                    rules(StopLossType.FIXED, 20, TakeProfitType.RATIO, 2), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isEqualByComparingTo("1.08300");
            assertThat(levels.takeProfit()).isEqualByComparingTo("1.08900");
            assertThat(levels.stopLossPips()).isCloseTo(20.0, within(1e-6));
        }

        @Test
        @DisplayName("SELL mirrors the levels around the entry")
        void sellMirrors() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.SELL, 1.08500,
                    rules(StopLossType.FIXED, 20, TakeProfitType.FIXED, 40), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isEqualByComparingTo("1.08700");
            assertThat(levels.takeProfit()).isEqualByComparingTo("1.08100");
        }

        @Test
        @DisplayName("JPY pairs use a 0.01 pip and three decimals")
        void jpyPip() {
            ExitLevels levels = calculator.calculate("USDJPY", TradeSide.BUY, 150.000,
                    rules(StopLossType.FIXED, 30, TakeProfitType.FIXED, 60), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isEqualByComparingTo("149.700");
            assertThat(levels.stopLoss().scale()).isEqualTo(3);
            assertThat(levels.takeProfit()).isEqualByComparingTo("150.600");
        }

        @Test
        @DisplayName("Percent stop is a share of the entry price")
        void percentStop() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.BUY, 1.08500,
                    rules(StopLossType.PERCENT, 1, TakeProfitType.PERCENT, 2), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isEqualByComparingTo("1.07415");
            assertThat(levels.takeProfit()).isEqualByComparingTo("1.10670");
        }

        @Test
        @DisplayName("ATR stop uses ATR times the multiple")
        void atrStop() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.BUY, 1.08500,
                    rules(StopLossType.ATR, 1.5, TakeProfitType.RATIO, 1), OptionalDouble.of(0.0020));

            assertThat(levels.stopLoss()).isEqualByComparingTo("1.08200");
            assertThat(levels.takeProfit()).isEqualByComparingTo("1.08800");
        }

        @Test
        @DisplayName("ATR stop without ATR data leaves both stop and ratio target unset")
        void atrStopWithoutData() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.BUY, 1.08500,
                    rules(StopLossType.ATR, 1.5, TakeProfitType.RATIO, 2), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isNull();
            assertThat(levels.takeProfit()).isNull();
            assertThat(levels.stopLossPips()).isZero();
        }

        @Test
        @DisplayName("No rules give no levels")
        void noRules() {
            ExitLevels levels = calculator.calculate("EURUSD", TradeSide.BUY, 1.08500, ExitRules.none(), OptionalDouble.empty());

            assertThat(levels.stopLoss()).isNull();
            assertThat(levels.takeProfit()).isNull();
        }
    }

    // ========================
    // TRAILING STOP
    // ========================

    @Nested
    @DisplayName("Trailing stop")
    class Trailing {

        private final TrailingStopRule rule =
                TrailingStopRule.builder().enabled(true).activationPips(20).distancePips(15).build();

        @Test
        @DisplayName("Once activated the stop trails the price by the distance")
        void trailsBuy() {
            assertThat(calculator.trailingStop(position(TradeSide.BUY, "1.08500", "1.08800", "1.08300", "0.10"), rule))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("1.08650"));
        }

        @Test
        @DisplayName("SELL trails above the price")
        void trailsSell() {
            assertThat(calculator.trailingStop(position(TradeSide.SELL, "1.08500", "1.08200", "1.08700", "0.10"), rule))
                    .hasValueSatisfying(stop -> assertThat(stop).isEqualByComparingTo("1.08350"));
        }

        @Test
        @DisplayName("Below the activation profit nothing moves")
        void notActivated() {
            assertThat(calculator.trailingStop(position(TradeSide.BUY, "1.08500", "1.08600", "1.08300", "0.10"), rule))
                    .isEmpty();
        }

        @Test
        @DisplayName("A stop never loosens")
        void neverLoosens() {
            assertThat(calculator.trailingStop(position(TradeSide.BUY, "1.08500", "1.08800", "1.08700", "0.10"), rule))
                    .isEmpty();
        }
    }

    // ========================
    // PARTIAL EXIT
    // ========================

    @Nested
    @DisplayName("Partial exit")
    class Partial {

        private final PartialExitRule rule =
                PartialExitRule.builder().enabled(true).atRiskMultiple(1.5).closeFraction(0.5).build();

        @Test
        @DisplayName("Closes the configured fraction once profit reaches the risk multiple")
        void closesFraction() {
            assertThat(calculator.partialExitVolume(
                    position(TradeSide.BUY, "1.08500", "1.08900", null, "0.10"), rule, 0.0020))
                    .hasValueSatisfying(volume -> assertThat(volume).isEqualByComparingTo("0.05"));
        }

        @Test
        @DisplayName("Not reached yet")
        void notReached() {
            assertThat(calculator.partialExitVolume(
                    position(TradeSide.BUY, "1.08500", "1.08700", null, "0.10"), rule, 0.0020)).isEmpty();
        }

        @Test
        @DisplayName("A close that would take the whole position is skipped")
        void wholePositionSkipped() {
            assertThat(calculator.partialExitVolume(
                    position(TradeSide.BUY, "1.08500", "1.08900", null, "0.01"), rule, 0.0020)).isEmpty();
        }
    }
}
