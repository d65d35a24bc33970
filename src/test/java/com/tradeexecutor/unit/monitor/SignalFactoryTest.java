package com.tradeexecutor.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.enums.ConditionOperator;
import com.tradeexecutor.domain.enums.StopLossType;
import com.tradeexecutor.domain.enums.TakeProfitType;
import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.ProposedTrade;
import com.tradeexecutor.domain.model.StopLossRule;
import com.tradeexecutor.domain.model.StrategyCondition;
import com.tradeexecutor.domain.model.TakeProfitRule;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.marketdata.indicator.IndicatorCalculator;
import com.tradeexecutor.monitor.ConditionEvaluator.ConditionResult;
import com.tradeexecutor.monitor.ConditionEvaluator.Evaluation;
import com.tradeexecutor.monitor.ExitRuleCalculator;
import com.tradeexecutor.monitor.SignalFactory;
import com.tradeexecutor.monitor.sizing.FixedLotSizer;
import com.tradeexecutor.monitor.sizing.PositionSizerFactory;
import com.tradeexecutor.safety.SafetyCheck;
import com.tradeexecutor.safety.SafetyDecision;
import com.tradeexecutor.safety.SafetyGate;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SignalFactoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private SafetyGate safetyGate;
    private SignalFactory signalFactory;
    private MarketSnapshot snapshot;

    @BeforeEach
    void setUp() {
        IndicatorCalculator indicatorCalculator = mock(IndicatorCalculator.class);
        when(indicatorCalculator.value(any(), anyString(), anyMap())).thenReturn(OptionalDouble.empty());
        safetyGate = mock(SafetyGate.class);
        when(safetyGate.check(any(), any())).thenReturn(SafetyDecision.allow());

        signalFactory = new SignalFactory(
                new ExitRuleCalculator(),
                new PositionSizerFactory(List.of(new FixedLotSizer())),
                indicatorCalculator,
                safetyGate,
                new MonitorConfig(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        snapshot = MarketSnapshot.builder()
                .symbol("EURUSD")
                .timeframe(Timeframe.M15)
                .bars(List.of(new PriceBar(NOW, 1.0848, 1.0852, 1.0846, 1.0850, 120)))
                .build();
    }

    private static ActiveStrategy rsiStrategy(TradeSide side) {
        return ActiveStrategy.builder()
                .id("s1")
                .name("RSI reversal")
                .symbols(List.of("EURUSD"))
                .timeframe(Timeframe.M15)
                .side(side)
                .conditions(List.of(StrategyCondition.builder()
                        .id("c1").indicator("RSI").operator(ConditionOperator.LESS_THAN).value("30").build()))
                .exitRules(ExitRules.builder()
                        .stopLoss(StopLossRule.builder().type(StopLossType.FIXED).value(20).build())
                        .takeProfit(TakeProfitRule.builder().type(TakeProfitType.RATIO).value(2).build())
                        .build())
                .build();
    }

    private static Evaluation rsiAt(double value) {
        return new Evaluation(true, List.of(new ConditionResult("c1", "RSI", value, true, "met RSI")));
    }

    @Test
    @DisplayName("Approved signal carries levels, default volume and reasons")
    void approvedSignal() {
        SignalFactory.Outcome outcome = signalFactory.create(
                rsiStrategy(TradeSide.BUY), snapshot, rsiAt(25), AccountSnapshot.empty());

        assertThat(outcome.approved()).isTrue();
        assertThat(outcome.signal().getId()).startsWith("sig_" + NOW.toEpochMilli() + "_");
        assertThat(outcome.signal().getEntryPrice()).isEqualByComparingTo("1.085");
        assertThat(outcome.signal().getStopLoss()).isEqualByComparingTo("1.08300");
        assertThat(outcome.signal().getTakeProfit()).isEqualByComparingTo("1.08900");
        assertThat(outcome.signal().getVolume()).isEqualByComparingTo("0.01");
        assertThat(outcome.signal().getConfidence()).isEqualTo(80);
        assertThat(outcome.signal().getReasons()).containsExactly("Entry conditions met (AND)", "met RSI");
    }

    @Test
    @DisplayName("Direction is inferred from RSI when the strategy has no side")
    void inferredDirection() {
        assertThat(signalFactory.create(rsiStrategy(null), snapshot, rsiAt(25), AccountSnapshot.empty())
                .signal().getDirection()).isEqualTo(TradeSide.BUY);
        assertThat(signalFactory.create(rsiStrategy(null), snapshot, rsiAt(75), AccountSnapshot.empty())
                .signal().getDirection()).isEqualTo(TradeSide.SELL);
    }

    @Test
    @DisplayName("The proposed trade is run through the safety gate; a denial yields no signal")
    void denialYieldsNoSignal() {
        when(safetyGate.check(any(), any())).thenReturn(
                SafetyDecision.denied(SafetyCheck.DAILY_LOSS, "Daily loss 520 reached limit 500", Map.of()));

        SignalFactory.Outcome outcome = signalFactory.create(
                rsiStrategy(TradeSide.SELL), snapshot, rsiAt(75), AccountSnapshot.empty());

        assertThat(outcome.approved()).isFalse();
        assertThat(outcome.decision().getReason()).isEqualTo("Daily loss 520 reached limit 500");
        ArgumentCaptor<ProposedTrade> captor = ArgumentCaptor.forClass(ProposedTrade.class);
        verify(safetyGate).check(captor.capture(), any());
        assertThat(captor.getValue().getSide()).isEqualTo(TradeSide.SELL);
        assertThat(captor.getValue().getVolume()).isEqualByComparingTo(new BigDecimal("0.01"));
    }
}
