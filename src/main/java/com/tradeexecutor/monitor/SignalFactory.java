package com.tradeexecutor.monitor;

import com.tradeexecutor.config.MonitorConfig;
import com.tradeexecutor.domain.enums.ConditionOperator;
import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.AccountSnapshot;
import com.tradeexecutor.domain.model.ActiveStrategy;
import com.tradeexecutor.domain.model.ProposedTrade;
import com.tradeexecutor.domain.model.Signal;
import com.tradeexecutor.domain.model.StrategyCondition;
import com.tradeexecutor.marketdata.MarketSnapshot;
import com.tradeexecutor.marketdata.indicator.IndicatorCalculator;
import com.tradeexecutor.monitor.ConditionEvaluator.Evaluation;
import com.tradeexecutor.monitor.ExitRuleCalculator.ExitLevels;
import com.tradeexecutor.monitor.sizing.PositionSizerFactory;
import com.tradeexecutor.monitor.sizing.SizingRequest;
import com.tradeexecutor.safety.SafetyDecision;
import com.tradeexecutor.safety.SafetyGate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * Turns a met entry evaluation into a sized, safety-checked {@link Signal}.
 *
 * <p>Steps: resolve direction, fix stop and target prices, size the position, then run the
 * safety gate. A denied trade yields no signal; the gate has already published TRADE_DENIED.
 */
@Component
public class SignalFactory {

    private final ExitRuleCalculator exitRuleCalculator;
    private final PositionSizerFactory positionSizerFactory;
    private final IndicatorCalculator indicatorCalculator;
    private final SafetyGate safetyGate;
    private final MonitorConfig monitorConfig;
    private final Clock clock;

    public SignalFactory(
            ExitRuleCalculator exitRuleCalculator,
            PositionSizerFactory positionSizerFactory,
            IndicatorCalculator indicatorCalculator,
            SafetyGate safetyGate,
            MonitorConfig monitorConfig,
            Clock clock) {
        this.exitRuleCalculator = exitRuleCalculator;
        this.positionSizerFactory = positionSizerFactory;
        this.indicatorCalculator = indicatorCalculator;
        this.safetyGate = safetyGate;
        this.monitorConfig = monitorConfig;
        this.clock = clock;
    }

    /** Result of {@link #create}: a signal when approved, otherwise the gate's denial. */
    public record Outcome(Signal signal, SafetyDecision decision) {

        public boolean approved() {
            return signal != null;
        }
    }

    public Outcome create(
            ActiveStrategy strategy, MarketSnapshot snapshot, Evaluation evaluation, AccountSnapshot account) {
        String symbol = snapshot.getSymbol();
        TradeSide direction = strategy.getSide() != null ? strategy.getSide() : inferDirection(strategy, evaluation);
        double entryPrice = snapshot.lastPrice();

        int atrPeriod = strategy.getExitRules().getStopLoss() != null
                ? strategy.getExitRules().getStopLoss().getAtrPeriod()
                : strategy.getRiskParameters().getAtrPeriod();
        OptionalDouble atr = indicatorCalculator.value(snapshot, "ATR", Map.of("period", (double) atrPeriod));

        ExitLevels levels = exitRuleCalculator.calculate(symbol, direction, entryPrice, strategy.getExitRules(), atr);

        BigDecimal volume = positionSizerFactory.size(new SizingRequest(
                symbol,
                strategy.getRiskParameters(),
                account.getBalance(),
                levels.stopLossPips(),
                atr,
                monitorConfig.getDefaultVolume()));

        ProposedTrade trade = ProposedTrade.builder()
                .strategyId(strategy.getId())
                .symbol(symbol)
                .side(direction)
                .volume(volume)
                .build();
        SafetyDecision decision = safetyGate.check(trade, account);
        if (decision.isDenied()) {
            return new Outcome(null, decision);
        }

        List<String> reasons = new ArrayList<>();
        reasons.add("Entry conditions met (" + strategy.getEntryLogic() + ")");
        reasons.addAll(evaluation.metReasons());

        Instant now = clock.instant();
        Signal signal = Signal.builder()
                .id(newSignalId(now))
                .strategyId(strategy.getId())
                .symbol(symbol)
                .direction(direction)
                .entryPrice(BigDecimal.valueOf(entryPrice).setScale(8, RoundingMode.HALF_UP).stripTrailingZeros())
                .stopLoss(levels.stopLoss())
                .takeProfit(levels.takeProfit())
                .volume(volume)
                .confidence(monitorConfig.getDefaultConfidence())
                .reasons(List.copyOf(reasons))
                .createdAt(now)
                .build();
        return new Outcome(signal, decision);
    }

    /**
     * Direction for strategies without a fixed side, read off the first condition: RSI below
     * 50 buys, a positive MACD histogram buys, otherwise upward comparisons buy and downward
     * ones sell.
     */
    static TradeSide inferDirection(ActiveStrategy strategy, Evaluation evaluation) {
        List<StrategyCondition> conditions = strategy.getConditions();
        if (conditions.isEmpty()) {
            return TradeSide.BUY;
        }
        StrategyCondition first = conditions.get(0);
        String indicator = first.getIndicator() != null ? first.getIndicator().toUpperCase(Locale.ROOT) : "";
        double value = evaluation.results().isEmpty() ? Double.NaN : evaluation.results().get(0).currentValue();
        if (!Double.isNaN(value)) {
            if (indicator.equals("RSI")) {
                return value < 50 ? TradeSide.BUY : TradeSide.SELL;
            }
            if (indicator.startsWith("MACD")) {
                return value > 0 ? TradeSide.BUY : TradeSide.SELL;
            }
        }
        ConditionOperator operator = first.getOperator();
        if (operator == ConditionOperator.LESS_THAN
                || operator == ConditionOperator.LESS_OR_EQUAL
                || operator == ConditionOperator.CROSSES_BELOW) {
            return TradeSide.SELL;
        }
        return TradeSide.BUY;
    }

    static String newSignalId(Instant now) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "sig_" + now.toEpochMilli() + "_" + random.substring(0, Math.min(9, random.length()));
    }
}
