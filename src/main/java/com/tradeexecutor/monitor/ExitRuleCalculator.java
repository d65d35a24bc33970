package com.tradeexecutor.monitor;

import com.tradeexecutor.domain.enums.TradeSide;
import com.tradeexecutor.domain.model.ExitRules;
import com.tradeexecutor.domain.model.Instruments;
import com.tradeexecutor.domain.model.OpenPosition;
import com.tradeexecutor.domain.model.PartialExitRule;
import com.tradeexecutor.domain.model.StopLossRule;
import com.tradeexecutor.domain.model.TakeProfitRule;
import com.tradeexecutor.domain.model.TrailingStopRule;
import com.tradeexecutor.monitor.sizing.PositionSizerFactory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Price maths for exits. Entry-time levels are fixed once per signal; trailing stops and
 * partial closes are recomputed against live positions by {@link ExitManagementService}.
 */
@Component
public class ExitRuleCalculator {

    /**
     * Stop and target prices for an entry. Either may be null when its rule is absent or
     * cannot be resolved (an ATR stop without ATR data, a ratio target without a stop).
     */
    public record ExitLevels(BigDecimal stopLoss, BigDecimal takeProfit, double stopLossPips) {}

    public ExitLevels calculate(
            String symbol, TradeSide side, double entryPrice, ExitRules rules, OptionalDouble atr) {
        if (rules == null || side == null || !(entryPrice > 0)) {
            return new ExitLevels(null, null, 0);
        }
        double pipSize = Instruments.pipSize(symbol);
        int sign = side.sign();

        double stopDistance = stopDistance(rules.getStopLoss(), entryPrice, pipSize, atr);
        double targetDistance = targetDistance(rules.getTakeProfit(), entryPrice, pipSize, stopDistance);

        BigDecimal stopLoss = stopDistance > 0 ? price(symbol, entryPrice - sign * stopDistance) : null;
        BigDecimal takeProfit = targetDistance > 0 ? price(symbol, entryPrice + sign * targetDistance) : null;
        return new ExitLevels(stopLoss, takeProfit, stopDistance > 0 ? stopDistance / pipSize : 0);
    }

    private static double stopDistance(StopLossRule rule, double entryPrice, double pipSize, OptionalDouble atr) {
        if (rule == null || rule.getValue() <= 0) {
            return 0;
        }
        return switch (rule.getType()) {
            case FIXED -> rule.getValue() * pipSize;
            case PERCENT -> entryPrice * rule.getValue() / 100.0;
            case ATR -> atr.isPresent() ? atr.getAsDouble() * rule.getValue() : 0;
        };
    }

    private static double targetDistance(TakeProfitRule rule, double entryPrice, double pipSize, double stopDistance) {
        if (rule == null || rule.getValue() <= 0) {
            return 0;
        }
        return switch (rule.getType()) {
            case FIXED -> rule.getValue() * pipSize;
            case PERCENT -> entryPrice * rule.getValue() / 100.0;
            case RATIO -> stopDistance * rule.getValue();
        };
    }

    // ========================
    // RUNTIME MANAGEMENT
    // ========================

    /**
     * New stop for a position under a trailing rule, if the trail has activated and the
     * new stop is strictly better than the current one. Stops only ever tighten.
     */
    public Optional<BigDecimal> trailingStop(OpenPosition position, TrailingStopRule rule) {
        if (rule == null || !rule.isEnabled() || rule.getDistancePips() <= 0 || !hasPrices(position)) {
            return Optional.empty();
        }
        String symbol = position.getSymbol();
        double pipSize = Instruments.pipSize(symbol);
        int sign = position.getSide().sign();
        double current = position.getCurrentPrice().doubleValue();
        double profitPips = (current - position.getOpenPrice().doubleValue()) * sign / pipSize;
        if (profitPips < rule.getActivationPips()) {
            return Optional.empty();
        }
        BigDecimal candidate = price(symbol, current - sign * rule.getDistancePips() * pipSize);
        BigDecimal existing = position.getStopLoss();
        if (existing != null && existing.signum() > 0 && candidate.subtract(existing).signum() * sign <= 0) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * Volume to close under a partial-exit rule once profit reaches {@code atRiskMultiple}
     * times {@code initialRisk} (a price distance). Empty when not reached, or when the
     * close would take the whole position.
     */
    public Optional<BigDecimal> partialExitVolume(OpenPosition position, PartialExitRule rule, double initialRisk) {
        if (rule == null || !rule.isEnabled() || initialRisk <= 0 || !hasPrices(position)
                || position.getVolume() == null) {
            return Optional.empty();
        }
        int sign = position.getSide().sign();
        double profitDistance = (position.getCurrentPrice().doubleValue() - position.getOpenPrice().doubleValue()) * sign;
        if (profitDistance < rule.getAtRiskMultiple() * initialRisk) {
            return Optional.empty();
        }
        BigDecimal closeVolume = position.getVolume().multiply(BigDecimal.valueOf(rule.getCloseFraction()))
                .setScale(2, RoundingMode.HALF_UP);
        if (closeVolume.compareTo(PositionSizerFactory.MIN_LOT) < 0 || closeVolume.compareTo(position.getVolume()) >= 0) {
            return Optional.empty();
        }
        return Optional.of(closeVolume);
    }

    private static boolean hasPrices(OpenPosition position) {
        return position.getSide() != null && position.getOpenPrice() != null && position.getCurrentPrice() != null;
    }

    private static BigDecimal price(String symbol, double value) {
        return BigDecimal.valueOf(value).setScale(Instruments.priceScale(symbol), RoundingMode.HALF_UP);
    }
}
