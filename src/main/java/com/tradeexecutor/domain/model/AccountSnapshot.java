package com.tradeexecutor.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the trading account used by the safety gate.
 *
 * <p>{@code dailyStartBalance} and {@code peakEquity} are tracked by the executor, not the
 * terminal; they anchor the percentage daily-loss and drawdown checks.
 */
@Value
@Builder(toBuilder = true)
public class AccountSnapshot {

    @Builder.Default
    BigDecimal balance = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal equity = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal dailyPnl = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal dailyStartBalance = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal peakEquity = BigDecimal.ZERO;

    @Builder.Default
    List<OpenPosition> openPositions = List.of();

    Instant capturedAt;

    public static AccountSnapshot empty() {
        return AccountSnapshot.builder().capturedAt(Instant.now()).build();
    }

    /** Today's loss as a non-negative amount; zero when the day is flat or profitable. */
    public BigDecimal dailyLoss() {
        return dailyPnl.signum() < 0 ? dailyPnl.negate() : BigDecimal.ZERO;
    }

    /** Equity drop from the tracked peak, never negative. */
    public BigDecimal drawdown() {
        BigDecimal drop = peakEquity.subtract(equity);
        return drop.signum() > 0 ? drop : BigDecimal.ZERO;
    }

    public int openPositionCount() {
        return openPositions.size();
    }

    public BigDecimal totalOpenVolume() {
        return openPositions.stream()
                .map(OpenPosition::getVolume)
                .filter(v -> v != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
