package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.model.RiskParameters;
import java.math.BigDecimal;
import java.util.OptionalDouble;

/**
 * Inputs for sizing one entry.
 *
 * @param stopLossPips distance from entry to stop in pips; zero when the strategy has no stop
 * @param atr current ATR in price units, when available
 */
public record SizingRequest(
        String symbol,
        RiskParameters risk,
        BigDecimal balance,
        double stopLossPips,
        OptionalDouble atr,
        BigDecimal defaultVolume) {}
