package com.tradeexecutor.safety;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable risk limits loaded once at startup.
 *
 * <p>Daily loss and drawdown each have an absolute and a percentage form; either one
 * breaching denies the trade. A null percentage disables that form.
 */
@Value
@Builder
@Jacksonized
public class SafetyLimits {

    BigDecimal maxDailyLoss;
    BigDecimal maxDailyLossPercent;
    BigDecimal maxDrawdown;
    BigDecimal maxDrawdownPercent;
    int maxPositions;
    BigDecimal maxLotSize;
    double maxCorrelation;
    BigDecimal maxTotalExposure;

    /** Units per standard lot. */
    BigDecimal contractSize;

    BigDecimal leverage;
}
