package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.StopLossType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StopLossRule {

    @Builder.Default
    StopLossType type = StopLossType.FIXED;

    /** Pips for FIXED, percent for PERCENT, ATR multiple for ATR. */
    double value;

    @Builder.Default
    int atrPeriod = 14;
}
