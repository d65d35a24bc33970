package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.TakeProfitType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TakeProfitRule {

    @Builder.Default
    TakeProfitType type = TakeProfitType.FIXED;

    /** Pips for FIXED, percent for PERCENT, reward-to-risk multiple for RATIO. */
    double value;
}
