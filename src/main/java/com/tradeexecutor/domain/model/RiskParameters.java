package com.tradeexecutor.domain.model;

import com.tradeexecutor.domain.enums.SizingMethod;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RiskParameters {

    @Builder.Default
    SizingMethod sizingMethod = SizingMethod.FIXED_LOT;

    /** Lot size for FIXED_LOT; null means the configured default volume. */
    BigDecimal lotSize;

    @Builder.Default
    double riskPercent = 1.0;

    @Builder.Default
    int atrPeriod = 14;

    @Builder.Default
    double atrMultiplier = 1.5;

    public static RiskParameters defaults() {
        return RiskParameters.builder().build();
    }
}
