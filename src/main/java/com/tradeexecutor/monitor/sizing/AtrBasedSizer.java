package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.enums.SizingMethod;
import com.tradeexecutor.domain.model.Instruments;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Risk-percent sizing with the stop distance taken as {@code ATR * atrMultiplier}. Without
 * an ATR value the strategy's own stop distance is used.
 */
@Component
public class AtrBasedSizer implements PositionSizer {

    @Override
    public SizingMethod method() {
        return SizingMethod.ATR_BASED;
    }

    @Override
    public BigDecimal size(SizingRequest request) {
        if (request.atr().isEmpty() || request.atr().getAsDouble() <= 0) {
            return PercentageRiskSizer.riskSized(request, request.stopLossPips());
        }
        double stopDistance = request.atr().getAsDouble() * request.risk().getAtrMultiplier();
        double stopPips = stopDistance / Instruments.pipSize(request.symbol());
        return PercentageRiskSizer.riskSized(request, stopPips);
    }
}
