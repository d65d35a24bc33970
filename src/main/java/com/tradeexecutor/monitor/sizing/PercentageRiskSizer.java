package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.enums.SizingMethod;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@code lots = balance * risk% / (stopLossPips * pipValue)}. */
@Component
public class PercentageRiskSizer implements PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PercentageRiskSizer.class);

    @Override
    public SizingMethod method() {
        return SizingMethod.PERCENTAGE_RISK;
    }

    @Override
    public BigDecimal size(SizingRequest request) {
        return riskSized(request, request.stopLossPips());
    }

    static BigDecimal riskSized(SizingRequest request, double stopLossPips) {
        BigDecimal balance = request.balance();
        if (stopLossPips <= 0 || balance == null || balance.signum() <= 0) {
            log.debug("Cannot risk-size {} (stop {} pips, balance {}); using default volume",
                    request.symbol(), stopLossPips, balance);
            return request.defaultVolume();
        }
        BigDecimal riskAmount = balance.multiply(BigDecimal.valueOf(request.risk().getRiskPercent()))
                .divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP);
        BigDecimal riskPerLot = BigDecimal.valueOf(stopLossPips).multiply(PIP_VALUE_PER_LOT);
        return riskAmount.divide(riskPerLot, 8, RoundingMode.HALF_UP);
    }
}
