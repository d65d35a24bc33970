package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.enums.SizingMethod;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

@Component
public class FixedLotSizer implements PositionSizer {

    @Override
    public SizingMethod method() {
        return SizingMethod.FIXED_LOT;
    }

    @Override
    public BigDecimal size(SizingRequest request) {
        BigDecimal lotSize = request.risk().getLotSize();
        return lotSize != null && lotSize.signum() > 0 ? lotSize : request.defaultVolume();
    }
}
