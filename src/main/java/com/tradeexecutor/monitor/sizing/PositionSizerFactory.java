package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.enums.SizingMethod;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the sizer for a strategy's sizing method and normalizes its result to
 * 0.01-lot steps with a 0.01 minimum.
 */
@Component
public class PositionSizerFactory {

    private static final Logger log = LoggerFactory.getLogger(PositionSizerFactory.class);

    public static final BigDecimal MIN_LOT = new BigDecimal("0.01");

    private final Map<SizingMethod, PositionSizer> sizers = new EnumMap<>(SizingMethod.class);

    public PositionSizerFactory(List<PositionSizer> positionSizers) {
        for (PositionSizer sizer : positionSizers) {
            sizers.put(sizer.method(), sizer);
        }
    }

    public BigDecimal size(SizingRequest request) {
        SizingMethod method = request.risk().getSizingMethod() != null
                ? request.risk().getSizingMethod()
                : SizingMethod.FIXED_LOT;
        PositionSizer sizer = sizers.getOrDefault(method, sizers.get(SizingMethod.FIXED_LOT));
        BigDecimal raw = sizer.size(request);
        BigDecimal lots = normalize(raw);
        log.debug("Sized {} with {}: raw={} lots={}", request.symbol(), method, raw, lots);
        return lots;
    }

    public static BigDecimal normalize(BigDecimal lots) {
        if (lots == null) {
            return MIN_LOT;
        }
        BigDecimal rounded = lots.setScale(2, RoundingMode.HALF_UP);
        return rounded.compareTo(MIN_LOT) < 0 ? MIN_LOT : rounded;
    }
}
