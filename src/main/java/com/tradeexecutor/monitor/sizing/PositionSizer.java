package com.tradeexecutor.monitor.sizing;

import com.tradeexecutor.domain.enums.SizingMethod;
import java.math.BigDecimal;

/** Computes an unrounded lot size for one sizing method. */
public interface PositionSizer {

    /** Account-currency value of one pip on one standard lot. */
    BigDecimal PIP_VALUE_PER_LOT = BigDecimal.TEN;

    SizingMethod method();

    BigDecimal size(SizingRequest request);
}
