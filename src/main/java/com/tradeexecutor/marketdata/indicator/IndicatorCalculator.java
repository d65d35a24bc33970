package com.tradeexecutor.marketdata.indicator;

import com.tradeexecutor.marketdata.MarketSnapshot;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Computes technical indicator values over a market snapshot.
 *
 * <p>{@code barsAgo = 0} is the latest bar, {@code 1} the bar before it. An unknown indicator,
 * too few bars or a non-finite result yields {@link OptionalDouble#empty()}.
 */
public interface IndicatorCalculator {

    OptionalDouble value(MarketSnapshot snapshot, String indicator, Map<String, Double> params, int barsAgo);

    default OptionalDouble value(MarketSnapshot snapshot, String indicator, Map<String, Double> params) {
        return value(snapshot, indicator, params, 0);
    }
}
