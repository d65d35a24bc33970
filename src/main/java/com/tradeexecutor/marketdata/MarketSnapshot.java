package com.tradeexecutor.marketdata;

import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.Quote;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Bars and the current quote for one symbol and timeframe, as of {@code fetchedAt}.
 * Bars are ordered oldest first; the last bar may still be forming.
 */
@Value
@Builder
public class MarketSnapshot {

    String symbol;
    Timeframe timeframe;

    @Builder.Default
    List<PriceBar> bars = List.of();

    Quote quote;
    Instant fetchedAt;

    public int barCount() {
        return bars.size();
    }

    /** Close of the most recent bar, or the quote mid when there are no bars. */
    public double lastPrice() {
        if (!bars.isEmpty()) {
            return bars.get(bars.size() - 1).close();
        }
        return quote != null ? quote.mid() : Double.NaN;
    }
}
