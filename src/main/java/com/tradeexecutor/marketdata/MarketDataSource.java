package com.tradeexecutor.marketdata;

import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.Quote;
import java.util.List;

/** Raw market data provider; implementations throw on transport failure. */
public interface MarketDataSource {

    List<PriceBar> fetchBars(String symbol, Timeframe timeframe, int count);

    Quote fetchQuote(String symbol);
}
