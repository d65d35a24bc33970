package com.tradeexecutor.marketdata;

import com.tradeexecutor.domain.enums.Timeframe;
import com.tradeexecutor.domain.model.Instruments;
import com.tradeexecutor.domain.model.PriceBar;
import com.tradeexecutor.domain.model.Quote;
import com.tradeexecutor.exception.TransportException;
import com.tradeexecutor.transport.TerminalAction;
import com.tradeexecutor.transport.TerminalRequest;
import com.tradeexecutor.transport.TerminalResponse;
import com.tradeexecutor.transport.TerminalTransport;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Reads bars and quotes from the trading terminal. */
@Component
public class TerminalMarketDataSource implements MarketDataSource {

    private final TerminalTransport terminalTransport;

    public TerminalMarketDataSource(TerminalTransport terminalTransport) {
        this.terminalTransport = terminalTransport;
    }

    @Override
    public List<PriceBar> fetchBars(String symbol, Timeframe timeframe, int count) {
        TerminalResponse response = terminalTransport.request(TerminalRequest.of(
                TerminalAction.GET_BARS, Map.of("symbol", symbol, "timeframe", timeframe.name(), "count", count)));
        if (!response.isSuccess()) {
            throw new TransportException("Bars for " + symbol + " unavailable: " + response.getError());
        }
        List<PriceBar> bars = new ArrayList<>();
        for (Map<String, Object> bar : response.getList("bars")) {
            bars.add(new PriceBar(
                    Instant.ofEpochMilli((long) number(bar.get("time"))),
                    number(bar.get("open")),
                    number(bar.get("high")),
                    number(bar.get("low")),
                    number(bar.get("close")),
                    number(bar.get("volume"))));
        }
        bars.sort(Comparator.comparing(PriceBar::time));
        return bars;
    }

    @Override
    public Quote fetchQuote(String symbol) {
        TerminalResponse response =
                terminalTransport.request(TerminalRequest.of(TerminalAction.GET_QUOTE, Map.of("symbol", symbol)));
        if (!response.isSuccess()) {
            throw new TransportException("Quote for " + symbol + " unavailable: " + response.getError());
        }
        return new Quote(
                symbol,
                response.getDouble("bid", Double.NaN),
                response.getDouble("ask", Double.NaN),
                response.getDouble("point", Instruments.pipSize(symbol) / 10));
    }

    private static double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value != null ? Double.parseDouble(value.toString()) : 0.0;
    }
}
