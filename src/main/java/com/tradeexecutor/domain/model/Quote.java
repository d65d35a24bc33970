package com.tradeexecutor.domain.model;

/** Current bid/ask for a symbol; {@code point} is the smallest price increment. */
public record Quote(String symbol, double bid, double ask, double point) {

    public double spread() {
        return ask - bid;
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }
}
