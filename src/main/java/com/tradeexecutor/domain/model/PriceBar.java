package com.tradeexecutor.domain.model;

import java.time.Instant;

/** One OHLCV bar as delivered by the terminal. */
public record PriceBar(Instant time, double open, double high, double low, double close, double volume) {}
