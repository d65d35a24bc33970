package com.tradeexecutor.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum TradeSide {
    BUY,
    SELL;

    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL; used to orient price offsets. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public static Optional<TradeSide> fromWire(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim().toUpperCase(Locale.ROOT);
        if (text.equals("BUY") || text.equals("LONG")) {
            return Optional.of(BUY);
        }
        if (text.equals("SELL") || text.equals("SHORT")) {
            return Optional.of(SELL);
        }
        return Optional.empty();
    }
}
