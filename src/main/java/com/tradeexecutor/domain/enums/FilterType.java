package com.tradeexecutor.domain.enums;

import java.util.Locale;

public enum FilterType {
    TIME,
    SESSION,
    SPREAD,
    VOLATILITY,
    DAY_OF_WEEK,
    NEWS,
    CORRELATION,
    UNKNOWN;

    public static FilterType fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
