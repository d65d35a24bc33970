package com.tradeexecutor.domain.model;

import java.util.Locale;

/**
 * Per-symbol price conventions. The executor trades FX majors and metals, where the pip
 * is 0.0001 except for yen crosses (0.01) and gold (0.1).
 */
public final class Instruments {

    private Instruments() {}

    public static boolean isJpyPair(String symbol) {
        return symbol != null && symbol.toUpperCase(Locale.ROOT).contains("JPY");
    }

    public static boolean isGold(String symbol) {
        return symbol != null && symbol.toUpperCase(Locale.ROOT).startsWith("XAU");
    }

    public static double pipSize(String symbol) {
        if (isJpyPair(symbol)) {
            return 0.01;
        }
        if (isGold(symbol)) {
            return 0.1;
        }
        return 0.0001;
    }

    /** Decimal places used when rounding prices for the terminal. */
    public static int priceScale(String symbol) {
        if (isJpyPair(symbol)) {
            return 3;
        }
        if (isGold(symbol)) {
            return 2;
        }
        return 5;
    }
}
