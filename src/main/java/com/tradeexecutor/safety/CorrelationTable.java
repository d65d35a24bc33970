package com.tradeexecutor.safety;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Static correlation coefficients between major FX pairs.
 *
 * <p>Symmetric lookup; identical symbols are 1.0 and pairs not in the table are 0.
 */
@Component
public class CorrelationTable {

    private final Map<String, Double> coefficients = new HashMap<>();

    public CorrelationTable() {
        put("EURUSD", "GBPUSD", 0.75);
        put("EURUSD", "AUDUSD", 0.65);
        put("EURUSD", "NZDUSD", 0.60);
        put("EURUSD", "USDCHF", -0.90);
        put("EURUSD", "USDJPY", -0.40);
        put("EURUSD", "USDCAD", -0.45);
        put("GBPUSD", "AUDUSD", 0.60);
        put("GBPUSD", "EURGBP", -0.50);
        put("GBPUSD", "USDCHF", -0.70);
        put("GBPUSD", "USDJPY", -0.35);
        put("AUDUSD", "NZDUSD", 0.85);
        put("AUDUSD", "USDCAD", -0.55);
    }

    public double correlation(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        String a = first.toUpperCase(Locale.ROOT);
        String b = second.toUpperCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1.0;
        }
        return coefficients.getOrDefault(key(a, b), 0.0);
    }

    private void put(String a, String b, double value) {
        coefficients.put(key(a, b), value);
    }

    private static String key(String a, String b) {
        return a.compareTo(b) < 0 ? a + "|" + b : b + "|" + a;
    }
}
