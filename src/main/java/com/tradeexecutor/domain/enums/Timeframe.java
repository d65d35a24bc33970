package com.tradeexecutor.domain.enums;

import java.time.Duration;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Chart timeframe of a strategy. Each timeframe carries the bar length used for market
 * data requests and the evaluation tick interval used by the strategy monitor.
 */
@Getter
@RequiredArgsConstructor
public enum Timeframe {
    M1(Duration.ofMinutes(1), Duration.ofSeconds(1)),
    M5(Duration.ofMinutes(5), Duration.ofSeconds(5)),
    M15(Duration.ofMinutes(15), Duration.ofSeconds(15)),
    M30(Duration.ofMinutes(30), Duration.ofSeconds(30)),
    H1(Duration.ofHours(1), Duration.ofSeconds(60)),
    H4(Duration.ofHours(4), Duration.ofSeconds(240)),
    D1(Duration.ofDays(1), Duration.ofSeconds(300));

    /** Fallback tick interval for timeframes the executor does not recognise. */
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(60);

    private final Duration barDuration;
    private final Duration checkInterval;

    /** Lenient parse; unknown values fall back to {@code fallback}. */
    public static Timeframe parse(String value, Timeframe fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
