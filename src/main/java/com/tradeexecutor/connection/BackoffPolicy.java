package com.tradeexecutor.connection;

import com.tradeexecutor.config.ConnectionConfig;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Exponential reconnect delay: {@code min(initial * multiplier^(attempt-1), max)}.
 *
 * <p>Non-decreasing in {@code attempt}; attempt numbers below 1 are treated as 1.
 */
@Component
public class BackoffPolicy {

    private final ConnectionConfig connectionConfig;

    public BackoffPolicy(ConnectionConfig connectionConfig) {
        this.connectionConfig = connectionConfig;
    }

    public Duration delayFor(int attempt) {
        int exponent = Math.max(attempt, 1) - 1;
        double raw = connectionConfig.getInitialDelayMs() * Math.pow(connectionConfig.getMultiplier(), exponent);
        long capped = (long) Math.min(raw, (double) connectionConfig.getMaxDelayMs());
        return Duration.ofMillis(Math.max(capped, 0));
    }
}
