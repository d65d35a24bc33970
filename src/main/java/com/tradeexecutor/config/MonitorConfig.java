package com.tradeexecutor.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Strategy monitor tuning.
 *
 * <p>Properties prefix: {@code executor.monitor.*}
 */
@Configuration
@ConfigurationProperties(prefix = "executor.monitor")
@Getter
@Setter
public class MonitorConfig {

    /** Threads shared by all strategy ticks. */
    private int poolSize = 4;

    /** Bars requested per market data fetch. */
    private int barsPerFetch = 100;

    private long signalCooldownMinutes = 15;

    /** A monitor is halted once consecutive tick errors exceed this. */
    private int maxConsecutiveErrors = 10;

    /** Lifetime of a cached market snapshot. */
    private long marketDataTtlMs = 1_000;

    /** Lot size used when a strategy does not set one. */
    private BigDecimal defaultVolume = new BigDecimal("0.01");

    private int defaultConfidence = 80;

    /** Recent signals kept for the status surface. */
    private int recentSignalBuffer = 100;

    private long exitManagementIntervalMs = 10_000;

    private long accountRefreshIntervalMs = 5_000;
}
