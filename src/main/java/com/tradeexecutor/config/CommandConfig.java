package com.tradeexecutor.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Command pipeline limits.
 *
 * <p>Properties prefix: {@code executor.command.*}
 */
@Configuration
@ConfigurationProperties(prefix = "executor.command")
@Getter
@Setter
public class CommandConfig {

    /** Maximum queued commands. Submissions beyond this are rejected with QUEUE_FULL. */
    private int queueCapacity = 1000;

    /** Terminal sends allowed per rate-limit window. */
    private int rateLimitPerWindow = 100;

    private long rateLimitWindowMs = 60_000;

    /** Per-send timeout when the command carries none of its own. */
    private long sendTimeoutMs = 30_000;

    /** Default retry budget when the inbound message omits maxRetries. */
    private int maxRetries = 3;

    /** Delay before retry n (1-based); the last entry repeats for later attempts. */
    private List<Long> retryDelaysMs = new ArrayList<>(List.of(1_000L, 2_000L, 5_000L, 10_000L, 30_000L));

    /** Completed commands kept for status lookups. */
    private int historySize = 1000;

    public long retryDelayMs(int retryNumber) {
        if (retryDelaysMs == null || retryDelaysMs.isEmpty()) {
            return 0;
        }
        int index = Math.min(Math.max(retryNumber, 1), retryDelaysMs.size()) - 1;
        return retryDelaysMs.get(index);
    }
}
