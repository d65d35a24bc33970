package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Control-plane REST endpoint and credentials.
 *
 * <p>An empty {@code url} runs the executor detached: reconciliation falls back to the
 * local snapshot and upstream reporting is skipped.
 */
@Configuration
@ConfigurationProperties(prefix = "executor.platform")
@Getter
@Setter
public class PlatformConfig {

    private String url = "";

    private String apiKey = "";

    private String apiSecret = "";

    private long requestTimeoutMs = 15_000;

    private long heartbeatIntervalMs = 60_000;

    /** Consecutive failed heartbeats before the platform-api connection is reported as ERROR. */
    private int maxMissedHeartbeats = 3;

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }
}
