package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "executor.reconciler")
@Getter
@Setter
public class ReconcilerConfig {

    /** Total attempts for the startup fetch of active strategies. */
    private int fetchAttempts = 3;

    /** Wait before the second attempt; doubles for each later attempt. */
    private long fetchInitialDelayMs = 1_000;

    private String crashMarkerPath = "./crash.marker";

    private long snapshotIntervalMs = 3_600_000;

    /** Execution snapshots kept; older ones are deleted after each new snapshot. */
    private int snapshotRetention = 24;
}
