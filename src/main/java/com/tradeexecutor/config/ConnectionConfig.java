package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Reconnect backoff shared by every supervised connection. */
@Configuration
@ConfigurationProperties(prefix = "executor.connection")
@Getter
@Setter
public class ConnectionConfig {

    private long initialDelayMs = 1_000;

    private long maxDelayMs = 60_000;

    private double multiplier = 2.0;

    /** Attempt count at which a STRUGGLING warning is published. */
    private int strugglingThreshold = 3;

    /** Attempt count after which automatic reconnection stops. */
    private int maxAttempts = 10;
}
