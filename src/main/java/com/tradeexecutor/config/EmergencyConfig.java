package com.tradeexecutor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Automatic kill-switch triggers. */
@Configuration
@ConfigurationProperties(prefix = "executor.emergency")
@Getter
@Setter
public class EmergencyConfig {

    private boolean autoTriggerEnabled = true;

    /** Losing closed trades in a row that trip the kill switch. */
    private int maxConsecutiveLosses = 5;

    /** Monitor and dispatch failures per minute that trip the kill switch. */
    private int maxErrorRatePerMinute = 20;

    /** Submit an urgent CLOSE_ALL_POSITIONS after every trip. */
    private boolean closePositionsOnTrip = false;
}
