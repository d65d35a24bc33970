package com.tradeexecutor.event;

public enum StrategyEventType {

    /** Registered and monitoring started. */
    STARTED,

    PAUSED,
    RESUMED,
    UPDATED,

    /** Monitoring stopped and the strategy left the registry. Published once per stop. */
    DEACTIVATED,

    /** Monitor halted after too many consecutive tick errors. */
    MONITOR_ERROR
}
