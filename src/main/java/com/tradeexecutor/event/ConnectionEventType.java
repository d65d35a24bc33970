package com.tradeexecutor.event;

public enum ConnectionEventType {

    /** Any state transition of a supervised connection. */
    STATUS_CHANGED,

    /** Reconnect attempts reached the struggling threshold; retries continue. */
    STRUGGLING,

    /** Reconnect attempts exhausted; no further automatic retry is scheduled. */
    MAX_ATTEMPTS_REACHED
}
