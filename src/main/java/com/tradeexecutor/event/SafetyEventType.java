package com.tradeexecutor.event;

public enum SafetyEventType {

    /** A proposed trade was refused by the safety gate. */
    TRADE_DENIED,

    KILL_SWITCH_TRIPPED,
    KILL_SWITCH_RESET,

    /** An account metric is close to its configured limit. */
    LIMIT_WARNING
}
