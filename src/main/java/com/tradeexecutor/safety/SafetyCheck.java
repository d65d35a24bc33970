package com.tradeexecutor.safety;

/** Safety gate checks, in evaluation order. */
public enum SafetyCheck {
    KILL_SWITCH,
    DAILY_LOSS,
    DRAWDOWN,
    MAX_POSITIONS,
    LOT_SIZE,
    CORRELATION,
    TOTAL_EXPOSURE
}
