package com.tradeexecutor.event;

/**
 * Severity attached to safety and system events.
 *
 * <p>CRITICAL is reserved for conditions that already triggered a protective action
 * (kill switch trip, monitor halt).
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
