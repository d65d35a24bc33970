package com.tradeexecutor.domain.enums;

/**
 * Why a command failed. Only {@link #EXECUTION} failures count toward the error-rate
 * emergency stop; the others are decisions, not faults.
 */
public enum CommandFailureKind {
    /** Invalid, unknown, queue full, or refused by the terminal. */
    REJECTED,
    /** Denied by the kill switch or a safety limit. */
    SAFETY_DENIED,
    /** Transport fault, timeout after retries, or an unexpected error while sending. */
    EXECUTION
}
