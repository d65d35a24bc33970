package com.tradeexecutor.domain.enums;

/** RATIO places the target at a multiple of the stop-loss distance. */
public enum TakeProfitType {
    FIXED,
    PERCENT,
    RATIO
}
