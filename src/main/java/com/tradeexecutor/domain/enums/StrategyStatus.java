package com.tradeexecutor.domain.enums;

public enum StrategyStatus {
    ACTIVE,
    PAUSED
}
