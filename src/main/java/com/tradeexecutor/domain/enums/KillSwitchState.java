package com.tradeexecutor.domain.enums;

public enum KillSwitchState {
    IDLE,
    TRIPPED
}
