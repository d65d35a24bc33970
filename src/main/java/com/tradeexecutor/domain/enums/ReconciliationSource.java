package com.tradeexecutor.domain.enums;

public enum ReconciliationSource {
    CONTROL_PLANE,
    LOCAL_SNAPSHOT,
    EMPTY
}
