package com.tradeexecutor.domain.enums;

public enum SizingMethod {
    FIXED_LOT,
    PERCENTAGE_RISK,
    ATR_BASED
}
