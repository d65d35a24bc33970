package com.tradeexecutor.domain.enums;

/** FIXED is a distance in pips, PERCENT a percentage of entry, ATR a multiple of the ATR value. */
public enum StopLossType {
    FIXED,
    PERCENT,
    ATR
}
