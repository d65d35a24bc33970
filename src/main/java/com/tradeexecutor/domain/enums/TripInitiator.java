package com.tradeexecutor.domain.enums;

/** Who or what tripped the kill switch. */
public enum TripInitiator {
    MANUAL,
    AUTOMATIC,
    SAFETY_BREACH,
    CLOUD,
    ERROR
}
