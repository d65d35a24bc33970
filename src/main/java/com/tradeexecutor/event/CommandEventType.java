package com.tradeexecutor.event;

public enum CommandEventType {
    RECEIVED,
    QUEUED,
    REJECTED,
    COMPLETED,
    FAILED,
    CANCELLED
}
