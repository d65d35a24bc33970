package com.tradeexecutor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    KILL_SWITCH_ACTIVE("KILL_SWITCH_ACTIVE", 409),
    SAFETY_LIMIT_EXCEEDED("SAFETY_LIMIT_EXCEEDED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    STATE_STORE_ERROR("STATE_STORE_ERROR", 500),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 502),
    PLATFORM_API_ERROR("PLATFORM_API_ERROR", 502),
    TRANSPORT_TIMEOUT("TRANSPORT_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
