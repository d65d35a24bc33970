package com.tradeexecutor.exception;

import java.util.Map;

public class SafetyViolationException extends BaseException {

    public SafetyViolationException(String message) {
        super(ErrorCode.SAFETY_LIMIT_EXCEEDED, message);
    }

    public SafetyViolationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
