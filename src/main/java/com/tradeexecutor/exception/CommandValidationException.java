package com.tradeexecutor.exception;

import java.util.Map;

/**
 * Raised by the command normalizer when an inbound message cannot be turned into a
 * canonical command. Callers drop the message; it is never retried.
 */
public class CommandValidationException extends BaseException {

    public CommandValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public CommandValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
