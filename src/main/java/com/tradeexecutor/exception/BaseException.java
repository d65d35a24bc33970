package com.tradeexecutor.exception;

import com.tradeexecutor.domain.enums.CommandFailureKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the executor's own failures. The {@link ErrorCode} decides both the HTTP status a
 * controller answers with and how a command that hit the error is classified.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;

    /** Context for the error body, such as the strategy or command id. Never null. */
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /** True for codes that map to a 5xx status: the executor or a dependency is at fault. */
    public boolean isFault() {
        return errorCode.getHttpStatus() >= 500;
    }

    public CommandFailureKind failureKind() {
        return switch (errorCode) {
            case KILL_SWITCH_ACTIVE, SAFETY_LIMIT_EXCEEDED -> CommandFailureKind.SAFETY_DENIED;
            default -> isFault() ? CommandFailureKind.EXECUTION : CommandFailureKind.REJECTED;
        };
    }
}
