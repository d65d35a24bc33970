package com.tradeexecutor.exception;

public class PlatformApiException extends BaseException {

    public PlatformApiException(String message) {
        super(ErrorCode.PLATFORM_API_ERROR, message);
    }

    public PlatformApiException(String message, Throwable cause) {
        super(ErrorCode.PLATFORM_API_ERROR, message, cause);
    }
}
