package com.tradeexecutor.exception;

public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }

    protected TransportException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
