package com.tradeexecutor.exception;

public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message) {
        super(ErrorCode.TRANSPORT_TIMEOUT, message);
    }
}
