package com.tradeexecutor.exception;

/** Raised when the local state store cannot read or write an entry. */
public class StateStoreException extends BaseException {

    public StateStoreException(String message, Throwable cause) {
        super(ErrorCode.STATE_STORE_ERROR, message, cause);
    }
}
