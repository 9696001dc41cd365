package com.tradingagent.exception;

public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
