package com.example.logstore.exceptions;

/**
 * Base exception for all log store failures.
 */
public class LogStoreException extends RuntimeException {

    private final ErrorCode errorCode;

    public LogStoreException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LogStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
