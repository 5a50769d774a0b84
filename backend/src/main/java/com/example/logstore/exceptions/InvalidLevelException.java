package com.example.logstore.exceptions;

public class InvalidLevelException extends LogStoreException {

    public InvalidLevelException(String level) {
        super(ErrorCode.INVALID_LEVEL, "invalid log level: " + level);
    }
}
