package com.example.logstore.exceptions;

public class InvalidQueryException extends LogStoreException {

    public InvalidQueryException(String message) {
        super(ErrorCode.INVALID_QUERY, message);
    }
}
