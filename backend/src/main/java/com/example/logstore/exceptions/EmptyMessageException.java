package com.example.logstore.exceptions;

public class EmptyMessageException extends LogStoreException {

    public EmptyMessageException() {
        super(ErrorCode.EMPTY_MESSAGE, "message cannot be empty");
    }
}
