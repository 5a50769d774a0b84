package com.example.logstore.exceptions;

/**
 * Error codes for failures surfaced by the log store.
 * - 1xxx: client errors
 * - 2xxx: storage errors
 */
public enum ErrorCode {

    INVALID_LEVEL(1001, "Unrecognized log level"),
    EMPTY_MESSAGE(1002, "Log message is empty"),
    INVALID_QUERY(1003, "Invalid search query"),
    SEGMENT_NOT_FOUND(1004, "Segment does not exist"),
    SEGMENT_ACTIVE(1005, "Segment is still active"),

    SEGMENT_UNAVAILABLE(2001, "Active segment is unavailable"),
    INDEX_CORRUPTION(2002, "Index does not match segment content"),

    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String description;

    ErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isClientError() {
        return code >= 1000 && code < 2000;
    }
}
