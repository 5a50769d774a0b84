package com.example.logstore.exceptions;

/**
 * Exception thrown when the write path cannot reach the active segment.
 * Fatal to the request; callers may retry.
 */
public class SegmentUnavailableException extends LogStoreException {

    public SegmentUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SEGMENT_UNAVAILABLE, message, cause);
    }
}
