package com.example.logstore.exceptions;

/**
 * Exception thrown when an index location does not resolve to the record it was created for.
 */
public class IndexCorruptionException extends LogStoreException {

    private final String segmentId;

    public IndexCorruptionException(String segmentId, String message) {
        super(ErrorCode.INDEX_CORRUPTION, message);
        this.segmentId = segmentId;
    }

    public IndexCorruptionException(String segmentId, String message, Throwable cause) {
        super(ErrorCode.INDEX_CORRUPTION, message, cause);
        this.segmentId = segmentId;
    }

    public String getSegmentId() {
        return segmentId;
    }
}
