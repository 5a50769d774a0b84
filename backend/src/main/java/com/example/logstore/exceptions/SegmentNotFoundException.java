package com.example.logstore.exceptions;

/**
 * Exception thrown when a segment file is not known to the segment manager
 */
public class SegmentNotFoundException extends LogStoreException {

    public SegmentNotFoundException(String segmentId) {
        super(ErrorCode.SEGMENT_NOT_FOUND, "Segment not found: " + segmentId);
    }
}
