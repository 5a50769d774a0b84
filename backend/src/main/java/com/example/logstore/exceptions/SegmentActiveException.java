package com.example.logstore.exceptions;

public class SegmentActiveException extends LogStoreException {

    public SegmentActiveException(String segmentId) {
        super(ErrorCode.SEGMENT_ACTIVE, "Segment is active and cannot be deleted: " + segmentId);
    }
}
