package com.example.logstore.storage.segment;

import java.time.Instant;

/**
 * Point-in-time metadata of a segment.
 */
public record SegmentInfo(
        String id,
        String fileName,
        String path,
        long size,
        long records,
        Instant firstTimestamp,
        Instant lastTimestamp,
        Instant lastModified,
        boolean sealed,
        boolean compressed) {
}
