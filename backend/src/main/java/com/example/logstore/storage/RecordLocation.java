package com.example.logstore.storage;

/**
 * Position of one record inside a segment file.
 *
 * @param segmentId segment holding the record
 * @param offset    byte offset of the record's line
 * @param length    length of the encoded record, excluding the line terminator
 * @param recordId  id of the record written at this location
 */
public record RecordLocation(String segmentId, long offset, int length, long recordId) {
}
