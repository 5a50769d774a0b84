package com.example.logstore.files.DTOs;

import com.example.logstore.storage.segment.SegmentInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentInfoResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("size") long size,
        @JsonProperty("size_human") String sizeHuman,
        @JsonProperty("records") long records,
        @JsonProperty("first_timestamp") Instant firstTimestamp,
        @JsonProperty("last_timestamp") Instant lastTimestamp,
        @JsonProperty("mod_time") Instant modTime,
        @JsonProperty("sealed") boolean sealed,
        @JsonProperty("compressed") boolean compressed,
        @JsonProperty("path") String path) {

    public static SegmentInfoResponse from(SegmentInfo info, String sizeHuman) {
        return new SegmentInfoResponse(
                info.id(),
                info.fileName(),
                info.size(),
                sizeHuman,
                info.records(),
                info.firstTimestamp(),
                info.lastTimestamp(),
                info.lastModified(),
                info.sealed(),
                info.compressed(),
                info.path());
    }
}
