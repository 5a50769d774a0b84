package com.example.logstore.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record LogSearchRequest(
        @JsonProperty("trace_id") @Size(max = 64) String traceId,
        @JsonProperty("span_id") @Size(max = 32) String spanId,
        @JsonProperty("service") @Size(max = 100) String service,
        @JsonProperty("level") String level,
        @JsonProperty("levels") List<String> levels,
        @JsonProperty("message") String message,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("offset") Integer offset,
        @JsonProperty("use_index") Boolean useIndex) {

    public LogSearchRequest {
        offset = (offset != null && offset >= 0) ? offset : 0;
        useIndex = useIndex != null && useIndex;
    }
}
