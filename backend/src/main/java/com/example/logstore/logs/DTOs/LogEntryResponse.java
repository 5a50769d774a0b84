package com.example.logstore.logs.DTOs;

import com.example.logstore.logs.models.LogEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LogEntryResponse(
        @JsonProperty("id") long id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("level") String level,
        @JsonProperty("message") String message,
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("service") String service,
        @JsonProperty("caller") String caller,
        @JsonProperty("fields") Map<String, Object> fields) {

    public static LogEntryResponse from(LogEntry entry) {
        return new LogEntryResponse(
                entry.getId(),
                entry.getTimestamp(),
                entry.getLevel().label(),
                entry.getMessage(),
                entry.getTraceId(),
                entry.getSpanId(),
                entry.getService(),
                entry.getCaller(),
                entry.getFields());
    }
}
