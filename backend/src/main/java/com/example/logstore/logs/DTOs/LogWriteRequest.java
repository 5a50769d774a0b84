package com.example.logstore.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Body of a write. Level and message are checked by the write path so that a missing or
 * unknown level and a blank message report their own error codes.
 */
public record LogWriteRequest(
        @JsonProperty("level")
        String level,

        @JsonProperty("message")
        @Size(max = 10000)
        String message,

        @JsonProperty("trace_id")
        @Size(max = 64)
        String traceId,

        @JsonProperty("span_id")
        @Size(max = 32)
        String spanId,

        @JsonProperty("service")
        @Size(max = 100)
        String service,

        @JsonProperty("caller")
        @Size(max = 255)
        String caller,

        @JsonProperty("fields")
        Map<String, Object> fields) {
}
