package com.example.logstore.logs.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One stored log record. Immutable once written: id and timestamp are assigned by the
 * write path, optional fields are either present with a value or absent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LogEntry {

    long id;

    Instant timestamp;

    LogLevel level;

    String message;

    @JsonProperty("trace_id")
    String traceId;

    @JsonProperty("span_id")
    String spanId;

    String service;

    String caller;

    Map<String, Object> fields;
}
