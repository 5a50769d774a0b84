package com.example.logstore;

import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;

import java.time.Instant;

public final class TestEntries {

    private TestEntries() {
    }

    public static LogEntry entry(long id, Instant timestamp, LogLevel level, String message) {
        return LogEntry.builder()
                .id(id)
                .timestamp(timestamp)
                .level(level)
                .message(message)
                .build();
    }

    public static LogEntry traced(long id, Instant timestamp, LogLevel level, String message,
                                  String traceId, String service) {
        return LogEntry.builder()
                .id(id)
                .timestamp(timestamp)
                .level(level)
                .message(message)
                .traceId(traceId)
                .service(service)
                .build();
    }
}
