package com.example.logstore.storage;

import java.util.Map;

/**
 * A record as submitted by a client, before validation and before the server assigns
 * its id and timestamp.
 */
public record LogDraft(
        String level,
        String message,
        String traceId,
        String spanId,
        String service,
        String caller,
        Map<String, Object> fields) {
}
