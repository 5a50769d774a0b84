package com.example.logstore.storage.index;

/**
 * Record fields with an equality index.
 */
public enum IndexKeyType {
    TRACE_ID,
    SPAN_ID,
    SERVICE,
    LEVEL
}
