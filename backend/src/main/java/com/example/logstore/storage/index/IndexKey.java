package com.example.logstore.storage.index;

import com.example.logstore.logs.models.LogEntry;

import java.util.ArrayList;
import java.util.List;

public record IndexKey(IndexKeyType type, String value) {

    /**
     * Keys for every indexed field the entry populates.
     */
    public static List<IndexKey> of(LogEntry entry) {
        List<IndexKey> keys = new ArrayList<>(4);
        if (entry.getTraceId() != null) {
            keys.add(new IndexKey(IndexKeyType.TRACE_ID, entry.getTraceId()));
        }
        if (entry.getSpanId() != null) {
            keys.add(new IndexKey(IndexKeyType.SPAN_ID, entry.getSpanId()));
        }
        if (entry.getService() != null) {
            keys.add(new IndexKey(IndexKeyType.SERVICE, entry.getService()));
        }
        if (entry.getLevel() != null) {
            keys.add(new IndexKey(IndexKeyType.LEVEL, entry.getLevel().label()));
        }
        return keys;
    }
}
