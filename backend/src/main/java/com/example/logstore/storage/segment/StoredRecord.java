package com.example.logstore.storage.segment;

import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.storage.RecordLocation;

public record StoredRecord(LogEntry entry, RecordLocation location) {
}
