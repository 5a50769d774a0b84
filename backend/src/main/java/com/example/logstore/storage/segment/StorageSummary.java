package com.example.logstore.storage.segment;

import java.time.Instant;

public record StorageSummary(
        int totalFiles,
        long totalBytes,
        String oldestFile,
        String newestFile,
        Instant oldestTime,
        Instant newestTime) {
}
