package com.example.logstore.stats;

import com.example.logstore.storage.segment.StorageSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record StatsResponse(
        @JsonProperty("total") long total,
        @JsonProperty("per_level") Map<String, Long> perLevel,
        @JsonProperty("per_service") Map<String, Long> perService,
        @JsonProperty("per_hour") Map<Instant, Long> perHour,
        @JsonProperty("period_start") Instant periodStart,
        @JsonProperty("index_entries") long indexEntries,
        @JsonProperty("storage") Storage storage) {

    public record Storage(
            @JsonProperty("total_files") int totalFiles,
            @JsonProperty("total_size") long totalSize,
            @JsonProperty("total_size_human") String totalSizeHuman,
            @JsonProperty("oldest_file") String oldestFile,
            @JsonProperty("newest_file") String newestFile,
            @JsonProperty("oldest_time") Instant oldestTime,
            @JsonProperty("newest_time") Instant newestTime) {

        public static Storage from(StorageSummary summary, String totalSizeHuman) {
            return new Storage(
                    summary.totalFiles(),
                    summary.totalBytes(),
                    totalSizeHuman,
                    summary.oldestFile(),
                    summary.newestFile(),
                    summary.oldestTime(),
                    summary.newestTime());
        }
    }
}
