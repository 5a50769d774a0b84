package com.example.logstore.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LogSearchResponse(
        @JsonProperty("entries") List<LogEntryResponse> entries,
        @JsonProperty("total_matched") long totalMatched,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset,
        @JsonProperty("used_index") boolean usedIndex,
        @JsonProperty("exhaustive") boolean exhaustive,
        @JsonProperty("search_time_ms") long searchTimeMs) {
}
