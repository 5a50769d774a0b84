package com.example.logstore.storage.search;

import com.example.logstore.logs.models.LogEntry;

import java.util.List;

/**
 * One page of search results, newest first.
 *
 * @param totalMatched exact on the index path; on the scan path the number of matches seen
 *                     before stopping, see {@code exhaustive}
 */
public record SearchResult(
        List<LogEntry> entries,
        long totalMatched,
        int limit,
        int offset,
        boolean usedIndex,
        boolean exhaustive) {
}
