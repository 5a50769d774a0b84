package com.example.logstore.logs.services;

import com.example.logstore.logs.DTOs.LogEntryResponse;
import com.example.logstore.logs.DTOs.LogSearchRequest;
import com.example.logstore.logs.DTOs.LogSearchResponse;
import com.example.logstore.logs.models.LogLevel;
import com.example.logstore.metrics.LogStoreMetrics;
import com.example.logstore.storage.search.LogQuery;
import com.example.logstore.storage.search.SearchEngine;
import com.example.logstore.storage.search.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class LogSearchService {

    private final SearchEngine searchEngine;
    private final LogStoreMetrics metrics;

    public LogSearchService(SearchEngine searchEngine, LogStoreMetrics metrics) {
        this.searchEngine = searchEngine;
        this.metrics = metrics;
    }

    public LogSearchResponse search(LogSearchRequest request) {
        LogQuery query = LogQuery.builder()
                .traceId(blankToNull(request.traceId()))
                .spanId(blankToNull(request.spanId()))
                .service(blankToNull(request.service()))
                .levels(parseLevels(request))
                .start(request.startTime())
                .end(request.endTime())
                .message(request.message())
                .build();
        return run(query, request.limit(), request.offset(), request.useIndex());
    }

    public LogSearchResponse errors(Integer limit, Integer offset) {
        return run(LogQuery.errorsOnly(), limit, offset, true);
    }

    public LogSearchResponse byTraceId(String traceId, Integer limit, Integer offset) {
        return run(LogQuery.builder().traceId(traceId).build(), limit, offset, true);
    }

    public LogSearchResponse bySpanId(String spanId, Integer limit, Integer offset) {
        return run(LogQuery.builder().spanId(spanId).build(), limit, offset, true);
    }

    public LogSearchResponse byLevel(String level, Integer limit, Integer offset) {
        return run(LogQuery.builder().levels(Set.of(LogLevel.parse(level))).build(), limit, offset, true);
    }

    public LogSearchResponse byService(String service, Integer limit, Integer offset) {
        return run(LogQuery.builder().service(service).build(), limit, offset, true);
    }

    private LogSearchResponse run(LogQuery query, Integer limit, Integer offset, boolean useIndex) {
        long startTime = System.nanoTime();
        SearchResult result = searchEngine.search(query, limit, offset, useIndex);
        metrics.recordSearch(result.usedIndex(), startTime);

        long searchTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        log.debug("Search completed: {} of {} results, index={}, {}ms",
                result.entries().size(), result.totalMatched(), result.usedIndex(), searchTimeMs);

        return new LogSearchResponse(
                result.entries().stream().map(LogEntryResponse::from).toList(),
                result.totalMatched(),
                result.limit(),
                result.offset(),
                result.usedIndex(),
                result.exhaustive(),
                searchTimeMs);
    }

    private Set<LogLevel> parseLevels(LogSearchRequest request) {
        Set<LogLevel> levels = EnumSet.noneOf(LogLevel.class);
        if (request.level() != null && !request.level().isBlank()) {
            levels.add(LogLevel.parse(request.level()));
        }
        if (request.levels() != null) {
            request.levels().forEach(level -> levels.add(LogLevel.parse(level)));
        }
        return levels;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
