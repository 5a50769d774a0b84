package com.example.logstore.storage.search;

import com.example.logstore.exceptions.IndexCorruptionException;
import com.example.logstore.exceptions.InvalidQueryException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;
import com.example.logstore.storage.RecordLocation;
import com.example.logstore.storage.index.IndexKey;
import com.example.logstore.storage.index.IndexKeyType;
import com.example.logstore.storage.index.IndexRepairService;
import com.example.logstore.storage.index.LogIndex;
import com.example.logstore.storage.segment.Segment;
import com.example.logstore.storage.segment.SegmentManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates {@link LogQuery} predicates.
 * <p>
 * With the index hint and at least one equality key, candidates come from the smallest
 * matching index list and are read newest first. Otherwise segments are scanned newest
 * first and the scan stops as soon as the requested page is filled.
 */
@Slf4j
public class SearchEngine {

    private static final Comparator<RecordLocation> NEWEST_FIRST =
            Comparator.comparingLong(RecordLocation::recordId).reversed();

    private final SegmentManager segmentManager;
    private final LogIndex index;
    private final IndexRepairService repairService;
    private final int defaultLimit;
    private final int maxLimit;

    public SearchEngine(SegmentManager segmentManager, LogIndex index, IndexRepairService repairService,
                        int defaultLimit, int maxLimit) {
        this.segmentManager = segmentManager;
        this.index = index;
        this.repairService = repairService;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * @param limit    page size; missing or non-positive means the default, capped at the maximum
     * @param offset   matches to skip; negative means zero
     * @param useIndex hint to answer from the index when the query has an equality key
     * @throws InvalidQueryException if the time range starts after it ends
     */
    public SearchResult search(LogQuery query, Integer limit, Integer offset, boolean useIndex) {
        if (query.start() != null && query.end() != null && query.start().isAfter(query.end())) {
            throw new InvalidQueryException("start_time must not be after end_time");
        }
        int effectiveLimit = normalizeLimit(limit);
        int effectiveOffset = offset == null || offset < 0 ? 0 : offset;

        if (useIndex && query.indexableKeyCount() > 0) {
            try {
                return indexSearch(query, effectiveLimit, effectiveOffset);
            } catch (IndexCorruptionException e) {
                log.warn("Index inconsistent with segment {}, falling back to scan: {}",
                        e.getSegmentId(), e.getMessage());
                repairService.scheduleRebuild(e.getSegmentId());
            }
        }
        return scanSearch(query, effectiveLimit, effectiveOffset);
    }

    public SearchResult errors(Integer limit, Integer offset) {
        return search(LogQuery.errorsOnly(), limit, offset, true);
    }

    public int normalizeLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return Math.min(limit, maxLimit);
    }

    private SearchResult indexSearch(LogQuery query, int limit, int offset) {
        List<RecordLocation> candidates = new ArrayList<>(smallestCandidateList(query));
        candidates.sort(NEWEST_FIRST);

        List<LogEntry> page = new ArrayList<>(Math.min(limit, candidates.size()));

        if (query.isSingleKey()) {
            // Every candidate matches; only the page needs materializing
            for (int i = offset; i < candidates.size() && page.size() < limit; i++) {
                materialize(candidates.get(i)).ifPresent(page::add);
            }
            log.debug("Index search {} matched {} records", query, candidates.size());
            return new SearchResult(page, candidates.size(), limit, offset, true, true);
        }

        long matched = 0;
        for (RecordLocation location : candidates) {
            Optional<LogEntry> entry = materialize(location);
            if (entry.isEmpty() || !query.matches(entry.get())) {
                continue;
            }
            if (matched >= offset && page.size() < limit) {
                page.add(entry.get());
            }
            matched++;
        }
        log.debug("Index search {} matched {} of {} candidates", query, matched, candidates.size());
        return new SearchResult(page, matched, limit, offset, true, true);
    }

    private List<RecordLocation> smallestCandidateList(LogQuery query) {
        List<IndexKey> keys = new ArrayList<>(4);
        if (query.traceId() != null) {
            keys.add(new IndexKey(IndexKeyType.TRACE_ID, query.traceId()));
        }
        if (query.spanId() != null) {
            keys.add(new IndexKey(IndexKeyType.SPAN_ID, query.spanId()));
        }
        if (query.service() != null) {
            keys.add(new IndexKey(IndexKeyType.SERVICE, query.service()));
        }
        if (query.levels().size() == 1) {
            LogLevel level = query.levels().iterator().next();
            keys.add(new IndexKey(IndexKeyType.LEVEL, level.label()));
        }

        IndexKey best = keys.get(0);
        int bestCount = Integer.MAX_VALUE;
        for (IndexKey key : keys) {
            int count = index.count(key.type(), key.value());
            if (count < bestCount) {
                best = key;
                bestCount = count;
            }
        }
        return index.lookup(best.type(), best.value());
    }

    private Optional<LogEntry> materialize(RecordLocation location) {
        return segmentManager.find(location.segmentId()).flatMap(segment -> segment.read(location));
    }

    private SearchResult scanSearch(LogQuery query, int limit, int offset) {
        long needed = (long) offset + limit;
        List<LogEntry> page = new ArrayList<>(Math.min(limit, 1024));
        long matched = 0;
        boolean exhaustive = true;

        Iterator<Segment> segments = segmentManager.segmentsNewestFirst().iterator();
        while (segments.hasNext()) {
            Segment segment = segments.next();
            if (!segment.overlaps(query.start(), query.end())) {
                continue;
            }

            // Keep only the newest matches this segment can contribute
            long room = needed - matched;
            Deque<LogEntry> window = new ArrayDeque<>((int) Math.min(room, 1024));
            long[] segmentMatches = {0};
            segment.scan(record -> {
                if (!query.matches(record.entry())) {
                    return;
                }
                segmentMatches[0]++;
                if (window.size() >= room) {
                    window.pollFirst();
                }
                window.addLast(record.entry());
            });

            // Matches of newer segments occupy positions [0, matched)
            long position = matched;
            Iterator<LogEntry> descending = window.descendingIterator();
            while (descending.hasNext()) {
                LogEntry entry = descending.next();
                if (position >= offset && position < needed) {
                    page.add(entry);
                }
                position++;
            }
            matched += segmentMatches[0];

            if (matched >= needed) {
                exhaustive = !hasOverlappingSegment(segments, query);
                break;
            }
        }

        log.debug("Scan search {} matched {} records (exhaustive={})", query, matched, exhaustive);
        return new SearchResult(List.copyOf(page), matched, limit, offset, false, exhaustive);
    }

    private boolean hasOverlappingSegment(Iterator<Segment> remaining, LogQuery query) {
        while (remaining.hasNext()) {
            if (remaining.next().overlaps(query.start(), query.end())) {
                return true;
            }
        }
        return false;
    }
}
