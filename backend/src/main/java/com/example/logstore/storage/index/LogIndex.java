package com.example.logstore.storage.index;

import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.storage.RecordLocation;
import com.example.logstore.storage.segment.StoredRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory equality index from {@link IndexKey} to record locations.
 * <p>
 * Entries are partitioned per segment, so dropping a segment is a single map removal and a
 * lookup concatenates the per-segment lists in segment order. Lookups return copies.
 */
@Slf4j
public class LogIndex {

    private final Map<String, Map<IndexKey, LinkedHashSet<RecordLocation>>> bySegment = new LinkedHashMap<>();
    private final Set<String> removedSegments = new HashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Add {@code location} under every key the entry populates. Adding the same location
     * twice has no effect.
     */
    public void update(LogEntry entry, RecordLocation location) {
        List<IndexKey> keys = IndexKey.of(entry);
        lock.writeLock().lock();
        try {
            if (removedSegments.contains(location.segmentId())) {
                log.debug("Ignoring index update for removed segment {}", location.segmentId());
                return;
            }
            Map<IndexKey, LinkedHashSet<RecordLocation>> segmentEntries =
                    bySegment.computeIfAbsent(location.segmentId(), id -> new HashMap<>());
            for (IndexKey key : keys) {
                segmentEntries.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(location);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Locations for a key in insertion order; empty for an unknown key.
     */
    public List<RecordLocation> lookup(IndexKeyType type, String value) {
        IndexKey key = new IndexKey(type, value);
        lock.readLock().lock();
        try {
            List<RecordLocation> result = new ArrayList<>();
            for (Map<IndexKey, LinkedHashSet<RecordLocation>> segmentEntries : bySegment.values()) {
                LinkedHashSet<RecordLocation> locations = segmentEntries.get(key);
                if (locations != null) {
                    result.addAll(locations);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of locations stored for a key, without copying them.
     */
    public int count(IndexKeyType type, String value) {
        IndexKey key = new IndexKey(type, value);
        lock.readLock().lock();
        try {
            int count = 0;
            for (Map<IndexKey, LinkedHashSet<RecordLocation>> segmentEntries : bySegment.values()) {
                LinkedHashSet<RecordLocation> locations = segmentEntries.get(key);
                if (locations != null) {
                    count += locations.size();
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop every entry pointing into the segment. Later updates for it are ignored.
     */
    public void removeSegment(String segmentId) {
        lock.writeLock().lock();
        try {
            removedSegments.add(segmentId);
            if (bySegment.remove(segmentId) != null) {
                log.debug("Removed index entries of segment {}", segmentId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget removed segments that no queued repair still refers to. Only the repair
     * service applies late updates to sealed segments, so once its queues no longer name
     * a removed segment nothing can re-add it.
     *
     * @return number of removed-segment ids forgotten
     */
    public int pruneRemovedSegments(Set<String> stillReferenced) {
        lock.writeLock().lock();
        try {
            int before = removedSegments.size();
            removedSegments.retainAll(stillReferenced);
            return before - removedSegments.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int removedSegmentCount() {
        lock.readLock().lock();
        try {
            return removedSegments.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the entries of one segment with entries built from {@code records}.
     */
    public void rebuildSegment(String segmentId, List<StoredRecord> records) {
        Map<IndexKey, LinkedHashSet<RecordLocation>> rebuilt = new HashMap<>();
        for (StoredRecord record : records) {
            for (IndexKey key : IndexKey.of(record.entry())) {
                rebuilt.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(record.location());
            }
        }

        lock.writeLock().lock();
        try {
            if (removedSegments.contains(segmentId)) {
                return;
            }
            bySegment.put(segmentId, rebuilt);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Rebuilt index of segment {} from {} records", segmentId, records.size());
    }

    /**
     * Total number of (key, location) entries.
     */
    public long entryCount() {
        lock.readLock().lock();
        try {
            long total = 0;
            for (Map<IndexKey, LinkedHashSet<RecordLocation>> segmentEntries : bySegment.values()) {
                for (LinkedHashSet<RecordLocation> locations : segmentEntries.values()) {
                    total += locations.size();
                }
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsSegment(String segmentId) {
        lock.readLock().lock();
        try {
            return bySegment.containsKey(segmentId);
        } finally {
            lock.readLock().unlock();
        }
    }
}
