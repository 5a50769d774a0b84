package com.example.logstore.storage.index;

import com.example.logstore.exceptions.LogStoreException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.metrics.LogStoreMetrics;
import com.example.logstore.storage.RecordLocation;
import com.example.logstore.storage.segment.Segment;
import com.example.logstore.storage.segment.SegmentManager;
import com.example.logstore.storage.segment.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies index updates that failed on the write path and rebuilds the index of segments
 * found to be inconsistent with their content.
 */
@Slf4j
public class IndexRepairService {

    private final LogIndex index;
    private final SegmentManager segmentManager;
    private final LogStoreMetrics metrics;

    private final Queue<PendingUpdate> pendingUpdates = new ConcurrentLinkedQueue<>();
    private final Set<String> pendingRebuilds = ConcurrentHashMap.newKeySet();

    public IndexRepairService(LogIndex index, SegmentManager segmentManager, LogStoreMetrics metrics) {
        this.index = index;
        this.segmentManager = segmentManager;
        this.metrics = metrics;
    }

    public void enqueue(LogEntry entry, RecordLocation location) {
        pendingUpdates.add(new PendingUpdate(entry, location));
        log.warn("Queued index repair for record {} in segment {}", entry.getId(), location.segmentId());
    }

    public void scheduleRebuild(String segmentId) {
        if (pendingRebuilds.add(segmentId)) {
            log.warn("Scheduled index rebuild for segment {}", segmentId);
        }
    }

    public int pendingCount() {
        return pendingUpdates.size() + pendingRebuilds.size();
    }

    /**
     * Drain queued work.
     *
     * @return number of repairs applied
     */
    @Scheduled(fixedDelayString = "${logstore.index.repair-interval-ms:1000}")
    public synchronized int runPendingRepairs() {
        int repaired = 0;

        List<PendingUpdate> retry = new ArrayList<>();
        PendingUpdate update;
        while ((update = pendingUpdates.poll()) != null) {
            if (segmentManager.find(update.location().segmentId()).isEmpty()) {
                continue;
            }
            try {
                index.update(update.entry(), update.location());
                metrics.recordIndexRepair();
                repaired++;
            } catch (RuntimeException e) {
                log.error("Index repair for record {} failed: {}", update.entry().getId(), e.getMessage());
                retry.add(update);
            }
        }
        pendingUpdates.addAll(retry);

        for (String segmentId : List.copyOf(pendingRebuilds)) {
            pendingRebuilds.remove(segmentId);
            Optional<Segment> segment = segmentManager.find(segmentId);
            if (segment.isEmpty()) {
                continue;
            }
            try {
                rebuild(segment.get());
                metrics.recordIndexRepair();
                repaired++;
            } catch (LogStoreException e) {
                log.error("Index rebuild of segment {} failed: {}", segmentId, e.getMessage());
                pendingRebuilds.add(segmentId);
            }
        }

        Set<String> referenced = new HashSet<>(pendingRebuilds);
        pendingUpdates.forEach(pending -> referenced.add(pending.location().segmentId()));
        int pruned = index.pruneRemovedSegments(referenced);
        if (pruned > 0) {
            log.debug("Forgot {} removed segments", pruned);
        }

        if (repaired > 0) {
            log.info("Applied {} index repairs", repaired);
        }
        return repaired;
    }

    private void rebuild(Segment segment) {
        // The active segment keeps growing; block appends so no update is lost by the swap
        ReentrantLock appendLock = segmentManager.appendLock();
        boolean active = segment == segmentManager.activeSegment();
        if (active) {
            appendLock.lock();
        }
        try {
            List<StoredRecord> records = new ArrayList<>();
            segment.scan(records::add);
            index.rebuildSegment(segment.id(), records);
        } finally {
            if (active) {
                appendLock.unlock();
            }
        }
    }

    private record PendingUpdate(LogEntry entry, RecordLocation location) {
    }
}
