package com.example.logstore.storage;

import com.example.logstore.exceptions.EmptyMessageException;
import com.example.logstore.exceptions.SegmentUnavailableException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;
import com.example.logstore.stats.StatsAggregator;
import com.example.logstore.storage.index.IndexRepairService;
import com.example.logstore.storage.index.LogIndex;
import com.example.logstore.storage.segment.SegmentManager;
import com.example.logstore.storage.segment.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.FixedBackOff;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The write path: validates drafts, assigns id and timestamp, appends to the active
 * segment and updates the index and stats.
 * <p>
 * A single writer lock covers id assignment, append and index update, so append order,
 * id order and timestamp order agree.
 */
@Slf4j
public class LogWriter {

    private final SegmentManager segmentManager;
    private final LogIndex index;
    private final StatsAggregator stats;
    private final IndexRepairService repairService;
    private final Clock clock;
    private final long retryIntervalMs;
    private final long retryAttempts;

    // Guarded by the segment manager's append lock
    private long sequence;
    private Instant lastTimestamp = Instant.EPOCH;

    public LogWriter(SegmentManager segmentManager, LogIndex index, StatsAggregator stats,
                     IndexRepairService repairService, Clock clock, long retryAttempts, long retryIntervalMs) {
        this.segmentManager = segmentManager;
        this.index = index;
        this.stats = stats;
        this.repairService = repairService;
        this.clock = clock;
        this.retryAttempts = retryAttempts;
        this.retryIntervalMs = retryIntervalMs;
    }

    /**
     * Open the segment manager and rebuild index, stats and the id sequence from the
     * records already on disk.
     */
    public void recover() throws IOException {
        ReentrantLock lock = segmentManager.appendLock();
        lock.lock();
        try {
            RecoveryState state = new RecoveryState();
            segmentManager.open(state::accept);
            state.flush();

            sequence = state.maxId;
            lastTimestamp = state.maxTimestamp;
            log.info("Recovered {} records from {} segments, next id {}",
                    state.records, state.segments, sequence + 1);
        } finally {
            lock.unlock();
        }
    }

    public WriteReceipt write(LogDraft draft) {
        return append(validate(draft));
    }

    /**
     * Validate every draft, then write them in order. A single invalid draft rejects the
     * batch before anything is appended.
     */
    public List<WriteReceipt> writeBatch(List<LogDraft> drafts) {
        List<LogEntry> validated = drafts.stream().map(this::validate).toList();
        List<WriteReceipt> receipts = new ArrayList<>(validated.size());
        for (LogEntry entry : validated) {
            receipts.add(append(entry));
        }
        return receipts;
    }

    /**
     * Turn a draft into an entry without id and timestamp.
     *
     * @throws com.example.logstore.exceptions.InvalidLevelException if the level is not recognized
     * @throws EmptyMessageException                                 if the message is blank
     */
    public LogEntry validate(LogDraft draft) {
        LogLevel level = LogLevel.parse(draft.level());
        if (draft.message() == null || draft.message().isBlank()) {
            throw new EmptyMessageException();
        }
        return LogEntry.builder()
                .level(level)
                .message(draft.message().trim())
                .traceId(normalize(draft.traceId()))
                .spanId(normalize(draft.spanId()))
                .service(normalize(draft.service()))
                .caller(normalize(draft.caller()))
                .fields(draft.fields() == null || draft.fields().isEmpty()
                        ? null
                        : Collections.unmodifiableMap(new LinkedHashMap<>(draft.fields())))
                .build();
    }

    public long lastAssignedId() {
        ReentrantLock lock = segmentManager.appendLock();
        lock.lock();
        try {
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    private WriteReceipt append(LogEntry template) {
        LogEntry entry;
        ReentrantLock lock = segmentManager.appendLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant timestamp = now.isBefore(lastTimestamp) ? lastTimestamp : now;
            entry = template.toBuilder()
                    .id(sequence + 1)
                    .timestamp(timestamp)
                    .build();

            RecordLocation location = appendWithRetry(entry);
            sequence = entry.getId();
            lastTimestamp = timestamp;

            try {
                index.update(entry, location);
            } catch (RuntimeException e) {
                log.error("Index update for record {} failed: {}", entry.getId(), e.getMessage());
                repairService.enqueue(entry, location);
            }
        } finally {
            lock.unlock();
        }

        stats.record(entry);
        log.debug("Wrote record {} ({}) to segment", entry.getId(), entry.getLevel().label());
        return new WriteReceipt(entry.getId(), entry.getTimestamp());
    }

    private RecordLocation appendWithRetry(LogEntry entry) {
        BackOffExecution backOff = new FixedBackOff(retryIntervalMs, retryAttempts).start();
        int attempt = 1;
        while (true) {
            try {
                segmentManager.rollIfNeeded(entry.getTimestamp());
                return segmentManager.append(entry);
            } catch (IOException e) {
                long waitMs = backOff.nextBackOff();
                if (waitMs == BackOffExecution.STOP) {
                    log.error("Append of record {} failed after {} attempts: {}", entry.getId(), attempt, e.getMessage());
                    throw new SegmentUnavailableException("Active segment is unavailable", e);
                }
                log.warn("Append of record {} failed (attempt {}), retrying in {} ms: {}",
                        entry.getId(), attempt, waitMs, e.getMessage());
                attempt++;
                sleep(waitMs, e);
            }
        }
    }

    private void sleep(long waitMs, IOException cause) {
        try {
            Thread.sleep(waitMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SegmentUnavailableException("Interrupted while retrying append", cause);
        }
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Collects recovered records one segment at a time.
     */
    private final class RecoveryState {
        private String currentSegment;
        private final List<StoredRecord> currentRecords = new ArrayList<>();
        private long maxId;
        private Instant maxTimestamp = Instant.EPOCH;
        private long records;
        private int segments;

        void accept(StoredRecord record) {
            String segmentId = record.location().segmentId();
            if (!segmentId.equals(currentSegment)) {
                flush();
                currentSegment = segmentId;
                segments++;
            }
            currentRecords.add(record);

            LogEntry entry = record.entry();
            stats.record(entry);
            maxId = Math.max(maxId, entry.getId());
            if (entry.getTimestamp().isAfter(maxTimestamp)) {
                maxTimestamp = entry.getTimestamp();
            }
            records++;
        }

        void flush() {
            if (currentSegment != null) {
                index.rebuildSegment(currentSegment, List.copyOf(currentRecords));
                currentRecords.clear();
            }
        }
    }
}
