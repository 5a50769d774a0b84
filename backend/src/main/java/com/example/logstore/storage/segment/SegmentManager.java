package com.example.logstore.storage.segment;

import com.example.logstore.exceptions.SegmentActiveException;
import com.example.logstore.exceptions.SegmentNotFoundException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.storage.RecordLocation;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the segment files of the storage directory.
 * <p>
 * Exactly one segment is active at a time. Segments are named
 * {@code <prefix>_<yyyy-MM-dd>_<seq>.log}, or {@code .log.gz} once compressed; a new one is
 * activated when the active segment reaches the size limit or the calendar day changes.
 */
@Slf4j
public class SegmentManager implements AutoCloseable {

    private final Path directory;
    private final String prefix;
    private final long maxSegmentBytes;
    private final boolean fsync;
    private final LogEntryCodec codec;
    private final Clock clock;
    private final Pattern fileNamePattern;

    // Single writer: id assignment, append and roll happen under this lock
    private final ReentrantLock appendLock = new ReentrantLock();

    // Segments in age order, oldest first
    private final Map<String, Segment> segments = new LinkedHashMap<>();
    private final ReadWriteLock segmentsLock = new ReentrantReadWriteLock();

    private final List<Consumer<String>> removalListeners = new CopyOnWriteArrayList<>();

    private volatile Segment active;
    private volatile boolean closed;

    public SegmentManager(Path directory, String prefix, long maxSegmentBytes, boolean fsync,
                          LogEntryCodec codec, Clock clock) {
        if (maxSegmentBytes <= 0) {
            throw new IllegalArgumentException("maxSegmentBytes must be positive: " + maxSegmentBytes);
        }
        this.directory = directory;
        this.prefix = prefix;
        this.maxSegmentBytes = maxSegmentBytes;
        this.fsync = fsync;
        this.codec = codec;
        this.clock = clock;
        this.fileNamePattern = Pattern.compile("^" + Pattern.quote(prefix) + "_(\\d{4}-\\d{2}-\\d{2})_(\\d+)\\.log(\\.gz)?$");
    }

    /**
     * Load existing segment files, seal them all and activate a fresh segment.
     *
     * @param visitor receives every recovered record, oldest segment first
     */
    public void open(Consumer<StoredRecord> visitor) throws IOException {
        Files.createDirectories(directory);

        removeIncompleteCompressions();

        Map<String, Path> byId = new HashMap<>();
        try (Stream<Path> listing = Files.list(directory)) {
            for (Path file : listing.filter(Files::isRegularFile)
                    .filter(p -> fileNamePattern.matcher(p.getFileName().toString()).matches())
                    .toList()) {
                Path existing = byId.putIfAbsent(idOf(file.getFileName().toString()), file);
                if (existing != null) {
                    // A compression finished its move but not the delete of the original
                    Path plain = existing.getFileName().toString().endsWith(Segment.FILE_EXTENSION) ? existing : file;
                    Path gzip = plain == existing ? file : existing;
                    log.warn("Found both {} and {}, keeping the compressed copy", plain.getFileName(), gzip.getFileName());
                    Files.delete(plain);
                    byId.put(idOf(gzip.getFileName().toString()), gzip);
                }
            }
        }
        List<Path> files = byId.values().stream()
                .sorted(Comparator.comparing((Path p) -> dayOf(p.getFileName().toString()))
                        .thenComparingInt(p -> sequenceOf(p.getFileName().toString())))
                .toList();

        segmentsLock.writeLock().lock();
        try {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String id = idOf(fileName);
                Segment segment = Segment.load(file, id, dayOf(fileName), codec, visitor);
                segments.put(id, segment);
            }
        } finally {
            segmentsLock.writeLock().unlock();
        }

        appendLock.lock();
        try {
            roll(today(clock.instant()));
        } finally {
            appendLock.unlock();
        }
        log.info("Opened storage directory {}: {} existing segments, active segment {}",
                directory, files.size(), active.id());
    }

    public ReentrantLock appendLock() {
        return appendLock;
    }

    /**
     * Append to the active segment. Caller must hold {@link #appendLock()}.
     */
    public RecordLocation append(LogEntry entry) throws IOException {
        Segment target = active;
        if (target == null || closed) {
            throw new IOException("No active segment");
        }
        return target.append(entry);
    }

    /**
     * Roll the active segment if it is full or belongs to an earlier day.
     * Caller must hold {@link #appendLock()}.
     */
    public void rollIfNeeded(Instant now) throws IOException {
        LocalDate day = today(now);
        Segment current = active;
        if (current == null || current.isSealed() || current.size() >= maxSegmentBytes || !current.day().equals(day)) {
            roll(day);
        }
    }

    /**
     * Seal a segment. Sealing the active segment activates a new one.
     */
    public void seal(String segmentId) throws IOException {
        Segment segment = find(segmentId).orElseThrow(() -> new SegmentNotFoundException(segmentId));
        appendLock.lock();
        try {
            if (segment == active) {
                roll(today(clock.instant()));
            } else {
                segment.seal();
            }
        } finally {
            appendLock.unlock();
        }
    }

    public Segment activeSegment() {
        return active;
    }

    public Optional<Segment> find(String segmentId) {
        segmentsLock.readLock().lock();
        try {
            return Optional.ofNullable(segments.get(segmentId));
        } finally {
            segmentsLock.readLock().unlock();
        }
    }

    /**
     * Snapshot of live segments, oldest first.
     */
    public List<Segment> segments() {
        segmentsLock.readLock().lock();
        try {
            return new ArrayList<>(segments.values());
        } finally {
            segmentsLock.readLock().unlock();
        }
    }

    public List<Segment> segmentsNewestFirst() {
        List<Segment> snapshot = segments();
        Collections.reverse(snapshot);
        return snapshot;
    }

    public List<SegmentInfo> listSegments() {
        return segments().stream().map(Segment::info).toList();
    }

    public SegmentInfo segmentInfo(String segmentId) {
        return find(segmentId).map(Segment::info).orElseThrow(() -> new SegmentNotFoundException(segmentId));
    }

    public LinesPage readContent(String segmentId, int limit, int offset, String search) {
        Segment segment = find(segmentId).orElseThrow(() -> new SegmentNotFoundException(segmentId));
        return segment.readLines(limit, offset, search);
    }

    /**
     * Register a callback invoked with the segment id before a segment is removed.
     */
    public void addRemovalListener(Consumer<String> listener) {
        removalListeners.add(listener);
    }

    /**
     * Delete a sealed segment: listeners first, then the file.
     *
     * @throws SegmentActiveException if the segment is the active one
     */
    public void deleteSegment(String segmentId) throws IOException {
        Segment segment;
        appendLock.lock();
        try {
            segment = find(segmentId).orElseThrow(() -> new SegmentNotFoundException(segmentId));
            if (segment == active) {
                throw new SegmentActiveException(segmentId);
            }
            removalListeners.forEach(listener -> listener.accept(segmentId));
            segmentsLock.writeLock().lock();
            try {
                segments.remove(segmentId);
            } finally {
                segmentsLock.writeLock().unlock();
            }
        } finally {
            appendLock.unlock();
        }
        segment.retire();
        log.info("Deleted segment {}", segmentId);
    }

    /**
     * Gzip sealed segments whose last write is older than {@code age}.
     *
     * @return ids of the compressed segments
     */
    public List<String> compressSegments(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        List<String> compressed = new ArrayList<>();
        for (Segment segment : segments()) {
            if (segment == active || !segment.isSealed() || segment.isCompressed()
                    || segment.lastModified() == null || !segment.lastModified().isBefore(cutoff)) {
                continue;
            }
            try {
                if (segment.compress()) {
                    compressed.add(segment.id());
                }
            } catch (IOException e) {
                log.error("Failed to compress segment {}: {}", segment.id(), e.getMessage());
            }
        }
        if (!compressed.isEmpty()) {
            log.info("Compressed {} segments older than {}", compressed.size(), cutoff);
        }
        return compressed;
    }

    /**
     * Delete sealed segments whose last write is older than {@code retention}.
     *
     * @return ids of the deleted segments
     */
    public List<String> expireSegments(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<String> expired = new ArrayList<>();
        for (Segment segment : segments()) {
            if (segment == active || segment.lastModified() == null || !segment.lastModified().isBefore(cutoff)) {
                continue;
            }
            try {
                deleteSegment(segment.id());
                expired.add(segment.id());
            } catch (SegmentActiveException e) {
                log.debug("Segment {} became active, skipping expiry", segment.id());
            } catch (IOException e) {
                log.error("Failed to delete expired segment {}: {}", segment.id(), e.getMessage());
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} segments older than {}", expired.size(), cutoff);
        }
        return expired;
    }

    public StorageSummary summary() {
        List<Segment> snapshot = segments();
        long totalBytes = 0;
        Segment oldest = null;
        Segment newest = null;
        for (Segment segment : snapshot) {
            totalBytes += segment.storedBytes();
            if (oldest == null || segment.lastModified().isBefore(oldest.lastModified())) {
                oldest = segment;
            }
            if (newest == null || segment.lastModified().isAfter(newest.lastModified())) {
                newest = segment;
            }
        }
        return new StorageSummary(
                snapshot.size(),
                totalBytes,
                oldest == null ? null : oldest.info().fileName(),
                newest == null ? null : newest.info().fileName(),
                oldest == null ? null : oldest.lastModified(),
                newest == null ? null : newest.lastModified());
    }

    /**
     * Whether the storage directory accepts writes and an active segment is open.
     */
    public boolean isWritable() {
        Segment current = active;
        return !closed && current != null && !current.isRetired() && Files.isDirectory(directory)
                && Files.isWritable(directory);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        appendLock.lock();
        try {
            closed = true;
            for (Segment segment : segments()) {
                try {
                    segment.close();
                } catch (IOException e) {
                    log.error("Failed to close segment {}: {}", segment.id(), e.getMessage());
                }
            }
            log.info("Closed storage directory {}", directory);
        } finally {
            appendLock.unlock();
        }
    }

    private void roll(LocalDate day) throws IOException {
        int nextSequence = segments().stream()
                .filter(s -> s.day().equals(day))
                .mapToInt(s -> sequenceOf(s.id() + Segment.FILE_EXTENSION))
                .max()
                .orElse(0) + 1;
        String id = String.format("%s_%s_%03d", prefix, day, nextSequence);

        Segment next = Segment.create(directory, id, day, codec, fsync);
        Segment previous = active;

        segmentsLock.writeLock().lock();
        try {
            segments.put(id, next);
        } finally {
            segmentsLock.writeLock().unlock();
        }
        active = next;

        if (previous != null) {
            previous.seal();
            log.info("Rolled segment {} -> {} ({} bytes)", previous.id(), id, previous.size());
        }
    }

    private LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, clock.getZone());
    }

    private void removeIncompleteCompressions() throws IOException {
        String suffix = Segment.COMPRESSED_EXTENSION + Segment.TEMP_SUFFIX;
        try (Stream<Path> listing = Files.list(directory)) {
            for (Path file : listing.filter(p -> p.getFileName().toString().startsWith(prefix + "_")
                    && p.getFileName().toString().endsWith(suffix)).toList()) {
                log.warn("Removing incomplete compression {}", file.getFileName());
                Files.delete(file);
            }
        }
    }

    private String idOf(String fileName) {
        String extension = fileName.endsWith(Segment.COMPRESSED_EXTENSION)
                ? Segment.COMPRESSED_EXTENSION
                : Segment.FILE_EXTENSION;
        return fileName.substring(0, fileName.length() - extension.length());
    }

    private LocalDate dayOf(String fileName) {
        return LocalDate.parse(match(fileName).group(1));
    }

    private int sequenceOf(String fileName) {
        return Integer.parseInt(match(fileName).group(2));
    }

    private Matcher match(String fileName) {
        Matcher matcher = fileNamePattern.matcher(fileName);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a segment file name: " + fileName);
        }
        return matcher;
    }
}
