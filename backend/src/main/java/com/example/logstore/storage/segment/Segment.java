package com.example.logstore.storage.segment;

import com.example.logstore.exceptions.IndexCorruptionException;
import com.example.logstore.exceptions.SegmentUnavailableException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.storage.RecordLocation;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Represents a single segment file: one JSON-encoded record per line, append-only.
 * <p>
 * Appends and reads use positional channel I/O and only ever look at bytes below the
 * committed {@link #size()}, so a reader never observes a partially written record.
 * Appends must be serialized by the caller.
 * <p>
 * A sealed segment can be replaced by a gzip copy ({@code .log.gz}). Offsets keep
 * addressing the uncompressed stream, so index locations stay valid.
 */
@Slf4j
public class Segment implements AutoCloseable {

    public static final String FILE_EXTENSION = ".log";
    public static final String COMPRESSED_EXTENSION = ".log.gz";
    static final String TEMP_SUFFIX = ".tmp";

    private static final int READ_CHUNK_BYTES = 64 * 1024;
    private static final byte NEWLINE = '\n';

    private final String id;
    private final LocalDate day;
    private final LogEntryCodec codec;
    private final boolean fsync;

    // Swapped by compress() under the exclusive lock; channel is null once compressed
    private volatile Path path;
    private volatile FileChannel channel;
    private volatile boolean compressed;
    private volatile long storedBytes;

    // Shared for appends and reads, exclusive for seal, retire and close
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final Object appendMutex = new Object();

    private volatile long size;
    private volatile long records;
    private volatile long firstId = -1;
    private volatile long lastId = -1;
    private volatile Instant firstTimestamp;
    private volatile Instant lastTimestamp;
    private volatile Instant lastModified;
    private volatile boolean sealed;
    private volatile boolean retired;

    private Segment(String id, Path path, LocalDate day, LogEntryCodec codec, boolean fsync, FileChannel channel) {
        this.id = id;
        this.path = path;
        this.day = day;
        this.codec = codec;
        this.fsync = fsync;
        this.channel = channel;
        this.compressed = channel == null;
    }

    /**
     * Create a new, empty, active segment file.
     */
    public static Segment create(Path directory, String id, LocalDate day, LogEntryCodec codec, boolean fsync)
            throws IOException {
        Path path = directory.resolve(id + FILE_EXTENSION);
        FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
        Segment segment = new Segment(id, path, day, codec, fsync, channel);
        segment.lastModified = Files.getLastModifiedTime(path).toInstant();
        log.debug("Created segment: {}", path);
        return segment;
    }

    /**
     * Open an existing segment file as sealed, rebuilding its metadata and handing every
     * readable record to {@code visitor}. A torn trailing line left by a crash is truncated.
     */
    public static Segment load(Path path, String id, LocalDate day, LogEntryCodec codec,
                               Consumer<StoredRecord> visitor) throws IOException {
        if (path.getFileName().toString().endsWith(COMPRESSED_EXTENSION)) {
            return loadCompressed(path, id, day, codec, visitor);
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        Segment segment = new Segment(id, path, day, codec, false, channel);
        try {
            long fileSize = channel.size();
            segment.size = fileSize;
            long validBytes = segment.scanRecords(fileSize, record -> {
                segment.track(record.entry());
                visitor.accept(record);
            });
            if (validBytes < fileSize) {
                log.warn("Truncating torn tail of segment {}: {} -> {} bytes", id, fileSize, validBytes);
                channel.truncate(validBytes);
                segment.size = validBytes;
            }
            segment.sealed = true;
            segment.lastModified = Files.getLastModifiedTime(path).toInstant();
            log.debug("Loaded segment {}: {} records, {} bytes", id, segment.records, segment.size);
            return segment;
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    private static Segment loadCompressed(Path path, String id, LocalDate day, LogEntryCodec codec,
                                          Consumer<StoredRecord> visitor) throws IOException {
        Segment segment = new Segment(id, path, day, codec, false, null);
        long validBytes = segment.scanRecords(Long.MAX_VALUE, record -> {
            segment.track(record.entry());
            visitor.accept(record);
        });
        segment.size = validBytes;
        segment.storedBytes = Files.size(path);
        segment.sealed = true;
        segment.lastModified = Files.getLastModifiedTime(path).toInstant();
        log.debug("Loaded compressed segment {}: {} records, {} bytes ({} on disk)",
                id, segment.records, segment.size, segment.storedBytes);
        return segment;
    }

    /**
     * Append one record.
     *
     * @return the location the record was written to
     */
    public RecordLocation append(LogEntry entry) throws IOException {
        byte[] encoded = codec.encode(entry);
        ByteBuffer buffer = ByteBuffer.allocate(encoded.length + 1);
        buffer.put(encoded).put(NEWLINE).flip();

        lifecycleLock.readLock().lock();
        try {
            synchronized (appendMutex) {
                if (sealed || retired) {
                    throw new IllegalStateException("Segment " + id + " is not accepting appends");
                }
                long position = size;
                try {
                    while (buffer.hasRemaining()) {
                        channel.write(buffer, position + buffer.position());
                    }
                    if (fsync) {
                        channel.force(false);
                    }
                } catch (IOException e) {
                    discardPartialWrite(position);
                    throw e;
                }
                track(entry);
                size = position + buffer.limit();
                return new RecordLocation(id, position, encoded.length, entry.getId());
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Materialize the record at {@code location}.
     *
     * @return the record, or empty if the segment has been retired
     * @throws IndexCorruptionException if the location does not hold the expected record
     */
    public Optional<LogEntry> read(RecordLocation location) {
        lifecycleLock.readLock().lock();
        try {
            if (retired) {
                return Optional.empty();
            }
            if (location.offset() < 0 || location.offset() + location.length() > size) {
                throw new IndexCorruptionException(id, String.format(
                        "Location %d+%d is outside segment %s (%d bytes)",
                        location.offset(), location.length(), id, size));
            }
            byte[] bytes = compressed ? readCompressed(location) : readPositional(location);

            LogEntry entry;
            try {
                entry = codec.decode(bytes, 0, location.length());
            } catch (IOException e) {
                throw new IndexCorruptionException(id,
                        "Undecodable record at offset " + location.offset() + " in segment " + id, e);
            }
            if (entry.getId() != location.recordId()) {
                throw new IndexCorruptionException(id, String.format(
                        "Expected record %d at offset %d in segment %s, found %d",
                        location.recordId(), location.offset(), id, entry.getId()));
            }
            return Optional.of(entry);
        } catch (IOException e) {
            throw new SegmentUnavailableException("Failed to read segment " + id, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Visit every committed record in append order. Does nothing once retired.
     */
    public void scan(Consumer<StoredRecord> visitor) {
        lifecycleLock.readLock().lock();
        try {
            if (retired) {
                return;
            }
            scanRecords(size, visitor);
        } catch (IOException e) {
            throw new SegmentUnavailableException("Failed to scan segment " + id, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Raw line view of the segment, optionally filtered by a substring.
     */
    public LinesPage readLines(int limit, int offset, String search) {
        lifecycleLock.readLock().lock();
        try {
            if (retired) {
                return new LinesPage(List.of(), 0);
            }
            List<String> window = new ArrayList<>();
            int[] matched = {0};
            scanLines(size, (lineOffset, bytes) -> {
                String line = new String(bytes, StandardCharsets.UTF_8);
                if (search != null && !search.isEmpty() && !line.contains(search)) {
                    return;
                }
                if (matched[0] >= offset && window.size() < limit) {
                    window.add(line);
                }
                matched[0]++;
            });
            return new LinesPage(window, matched[0]);
        } catch (IOException e) {
            throw new SegmentUnavailableException("Failed to read segment " + id, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Replace the sealed segment file with a gzip copy. The copy is written next to the
     * file and moved into place before the original is deleted.
     *
     * @return false if the segment is not sealed, already compressed or retired
     */
    public boolean compress() throws IOException {
        Path target = path.resolveSibling(id + COMPRESSED_EXTENSION);
        Path temp = path.resolveSibling(id + COMPRESSED_EXTENSION + TEMP_SUFFIX);

        // Sealed content is immutable, so the copy only needs to keep retire() out
        lifecycleLock.readLock().lock();
        try {
            if (!sealed || compressed || retired) {
                return false;
            }
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp), READ_CHUNK_BYTES)) {
                copyTo(out);
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
            Files.setLastModifiedTime(temp, Files.getLastModifiedTime(path));
        } finally {
            lifecycleLock.readLock().unlock();
        }

        lifecycleLock.writeLock().lock();
        try {
            if (compressed || retired) {
                Files.deleteIfExists(temp);
                return false;
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            Path original = path;
            channel.close();
            channel = null;
            path = target;
            compressed = true;
            storedBytes = Files.size(target);
            Files.delete(original);
            log.info("Compressed segment {}: {} -> {} bytes", id, size, storedBytes);
            return true;
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * Flush and mark the segment immutable.
     */
    public void seal() throws IOException {
        lifecycleLock.writeLock().lock();
        try {
            if (sealed || retired) {
                return;
            }
            if (channel != null) {
                channel.force(true);
            }
            sealed = true;
            log.debug("Sealed segment {} ({} records, {} bytes)", id, records, size);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * Close and delete the segment file. Waits for in-flight reads to finish; later reads
     * see the segment as gone.
     */
    public void retire() throws IOException {
        lifecycleLock.writeLock().lock();
        try {
            if (retired) {
                return;
            }
            retired = true;
            if (channel != null) {
                channel.close();
            }
            Files.deleteIfExists(path);
            log.debug("Retired segment {}", id);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public void close() throws IOException {
        lifecycleLock.writeLock().lock();
        try {
            if (channel != null && channel.isOpen()) {
                if (!sealed) {
                    channel.force(true);
                }
                channel.close();
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    /**
     * Whether any record of this segment falls inside {@code [start, end]}; null bounds are open.
     */
    public boolean overlaps(Instant start, Instant end) {
        Instant first = firstTimestamp;
        Instant last = lastTimestamp;
        if (first == null || last == null) {
            return false;
        }
        if (start != null && last.isBefore(start)) {
            return false;
        }
        return end == null || !first.isAfter(end);
    }

    public SegmentInfo info() {
        Path current = path;
        return new SegmentInfo(id, current.getFileName().toString(), current.toString(), storedBytes(), records,
                firstTimestamp, lastTimestamp, lastModified, sealed, compressed);
    }

    public String id() {
        return id;
    }

    public LocalDate day() {
        return day;
    }

    /**
     * Committed bytes of the uncompressed record stream.
     */
    public long size() {
        return size;
    }

    /**
     * Bytes the segment occupies on disk.
     */
    public long storedBytes() {
        return compressed ? storedBytes : size;
    }

    public long records() {
        return records;
    }

    public long lastId() {
        return lastId;
    }

    public Instant lastTimestamp() {
        return lastTimestamp;
    }

    public Instant lastModified() {
        return lastModified;
    }

    public boolean isSealed() {
        return sealed;
    }

    public boolean isRetired() {
        return retired;
    }

    public boolean isCompressed() {
        return compressed;
    }

    private void track(LogEntry entry) {
        if (firstId < 0) {
            firstId = entry.getId();
            firstTimestamp = entry.getTimestamp();
        }
        lastId = entry.getId();
        lastTimestamp = entry.getTimestamp();
        lastModified = entry.getTimestamp();
        records++;
    }

    private byte[] readPositional(RecordLocation location) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(location.length());
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, location.offset() + buffer.position());
            if (read < 0) {
                throw new IndexCorruptionException(id, "Unexpected end of segment " + id);
            }
        }
        return buffer.array();
    }

    private byte[] readCompressed(RecordLocation location) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path), READ_CHUNK_BYTES)) {
            long skipped = in.skip(location.offset());
            while (skipped < location.offset()) {
                long step = in.skip(location.offset() - skipped);
                if (step <= 0) {
                    throw new IndexCorruptionException(id, "Unexpected end of segment " + id);
                }
                skipped += step;
            }
            byte[] bytes = in.readNBytes(location.length());
            if (bytes.length < location.length()) {
                throw new IndexCorruptionException(id, "Unexpected end of segment " + id);
            }
            return bytes;
        }
    }

    private void copyTo(OutputStream out) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK_BYTES);
        long position = 0;
        while (position < size) {
            buffer.clear();
            buffer.limit((int) Math.min(buffer.capacity(), size - position));
            int read = channel.read(buffer, position);
            if (read <= 0) {
                throw new IOException("Unexpected end of segment " + id + " at " + position);
            }
            out.write(buffer.array(), 0, read);
            position += read;
        }
    }

    private void discardPartialWrite(long committedSize) {
        try {
            channel.truncate(committedSize);
        } catch (IOException e) {
            log.error("Failed to discard partial write in segment {}: {}", id, e.getMessage());
        }
    }

    private long scanRecords(long limit, Consumer<StoredRecord> visitor) throws IOException {
        return scanLines(limit, (lineOffset, bytes) -> {
            try {
                LogEntry entry = codec.decode(bytes, 0, bytes.length);
                visitor.accept(new StoredRecord(entry, new RecordLocation(id, lineOffset, bytes.length, entry.getId())));
            } catch (IOException e) {
                log.warn("Skipping unreadable record at offset {} in segment {}: {}", lineOffset, id, e.getMessage());
            }
        });
    }

    /**
     * Walk newline-terminated lines below {@code limit}.
     *
     * @return the offset just past the last complete line
     */
    private long scanLines(long limit, LineVisitor visitor) throws IOException {
        if (compressed) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(path), READ_CHUNK_BYTES)) {
                return scanLines(limit, (chunk, length, position) -> in.read(chunk, 0, length), visitor);
            }
        }
        FileChannel source = channel;
        return scanLines(limit,
                (chunk, length, position) -> source.read(ByteBuffer.wrap(chunk, 0, length), position), visitor);
    }

    private long scanLines(long limit, ChunkReader reader, LineVisitor visitor) throws IOException {
        byte[] chunk = new byte[READ_CHUNK_BYTES];
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        long position = 0;
        long lineStart = 0;

        while (position < limit) {
            int read = reader.read(chunk, (int) Math.min(chunk.length, limit - position), position);
            if (read <= 0) {
                break;
            }
            int from = 0;
            for (int i = 0; i < read; i++) {
                if (chunk[i] == NEWLINE) {
                    line.write(chunk, from, i - from);
                    if (line.size() > 0) {
                        visitor.visit(lineStart, line.toByteArray());
                    }
                    line.reset();
                    from = i + 1;
                    lineStart = position + i + 1;
                }
            }
            line.write(chunk, from, read - from);
            position += read;
        }
        return lineStart;
    }

    @FunctionalInterface
    private interface LineVisitor {
        void visit(long offset, byte[] line);
    }

    @FunctionalInterface
    private interface ChunkReader {
        int read(byte[] chunk, int length, long position) throws IOException;
    }
}
