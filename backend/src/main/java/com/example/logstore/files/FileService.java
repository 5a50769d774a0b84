package com.example.logstore.files;

import com.example.logstore.exceptions.InvalidQueryException;
import com.example.logstore.exceptions.SegmentUnavailableException;
import com.example.logstore.files.DTOs.FileContentResponse;
import com.example.logstore.files.DTOs.SegmentInfoResponse;
import com.example.logstore.storage.segment.LinesPage;
import com.example.logstore.storage.segment.Segment;
import com.example.logstore.storage.segment.SegmentInfo;
import com.example.logstore.storage.segment.SegmentManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Read-only view of the segment files, plus explicit deletion of sealed segments.
 */
@Slf4j
@Service
public class FileService {

    static final int DEFAULT_CONTENT_LIMIT = 1000;
    static final int MAX_CONTENT_LIMIT = 10000;
    private static final int MAX_FILE_NAME_LENGTH = 255;
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private final SegmentManager segmentManager;

    public FileService(SegmentManager segmentManager) {
        this.segmentManager = segmentManager;
    }

    /**
     * Segments, most recently written first.
     */
    public List<SegmentInfoResponse> listFiles() {
        return segmentManager.listSegments().stream()
                .sorted(Comparator.comparing(SegmentInfo::lastModified).reversed())
                .map(this::toResponse)
                .toList();
    }

    public SegmentInfoResponse getFile(String name) {
        return toResponse(segmentManager.segmentInfo(segmentId(name)));
    }

    public FileContentResponse readContent(String name, Integer limit, Integer offset, String search) {
        String id = segmentId(name);
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_CONTENT_LIMIT : Math.min(limit, MAX_CONTENT_LIMIT);
        int effectiveOffset = offset == null || offset < 0 ? 0 : offset;
        String effectiveSearch = search == null || search.isEmpty() ? null : search;

        SegmentInfo info = segmentManager.segmentInfo(id);
        LinesPage page = segmentManager.readContent(id, effectiveLimit, effectiveOffset, effectiveSearch);
        return new FileContentResponse(
                info.fileName(),
                page.lines(),
                page.total(),
                page.lines().size(),
                effectiveOffset,
                effectiveLimit,
                effectiveSearch);
    }

    public void deleteFile(String name) {
        String id = segmentId(name);
        try {
            segmentManager.deleteSegment(id);
        } catch (IOException e) {
            throw new SegmentUnavailableException("Failed to delete segment " + id, e);
        }
        log.info("Deleted log file {}", id);
    }

    /**
     * Validate a file name from a request path and turn it into a segment id.
     *
     * @throws InvalidQueryException for empty names, names over 255 characters, or names
     *                               containing {@code ..} or a path separator
     */
    public String segmentId(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidQueryException("file name is required");
        }
        if (name.length() > MAX_FILE_NAME_LENGTH) {
            throw new InvalidQueryException("file name too long");
        }
        if (name.contains("..") || name.contains("/") || name.contains("\\")) {
            throw new InvalidQueryException("invalid file name: " + name);
        }
        if (name.endsWith(Segment.COMPRESSED_EXTENSION)) {
            return name.substring(0, name.length() - Segment.COMPRESSED_EXTENSION.length());
        }
        return name.endsWith(Segment.FILE_EXTENSION)
                ? name.substring(0, name.length() - Segment.FILE_EXTENSION.length())
                : name;
    }

    public static String formatFileSize(long size) {
        if (size < 1024) {
            return size + " B";
        }
        double value = size;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
    }

    private SegmentInfoResponse toResponse(SegmentInfo info) {
        return SegmentInfoResponse.from(info, formatFileSize(info.size()));
    }
}
