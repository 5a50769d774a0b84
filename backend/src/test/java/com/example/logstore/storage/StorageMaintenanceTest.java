package com.example.logstore.storage;

import com.example.logstore.MutableClock;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.storage.index.IndexKeyType;
import com.example.logstore.storage.search.LogQuery;
import com.example.logstore.storage.search.SearchResult;
import com.example.logstore.storage.segment.SegmentInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StorageMaintenanceTest {

    private static final Instant T0 = Instant.parse("2026-10-18T10:00:00Z");

    @TempDir
    Path directory;

    private StorageFixture storage;

    @AfterEach
    void tearDown() {
        if (storage != null) {
            storage.close();
        }
    }

    @Test
    void shouldDeleteExpiredSegmentsAndTheirIndexEntries() throws IOException {
        storage = StorageFixture.open(directory, new MutableClock(T0), 1024 * 1024);
        storage.write("error", "old", "t-old", "svc-a");

        storage.clock.advance(Duration.ofDays(8));
        storage.write("error", "new", "t-new", "svc-a");

        List<String> expired = new StorageMaintenance(storage.segmentManager, 7, Duration.ofHours(24)).enforceRetention();

        assertThat(expired).containsExactly("app_2026-10-18_001");
        assertThat(Files.exists(directory.resolve("app_2026-10-18_001.log"))).isFalse();
        assertThat(storage.segmentManager.listSegments()).extracting(SegmentInfo::id)
                .containsExactly("app_2026-10-26_001");
        assertThat(storage.index.lookup(IndexKeyType.TRACE_ID, "t-old")).isEmpty();

        SearchResult result = storage.engine.search(LogQuery.builder().service("svc-a").build(), null, null, true);
        assertThat(result.totalMatched()).isEqualTo(1);
    }

    @Test
    void shouldKeepSegmentsInsideRetention() throws IOException {
        storage = StorageFixture.open(directory, new MutableClock(T0), 1024 * 1024);
        storage.write("info", "recent", null, null);

        storage.clock.advance(Duration.ofDays(2));
        storage.write("info", "newer", null, null);

        List<String> expired = new StorageMaintenance(storage.segmentManager, 7, Duration.ofHours(24)).enforceRetention();

        assertThat(expired).isEmpty();
        assertThat(storage.segmentManager.listSegments()).hasSize(2);
    }

    @Test
    void shouldCompressSealedSegmentsPastTheCompressionAge() throws IOException {
        storage = StorageFixture.open(directory, new MutableClock(T0), 1024 * 1024);
        storage.write("error", "yesterday", "t-old", "svc-a");

        storage.clock.advance(Duration.ofDays(2));
        storage.write("info", "today", "t-new", "svc-a");

        List<String> compressed = new StorageMaintenance(storage.segmentManager, 7, Duration.ofHours(24))
                .compressSealedSegments();

        assertThat(compressed).containsExactly("app_2026-10-18_001");
        assertThat(Files.exists(directory.resolve("app_2026-10-18_001.log"))).isFalse();
        assertThat(Files.exists(directory.resolve("app_2026-10-18_001.log.gz"))).isTrue();
        assertThat(storage.segmentManager.listSegments())
                .extracting(SegmentInfo::id, SegmentInfo::compressed)
                .containsExactly(tuple("app_2026-10-18_001", true), tuple("app_2026-10-20_001", false));

        SearchResult byIndex = storage.engine.search(LogQuery.builder().traceId("t-old").build(), null, null, true);
        assertThat(byIndex.entries()).extracting(LogEntry::getMessage).containsExactly("yesterday");
        SearchResult byScan = storage.engine.search(LogQuery.builder().service("svc-a").build(), null, null, false);
        assertThat(byScan.entries()).extracting(LogEntry::getMessage).containsExactly("today", "yesterday");
    }

    @Test
    void shouldNotCompressWhenDisabledOrTooRecent() throws IOException {
        storage = StorageFixture.open(directory, new MutableClock(T0), 1024 * 1024);
        storage.write("info", "first", null, null);
        storage.clock.advance(Duration.ofDays(1).plusHours(1));
        storage.write("info", "second", null, null);

        assertThat(new StorageMaintenance(storage.segmentManager, 7, Duration.ZERO).compressSealedSegments()).isEmpty();
        assertThat(new StorageMaintenance(storage.segmentManager, 7, Duration.ofDays(3)).compressSealedSegments()).isEmpty();
        assertThat(storage.segmentManager.listSegments()).noneMatch(SegmentInfo::compressed);
    }
}
