package com.example.logstore.storage;

import com.example.logstore.MutableClock;
import com.example.logstore.exceptions.EmptyMessageException;
import com.example.logstore.exceptions.InvalidLevelException;
import com.example.logstore.exceptions.SegmentUnavailableException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;
import com.example.logstore.stats.StatsAggregator;
import com.example.logstore.storage.index.IndexKeyType;
import com.example.logstore.storage.index.IndexRepairService;
import com.example.logstore.storage.index.LogIndex;
import com.example.logstore.storage.search.LogQuery;
import com.example.logstore.storage.segment.SegmentManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LogWriterTest {

    private static final Instant T0 = Instant.parse("2026-10-18T10:00:00Z");

    private static LogDraft draft(String level, String message) {
        return new LogDraft(level, message, null, null, null, null, null);
    }

    // ==================== Write path against mocked storage ====================

    @Nested
    @ExtendWith(MockitoExtension.class)
    @MockitoSettings(strictness = Strictness.LENIENT)
    class WithMockedStorage {

        @Mock
        private SegmentManager segmentManager;

        @Mock
        private LogIndex index;

        @Mock
        private IndexRepairService repairService;

        private final MutableClock clock = new MutableClock(T0);
        private StatsAggregator stats;
        private LogWriter writer;

        @BeforeEach
        void setUp() {
            when(segmentManager.appendLock()).thenReturn(new ReentrantLock());
            stats = new StatsAggregator(clock);
            writer = new LogWriter(segmentManager, index, stats, repairService, clock, 3, 1);
        }

        private static RecordLocation location(long recordId) {
            return new RecordLocation("app_2026-10-18_001", recordId * 100, 80, recordId);
        }

        @Test
        void shouldRejectUnknownLevelWithoutAppending() throws IOException {
            assertThatThrownBy(() -> writer.write(draft("fatal", "boom")))
                    .isInstanceOf(InvalidLevelException.class)
                    .hasMessageContaining("fatal");

            verify(segmentManager, never()).append(any());
        }

        @Test
        void shouldRejectMissingLevel() {
            assertThatThrownBy(() -> writer.write(draft(null, "boom")))
                    .isInstanceOf(InvalidLevelException.class);
        }

        @Test
        void shouldRejectBlankMessageWithoutAppending() throws IOException {
            assertThatThrownBy(() -> writer.write(draft("info", "   ")))
                    .isInstanceOf(EmptyMessageException.class);

            verify(segmentManager, never()).append(any());
        }

        @Test
        void shouldAcceptLevelInAnyCaseWithSurroundingWhitespace() throws IOException {
            when(segmentManager.append(any())).thenReturn(location(1));

            writer.write(draft("  WaRn ", "careful"));

            ArgumentCaptor<LogEntry> captor = ArgumentCaptor.forClass(LogEntry.class);
            verify(segmentManager).append(captor.capture());
            assertThat(captor.getValue().getLevel()).isEqualTo(LogLevel.WARN);
        }

        @Test
        void shouldNormalizeBlankOptionalFieldsToAbsent() throws IOException {
            when(segmentManager.append(any())).thenReturn(location(1));

            writer.write(new LogDraft("info", " hello ", " ", "", " svc-a ", null, Map.of()));

            ArgumentCaptor<LogEntry> captor = ArgumentCaptor.forClass(LogEntry.class);
            verify(segmentManager).append(captor.capture());
            LogEntry entry = captor.getValue();
            assertThat(entry.getMessage()).isEqualTo("hello");
            assertThat(entry.getTraceId()).isNull();
            assertThat(entry.getSpanId()).isNull();
            assertThat(entry.getService()).isEqualTo("svc-a");
            assertThat(entry.getFields()).isNull();
        }

        @Test
        void shouldAssignIncreasingIdsAndNonDecreasingTimestamps() throws IOException {
            when(segmentManager.append(any())).thenAnswer(inv -> location(((LogEntry) inv.getArgument(0)).getId()));

            WriteReceipt first = writer.write(draft("info", "one"));
            clock.set(T0.minusSeconds(30));
            WriteReceipt second = writer.write(draft("info", "two"));

            assertThat(second.id()).isEqualTo(first.id() + 1);
            assertThat(second.timestamp()).isEqualTo(first.timestamp());
        }

        @Test
        void shouldRetryTransientAppendFailures() throws IOException {
            when(segmentManager.append(any()))
                    .thenThrow(new IOException("disk hiccup"))
                    .thenThrow(new IOException("disk hiccup"))
                    .thenReturn(location(1));

            WriteReceipt receipt = writer.write(draft("error", "boom"));

            assertThat(receipt.id()).isEqualTo(1);
            verify(segmentManager, times(3)).append(any());
            verify(index).update(any(), eq(location(1)));
        }

        @Test
        void shouldFailWithSegmentUnavailableOnceRetriesAreExhausted() throws IOException {
            when(segmentManager.append(any())).thenThrow(new IOException("disk gone"));

            assertThatThrownBy(() -> writer.write(draft("error", "boom")))
                    .isInstanceOf(SegmentUnavailableException.class)
                    .hasCauseInstanceOf(IOException.class);

            // initial attempt plus three retries
            verify(segmentManager, times(4)).append(any());
            verify(index, never()).update(any(), any());
            assertThat(stats.snapshot().total()).isZero();
            assertThat(writer.lastAssignedId()).isZero();
        }

        @Test
        void shouldQueueRepairWhenIndexUpdateFails() throws IOException {
            when(segmentManager.append(any())).thenReturn(location(1));
            doThrow(new IllegalStateException("index broken")).when(index).update(any(), any());

            WriteReceipt receipt = writer.write(draft("info", "still stored"));

            assertThat(receipt.id()).isEqualTo(1);
            verify(repairService).enqueue(any(), eq(location(1)));
            assertThat(stats.snapshot().total()).isEqualTo(1);
        }

        @Test
        void shouldRejectWholeBatchWhenOneDraftIsInvalid() throws IOException {
            List<LogDraft> batch = List.of(draft("info", "fine"), draft("info", ""), draft("warn", "also fine"));

            assertThatThrownBy(() -> writer.writeBatch(batch)).isInstanceOf(EmptyMessageException.class);

            verify(segmentManager, never()).append(any());
        }
    }

    // ==================== Write path against real storage ====================

    @Nested
    class WithRealStorage {

        @TempDir
        Path directory;

        @Test
        void shouldWriteBatchInOrder() throws IOException {
            try (StorageFixture storage = StorageFixture.open(directory, new MutableClock(T0), 1024 * 1024)) {
                List<WriteReceipt> receipts = storage.writer.writeBatch(List.of(
                        draft("info", "a"), draft("warn", "b"), draft("error", "c")));

                assertThat(receipts).extracting(WriteReceipt::id).containsExactly(1L, 2L, 3L);
                assertThat(storage.stats.snapshot().total()).isEqualTo(3);
            }
        }

        @Test
        void shouldRecoverIdsIndexAndStatsAfterRestart() throws IOException {
            MutableClock clock = new MutableClock(T0);
            try (StorageFixture storage = StorageFixture.open(directory, clock, 1024 * 1024)) {
                storage.write("error", "boom", "t1", "svc-a");
                clock.advance(Duration.ofSeconds(1));
                storage.write("info", "ok", "t2", "svc-b");
                clock.advance(Duration.ofSeconds(1));
                storage.write("warn", "hmm", "t1", "svc-a");
            }

            try (StorageFixture restarted = StorageFixture.open(directory, clock, 1024 * 1024)) {
                assertThat(restarted.writer.lastAssignedId()).isEqualTo(3);
                assertThat(restarted.index.lookup(IndexKeyType.TRACE_ID, "t1")).hasSize(2);
                assertThat(restarted.stats.snapshot().total()).isEqualTo(3);
                assertThat(restarted.stats.snapshot().perService()).containsEntry("svc-a", 2L);

                clock.set(T0);
                WriteReceipt next = restarted.write("info", "after restart", "t1", "svc-a");

                assertThat(next.id()).isEqualTo(4);
                assertThat(next.timestamp()).isAfterOrEqualTo(T0.plusSeconds(2));
                assertThat(restarted.engine.search(LogQuery.builder().traceId("t1").build(), null, null, true)
                        .entries()).extracting(LogEntry::getMessage)
                        .containsExactly("after restart", "hmm", "boom");
            }
        }
    }
}
