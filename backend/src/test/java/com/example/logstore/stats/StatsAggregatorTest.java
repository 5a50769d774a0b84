package com.example.logstore.stats;

import com.example.logstore.MutableClock;
import com.example.logstore.logs.models.LogLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.example.logstore.TestEntries.traced;
import static org.assertj.core.api.Assertions.assertThat;

class StatsAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-10-18T10:15:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final StatsAggregator aggregator = new StatsAggregator(clock);

    @Test
    void shouldStartPeriodAtBeginningOfDay() {
        assertThat(aggregator.snapshot().periodStart()).isEqualTo(Instant.parse("2026-10-18T00:00:00Z"));
    }

    @Test
    void shouldCountPerLevelServiceAndHour() {
        aggregator.record(LogLevel.ERROR, "svc-a", T0);
        aggregator.record(LogLevel.ERROR, "svc-b", T0.plusSeconds(60));
        aggregator.record(LogLevel.INFO, "svc-a", T0.plus(Duration.ofHours(1)));

        StatsSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.total()).isEqualTo(3);
        assertThat(snapshot.perLevel())
                .containsEntry("error", 2L)
                .containsEntry("info", 1L)
                .containsEntry("debug", 0L)
                .containsEntry("warn", 0L);
        assertThat(snapshot.perService()).containsEntry("svc-a", 2L).containsEntry("svc-b", 1L);
        assertThat(snapshot.perHour())
                .containsEntry(Instant.parse("2026-10-18T10:00:00Z"), 2L)
                .containsEntry(Instant.parse("2026-10-18T11:00:00Z"), 1L);
    }

    @Test
    void shouldCountMissingServiceAsUnknown() {
        aggregator.record(traced(1, T0, LogLevel.WARN, "no service", null, null));

        assertThat(aggregator.snapshot().perService()).containsEntry("unknown", 1L);
    }

    @Test
    void shouldIgnoreRecordsFromBeforeThePeriod() {
        aggregator.record(LogLevel.INFO, "svc", Instant.parse("2026-10-17T23:59:59Z"));

        assertThat(aggregator.snapshot().total()).isZero();
    }

    @Test
    void shouldResetCountsOnRollover() {
        aggregator.record(LogLevel.INFO, "svc", T0);
        clock.advance(Duration.ofHours(14));

        aggregator.rollover();
        aggregator.record(LogLevel.DEBUG, "svc", clock.instant());

        StatsSnapshot snapshot = aggregator.snapshot();
        assertThat(snapshot.periodStart()).isEqualTo(clock.instant());
        assertThat(snapshot.total()).isEqualTo(1);
        assertThat(snapshot.perLevel()).containsEntry("info", 0L).containsEntry("debug", 1L);
    }

    @Test
    void shouldNotLoseConcurrentIncrements() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    aggregator.record(LogLevel.INFO, "svc-" + (i % 5), T0);
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        StatsSnapshot snapshot = aggregator.snapshot();
        assertThat(snapshot.total()).isEqualTo(8000);
        assertThat(snapshot.perService().values().stream().mapToLong(Long::longValue).sum()).isEqualTo(8000);
    }
}
