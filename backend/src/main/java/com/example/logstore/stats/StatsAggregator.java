package com.example.logstore.stats;

import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counts of accepted records since the start of the current period.
 * Counters are {@link LongAdder}s; taking a snapshot never blocks writers.
 */
@Slf4j
public class StatsAggregator {

    static final String UNKNOWN_SERVICE = "unknown";

    private final Clock clock;
    private volatile Period period;

    public StatsAggregator(Clock clock) {
        this.clock = clock;
        Instant startOfDay = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        this.period = new Period(startOfDay);
    }

    public void record(LogEntry entry) {
        record(entry.getLevel(), entry.getService(), entry.getTimestamp());
    }

    /**
     * Count one record. Records older than the current period are ignored, which lets
     * startup recovery replay every stored record.
     */
    public void record(LogLevel level, String service, Instant timestamp) {
        Period current = period;
        if (timestamp.isBefore(current.start)) {
            return;
        }
        current.total.increment();
        current.perLevel.get(level).increment();
        current.perService.computeIfAbsent(service == null ? UNKNOWN_SERVICE : service, s -> new LongAdder()).increment();
        current.perHour.computeIfAbsent(timestamp.truncatedTo(ChronoUnit.HOURS), h -> new LongAdder()).increment();
    }

    public StatsSnapshot snapshot() {
        Period current = period;

        Map<String, Long> perLevel = new LinkedHashMap<>();
        current.perLevel.forEach((level, count) -> perLevel.put(level.label(), count.sum()));

        Map<String, Long> perService = new TreeMap<>();
        current.perService.forEach((service, count) -> perService.put(service, count.sum()));

        Map<Instant, Long> perHour = new TreeMap<>();
        current.perHour.forEach((hour, count) -> perHour.put(hour, count.sum()));

        return new StatsSnapshot(current.total.sum(), perLevel, perService, perHour, current.start);
    }

    /**
     * Reset all counts and start a new period now.
     */
    @Scheduled(cron = "${logstore.stats.rollover-cron:0 0 0 * * *}")
    public void rollover() {
        Period previous = period;
        period = new Period(clock.instant());
        log.info("Stats rolled over: {} records counted since {}", previous.total.sum(), previous.start);
    }

    private static final class Period {
        private final Instant start;
        private final LongAdder total = new LongAdder();
        private final Map<LogLevel, LongAdder> perLevel = new EnumMap<>(LogLevel.class);
        private final ConcurrentMap<String, LongAdder> perService = new ConcurrentHashMap<>();
        private final ConcurrentMap<Instant, LongAdder> perHour = new ConcurrentHashMap<>();

        private Period(Instant start) {
            this.start = start;
            // Fully populated before publication, read-only afterwards
            for (LogLevel level : LogLevel.values()) {
                perLevel.put(level, new LongAdder());
            }
        }
    }
}
