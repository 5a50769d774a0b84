package com.example.logstore.stats;

import java.time.Instant;
import java.util.Map;

public record StatsSnapshot(
        long total,
        Map<String, Long> perLevel,
        Map<String, Long> perService,
        Map<Instant, Long> perHour,
        Instant periodStart) {
}
