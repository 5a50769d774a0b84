package com.example.logstore.storage;

import com.example.logstore.storage.segment.SegmentManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Deletes segments past the retention period and gzips sealed segments past the
 * compression age. A zero or negative compression age turns compression off.
 */
@Slf4j
@Component
public class StorageMaintenance {

    private final SegmentManager segmentManager;
    private final Duration retention;
    private final Duration compressAfter;

    public StorageMaintenance(SegmentManager segmentManager,
                              @Value("${logstore.storage.retention-days:7}") int retentionDays,
                              @Value("${logstore.storage.compress-after:24h}") Duration compressAfter) {
        this.segmentManager = segmentManager;
        this.retention = Duration.ofDays(retentionDays);
        this.compressAfter = compressAfter;
    }

    @Scheduled(fixedDelayString = "${logstore.storage.retention-check-ms:3600000}",
            initialDelayString = "${logstore.storage.retention-check-ms:3600000}")
    public void runMaintenance() {
        enforceRetention();
        compressSealedSegments();
    }

    public List<String> enforceRetention() {
        log.debug("Checking segments against retention of {}", retention);
        return segmentManager.expireSegments(retention);
    }

    public List<String> compressSealedSegments() {
        if (compressAfter.isZero() || compressAfter.isNegative()) {
            return List.of();
        }
        log.debug("Compressing sealed segments older than {}", compressAfter);
        return segmentManager.compressSegments(compressAfter);
    }
}
