package com.example.logstore.health;

import com.example.logstore.storage.segment.Segment;
import com.example.logstore.storage.segment.SegmentManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StorageHealthIndicator implements HealthIndicator {

    private final SegmentManager segmentManager;

    public StorageHealthIndicator(SegmentManager segmentManager) {
        this.segmentManager = segmentManager;
    }

    @Override
    public Health health() {
        try {
            Segment active = segmentManager.activeSegment();
            if (segmentManager.isWritable() && active != null) {
                return Health.up()
                        .withDetail("directory", segmentManager.directory().toString())
                        .withDetail("active_segment", active.id())
                        .withDetail("active_segment_bytes", active.size())
                        .withDetail("status", "Writable")
                        .build();
            }
            return Health.down()
                    .withDetail("directory", segmentManager.directory().toString())
                    .withDetail("status", active == null ? "No active segment" : "Storage directory is not writable")
                    .build();

        } catch (Exception e) {
            log.error("Storage health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .withDetail("status", "Storage is unavailable")
                    .build();
        }
    }
}
