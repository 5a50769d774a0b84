package com.example.logstore.stats;

import com.example.logstore.files.FileService;
import com.example.logstore.logs.DTOs.ApiResponse;
import com.example.logstore.storage.index.LogIndex;
import com.example.logstore.storage.segment.SegmentManager;
import com.example.logstore.storage.segment.StorageSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/stats")
public class StatsController {

    private final StatsAggregator statsAggregator;
    private final SegmentManager segmentManager;
    private final LogIndex logIndex;

    public StatsController(StatsAggregator statsAggregator, SegmentManager segmentManager, LogIndex logIndex) {
        this.statsAggregator = statsAggregator;
        this.segmentManager = segmentManager;
        this.logIndex = logIndex;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<StatsResponse>> getStats() {
        StatsSnapshot snapshot = statsAggregator.snapshot();
        StorageSummary summary = segmentManager.summary();

        StatsResponse response = new StatsResponse(
                snapshot.total(),
                snapshot.perLevel(),
                snapshot.perService(),
                snapshot.perHour(),
                snapshot.periodStart(),
                logIndex.entryCount(),
                StatsResponse.Storage.from(summary, FileService.formatFileSize(summary.totalBytes())));
        return ResponseEntity.ok(ApiResponse.ok(response, "Stats retrieved"));
    }
}
