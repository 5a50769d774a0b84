package com.example.logstore.config;

import com.example.logstore.exceptions.SegmentUnavailableException;
import com.example.logstore.metrics.LogStoreMetrics;
import com.example.logstore.stats.StatsAggregator;
import com.example.logstore.storage.LogWriter;
import com.example.logstore.storage.index.IndexRepairService;
import com.example.logstore.storage.index.LogIndex;
import com.example.logstore.storage.search.SearchEngine;
import com.example.logstore.storage.segment.LogEntryCodec;
import com.example.logstore.storage.segment.SegmentManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Value("${logstore.storage.directory:./logs}")
    private String directory;

    @Value("${logstore.storage.segment-prefix:app}")
    private String segmentPrefix;

    @Value("${logstore.storage.max-segment-bytes:104857600}")
    private long maxSegmentBytes;

    @Value("${logstore.storage.fsync:false}")
    private boolean fsync;

    @Value("${logstore.search.default-limit:100}")
    private int defaultLimit;

    @Value("${logstore.search.max-limit:1000}")
    private int maxLimit;

    @Value("${logstore.write.retry-attempts:3}")
    private long retryAttempts;

    @Value("${logstore.write.retry-interval-ms:100}")
    private long retryIntervalMs;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LogEntryCodec logEntryCodec() {
        return new LogEntryCodec();
    }

    // Opened by LogWriter.recover() so recovered records flow into index and stats
    @Bean(destroyMethod = "close")
    public SegmentManager segmentManager(LogEntryCodec codec, Clock clock) {
        return new SegmentManager(Path.of(directory), segmentPrefix, maxSegmentBytes, fsync, codec, clock);
    }

    @Bean
    public LogIndex logIndex(SegmentManager segmentManager) {
        LogIndex index = new LogIndex();
        segmentManager.addRemovalListener(index::removeSegment);
        return index;
    }

    @Bean
    public StatsAggregator statsAggregator(Clock clock) {
        return new StatsAggregator(clock);
    }

    @Bean
    public IndexRepairService indexRepairService(LogIndex index, SegmentManager segmentManager,
                                                 LogStoreMetrics metrics) {
        return new IndexRepairService(index, segmentManager, metrics);
    }

    @Bean
    public LogWriter logWriter(SegmentManager segmentManager, LogIndex index, StatsAggregator stats,
                               IndexRepairService repairService, Clock clock) {
        LogWriter writer = new LogWriter(segmentManager, index, stats, repairService, clock,
                retryAttempts, retryIntervalMs);
        try {
            writer.recover();
        } catch (IOException e) {
            throw new SegmentUnavailableException("Failed to open storage directory " + directory, e);
        }
        return writer;
    }

    // Depends on the writer so searches only start after recovery
    @Bean
    public SearchEngine searchEngine(SegmentManager segmentManager, LogIndex index,
                                     IndexRepairService repairService, LogWriter logWriter) {
        return new SearchEngine(segmentManager, index, repairService, defaultLimit, maxLimit);
    }
}
