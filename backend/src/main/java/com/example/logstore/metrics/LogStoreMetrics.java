package com.example.logstore.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class LogStoreMetrics {

    private final Counter logsWrittenCounter;
    private final Counter logsRejectedCounter;
    private final Counter indexRepairsCounter;

    private final Timer indexSearchTime;
    private final Timer scanSearchTime;

    public LogStoreMetrics(MeterRegistry meterRegistry) {
        //write metrics
        this.logsWrittenCounter = Counter.builder("logs.written.total")
                .description("Total number of logs appended to segments")
                .register(meterRegistry);

        this.logsRejectedCounter = Counter.builder("logs.rejected.total")
                .description("Total number of logs rejected by validation or storage errors")
                .register(meterRegistry);

        //index metrics
        this.indexRepairsCounter = Counter.builder("logs.index.repairs.total")
                .description("Total number of index repairs applied")
                .register(meterRegistry);

        //search metrics
        this.indexSearchTime = Timer.builder("logs.search.duration")
                .description("Time taken to answer a search")
                .tag("path", "index")
                .register(meterRegistry);

        this.scanSearchTime = Timer.builder("logs.search.duration")
                .description("Time taken to answer a search")
                .tag("path", "scan")
                .register(meterRegistry);
    }

    public void recordLogWritten() {
        logsWrittenCounter.increment();
    }

    public void recordBatchWritten(int count) {
        logsWrittenCounter.increment(count);
    }

    public void recordLogRejected() {
        logsRejectedCounter.increment();
    }

    public void recordBatchRejected(int count) {
        logsRejectedCounter.increment(count);
    }

    public void recordIndexRepair() {
        indexRepairsCounter.increment();
    }

    public void recordSearch(boolean usedIndex, long startTimeNanos) {
        Timer timer = usedIndex ? indexSearchTime : scanSearchTime;
        timer.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }
}
