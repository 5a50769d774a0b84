package com.example.logstore.logs.services;

import com.example.logstore.exceptions.LogStoreException;
import com.example.logstore.logs.DTOs.LogWriteRequest;
import com.example.logstore.logs.DTOs.LogWriteResponse;
import com.example.logstore.metrics.LogStoreMetrics;
import com.example.logstore.storage.LogDraft;
import com.example.logstore.storage.LogWriter;
import com.example.logstore.storage.WriteReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class LogWriteService {

    private final LogWriter logWriter;
    private final LogStoreMetrics metrics;

    public LogWriteService(LogWriter logWriter, LogStoreMetrics metrics) {
        this.logWriter = logWriter;
        this.metrics = metrics;
    }

    public LogWriteResponse write(LogWriteRequest request) {
        try {
            WriteReceipt receipt = logWriter.write(toDraft(request));
            metrics.recordLogWritten();
            log.debug("Accepted log {} from service {}", receipt.id(), request.service());
            return toResponse(receipt);
        } catch (LogStoreException e) {
            metrics.recordLogRejected();
            log.warn("Rejected log write: {}", e.getMessage());
            throw e;
        }
    }

    public List<LogWriteResponse> writeBatch(List<LogWriteRequest> requests) {
        try {
            List<WriteReceipt> receipts = logWriter.writeBatch(requests.stream().map(this::toDraft).toList());
            metrics.recordBatchWritten(receipts.size());
            log.info("Accepted batch of {} logs", receipts.size());
            return receipts.stream().map(this::toResponse).toList();
        } catch (LogStoreException e) {
            metrics.recordBatchRejected(requests.size());
            log.warn("Rejected batch of {} logs: {}", requests.size(), e.getMessage());
            throw e;
        }
    }

    private LogDraft toDraft(LogWriteRequest request) {
        return new LogDraft(
                request.level(),
                request.message(),
                request.traceId(),
                request.spanId(),
                request.service(),
                request.caller(),
                request.fields());
    }

    private LogWriteResponse toResponse(WriteReceipt receipt) {
        return new LogWriteResponse(receipt.id(), receipt.timestamp());
    }
}
