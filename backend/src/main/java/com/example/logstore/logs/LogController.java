package com.example.logstore.logs;

import com.example.logstore.logs.DTOs.ApiResponse;
import com.example.logstore.logs.DTOs.LogSearchRequest;
import com.example.logstore.logs.DTOs.LogSearchResponse;
import com.example.logstore.logs.DTOs.LogWriteRequest;
import com.example.logstore.logs.DTOs.LogWriteResponse;
import com.example.logstore.logs.services.LogSearchService;
import com.example.logstore.logs.services.LogWriteService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/logs")
public class LogController {

    private final LogWriteService logWriteService;
    private final LogSearchService logSearchService;

    public LogController(LogWriteService logWriteService, LogSearchService logSearchService) {
        this.logWriteService = logWriteService;
        this.logSearchService = logSearchService;
    }

    @PostMapping("/write")
    public ResponseEntity<ApiResponse<LogWriteResponse>> writeLog(@Valid @RequestBody LogWriteRequest request) {
        LogWriteResponse response = logWriteService.write(request);
        return ResponseEntity.ok(ApiResponse.ok(response, "Log written successfully"));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<List<LogWriteResponse>>> writeBatch(
            @RequestBody List<@NotNull @Valid LogWriteRequest> requests) {
        List<LogWriteResponse> responses = logWriteService.writeBatch(requests);
        return ResponseEntity.ok(ApiResponse.ok(responses, responses.size() + " logs written successfully"));
    }

    /**
     * Search logs. Uses the index when {@code use_index} is set and the query names a trace id,
     * span id, service or single level; scans segments otherwise.
     */
    @PostMapping("/search")
    public ResponseEntity<ApiResponse<LogSearchResponse>> searchLogs(@Valid @RequestBody LogSearchRequest request) {
        log.debug("Search request: trace_id={}, service={}, level={}, use_index={}",
                request.traceId(), request.service(), request.level(), request.useIndex());
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.search(request), "Search completed"));
    }

    @GetMapping("/errors")
    public ResponseEntity<ApiResponse<LogSearchResponse>> getErrors(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.errors(limit, offset), "Error logs retrieved"));
    }

    @GetMapping("/trace/{traceId}")
    public ResponseEntity<ApiResponse<LogSearchResponse>> getByTraceId(
            @PathVariable String traceId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.byTraceId(traceId, limit, offset), "Search completed"));
    }

    @GetMapping("/span/{spanId}")
    public ResponseEntity<ApiResponse<LogSearchResponse>> getBySpanId(
            @PathVariable String spanId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.bySpanId(spanId, limit, offset), "Search completed"));
    }

    @GetMapping("/level/{level}")
    public ResponseEntity<ApiResponse<LogSearchResponse>> getByLevel(
            @PathVariable String level,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.byLevel(level, limit, offset), "Search completed"));
    }

    @GetMapping("/service/{service}")
    public ResponseEntity<ApiResponse<LogSearchResponse>> getByService(
            @PathVariable String service,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(ApiResponse.ok(logSearchService.byService(service, limit, offset), "Search completed"));
    }
}
