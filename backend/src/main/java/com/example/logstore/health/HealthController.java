package com.example.logstore.health;

import com.example.logstore.logs.DTOs.ApiResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint. Always answers 200; a storage problem shows up as {@code degraded}.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final StorageHealthIndicator storageHealthIndicator;
    private final String version;

    public HealthController(StorageHealthIndicator storageHealthIndicator,
                            @Value("${logstore.version:1.0.0}") String version) {
        this.storageHealthIndicator = storageHealthIndicator;
        this.version = version;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<HealthResponse>> health() {
        Health storage = storageHealthIndicator.health();
        String status = Status.UP.equals(storage.getStatus()) ? "healthy" : "degraded";
        HealthResponse response = new HealthResponse(status, Instant.now(), "log-store-api", version,
                storage.getDetails());
        return ResponseEntity.ok(ApiResponse.ok(response, "Service is " + status));
    }

    public record HealthResponse(
            @JsonProperty("status") String status,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("service") String service,
            @JsonProperty("version") String version,
            @JsonProperty("storage") Map<String, Object> storage) {
    }
}
