package com.example.logstore.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope shared by every endpoint.
 *
 * @param code      HTTP status of the response
 * @param errorCode application error code, present on failures only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        @JsonProperty("success") boolean success,
        @JsonProperty("data") T data,
        @JsonProperty("error") String error,
        @JsonProperty("error_code") Integer errorCode,
        @JsonProperty("message") String message,
        @JsonProperty("code") int code,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("request_id") String requestId) {

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, null, null, message, 200, Instant.now(), newRequestId());
    }

    public static <T> ApiResponse<T> error(int status, Integer errorCode, String error, String message, T data) {
        return new ApiResponse<>(false, data, error, errorCode, message, status, Instant.now(), newRequestId());
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }
}
