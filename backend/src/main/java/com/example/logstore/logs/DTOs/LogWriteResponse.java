package com.example.logstore.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LogWriteResponse(
        @JsonProperty("id") long id,
        @JsonProperty("timestamp") Instant timestamp) {
}
