package com.example.logstore.files.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileContentResponse(
        @JsonProperty("file_name") String fileName,
        @JsonProperty("lines") List<String> lines,
        @JsonProperty("total_lines") int totalLines,
        @JsonProperty("returned") int returned,
        @JsonProperty("offset") int offset,
        @JsonProperty("limit") int limit,
        @JsonProperty("search") String search) {
}
