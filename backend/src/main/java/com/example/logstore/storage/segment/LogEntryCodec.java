package com.example.logstore.storage.segment;

import com.example.logstore.logs.models.LogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Encodes records as single-line JSON documents, the on-disk format of a segment.
 */
public class LogEntryCodec {

    private final ObjectMapper objectMapper;

    public LogEntryCodec() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public byte[] encode(LogEntry entry) throws IOException {
        return objectMapper.writeValueAsBytes(entry);
    }

    public LogEntry decode(byte[] data, int offset, int length) throws IOException {
        return objectMapper.readValue(data, offset, length, LogEntry.class);
    }
}
