package com.example.logstore.logs.models;

import com.example.logstore.exceptions.InvalidLevelException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive, whitespace-tolerant parse of a level label.
     *
     * @throws InvalidLevelException if the label is missing or not one of debug, info, warn, error
     */
    @JsonCreator
    public static LogLevel parse(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidLevelException(String.valueOf(label));
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidLevelException(label);
        }
    }
}
