package com.example.logstore.storage.search;

import com.example.logstore.exceptions.InvalidQueryException;
import com.example.logstore.logs.models.LogEntry;
import com.example.logstore.logs.models.LogLevel;
import lombok.Builder;

import java.time.Instant;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Conjunction of optional predicates over a record. Null or empty members match anything.
 * The message predicate is a regular expression found anywhere in the message.
 */
@Builder(toBuilder = true)
public record LogQuery(
        String traceId,
        String spanId,
        String service,
        Set<LogLevel> levels,
        Instant start,
        Instant end,
        Pattern messagePattern) {

    public LogQuery {
        levels = levels == null ? Set.of() : Set.copyOf(levels);
    }

    public static LogQuery errorsOnly() {
        return LogQuery.builder().levels(Set.of(LogLevel.ERROR)).build();
    }

    /**
     * Compile a message expression; blank means no message predicate.
     *
     * @throws InvalidQueryException if the expression does not compile
     */
    public static Pattern compileMessagePattern(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(expression);
        } catch (PatternSyntaxException e) {
            throw new InvalidQueryException("invalid message pattern: " + e.getDescription());
        }
    }

    public boolean matches(LogEntry entry) {
        if (traceId != null && !traceId.equals(entry.getTraceId())) {
            return false;
        }
        if (spanId != null && !spanId.equals(entry.getSpanId())) {
            return false;
        }
        if (service != null && !service.equals(entry.getService())) {
            return false;
        }
        if (!levels.isEmpty() && !levels.contains(entry.getLevel())) {
            return false;
        }
        if (start != null && entry.getTimestamp().isBefore(start)) {
            return false;
        }
        if (end != null && entry.getTimestamp().isAfter(end)) {
            return false;
        }
        return messagePattern == null
                || (entry.getMessage() != null && messagePattern.matcher(entry.getMessage()).find());
    }

    /**
     * Number of predicates answerable by an equality index.
     */
    public int indexableKeyCount() {
        int count = 0;
        if (traceId != null) count++;
        if (spanId != null) count++;
        if (service != null) count++;
        if (levels.size() == 1) count++;
        return count;
    }

    /**
     * True when nothing but a single indexed key constrains the query.
     */
    public boolean isSingleKey() {
        return indexableKeyCount() == 1 && levels.size() <= 1
                && start == null && end == null && messagePattern == null;
    }

    public static class LogQueryBuilder {

        public LogQueryBuilder message(String expression) {
            return messagePattern(compileMessagePattern(expression));
        }
    }
}
