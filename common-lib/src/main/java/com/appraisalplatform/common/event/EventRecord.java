package com.appraisalplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured operational event. Immutable; {@code severity} and {@code data} are optional.
 */
public record EventRecord(
    @JsonProperty("type")      EventType type,
    @JsonProperty("severity")  EventSeverity severity,
    @JsonProperty("source")    String source,
    @JsonProperty("message")   String message,
    @JsonProperty("data")      Object data,
    @JsonProperty("timestamp") Instant timestamp
) {
    public EventRecord {
        Objects.requireNonNull(type, "type");
        source = source == null ? "unknown" : source;
        message = message == null ? "" : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static EventRecord info(String source, String message, Object data) {
        return new EventRecord(EventType.INFO, null, source, message, data, Instant.now());
    }

    public static EventRecord warning(EventSeverity severity, String source, String message, Object data) {
        return new EventRecord(EventType.WARNING, severity, source, message, data, Instant.now());
    }

    public static EventRecord error(EventSeverity severity, String source, String message, Object data) {
        return new EventRecord(EventType.ERROR, severity, source, message, data, Instant.now());
    }
}
