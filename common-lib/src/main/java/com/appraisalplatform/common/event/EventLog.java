package com.appraisalplatform.common.event;

import java.util.List;

/**
 * Sink for structured operational events. {@link #log} is synchronous and must never
 * throw: a failing sink degrades silently to its own diagnostics.
 */
public interface EventLog {

    void log(EventRecord event);

    /**
     * The {@code limit} most recent events, newest first. Sinks without history return
     * an empty list.
     */
    default List<EventRecord> recent(int limit) {
        return List.of();
    }

    default void info(String source, String message, Object data) {
        log(EventRecord.info(source, message, data));
    }

    default void warning(EventSeverity severity, String source, String message, Object data) {
        log(EventRecord.warning(severity, source, message, data));
    }

    default void error(EventSeverity severity, String source, String message, Object data) {
        log(EventRecord.error(severity, source, message, data));
    }
}
