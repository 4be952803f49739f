package com.appraisalplatform.common.event;

import com.appraisalplatform.common.trace.TraceContextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * {@link EventLog} writing through SLF4J, keeping the last {@code historySize} events
 * in memory for status queries.
 *
 * <p>INFO maps to {@code info}, WARNING to {@code warn}, ERROR to {@code error}. The event
 * source is bridged into MDC under {@link TraceContextUtil#SOURCE_KEY} while the
 * statement is written.
 */
public class Slf4jEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(Slf4jEventLog.class);
    private static final Logger events = LoggerFactory.getLogger("agent-system.events");

    private final ObjectMapper objectMapper;
    private final int historySize;
    private final Deque<EventRecord> history = new ArrayDeque<>();

    public Slf4jEventLog(ObjectMapper objectMapper, int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must not be negative: " + historySize);
        }
        this.objectMapper = objectMapper;
        this.historySize = historySize;
    }

    @Override
    public void log(EventRecord event) {
        if (event == null) {
            return;
        }
        try {
            remember(event);
            write(event);
        } catch (RuntimeException e) {
            log.warn("Event log write failed. source={} message={}", event.source(), event.message(), e);
        }
    }

    @Override
    public List<EventRecord> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        synchronized (history) {
            List<EventRecord> result = new ArrayList<>(Math.min(limit, history.size()));
            Iterator<EventRecord> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
            return result;
        }
    }

    public long count(EventType type) {
        synchronized (history) {
            return history.stream().filter(e -> e.type() == type).count();
        }
    }

    /**
     * All retained events, oldest first.
     */
    public List<EventRecord> events() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    private void remember(EventRecord event) {
        if (historySize == 0) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private void write(EventRecord event) {
        String severity = event.severity() == null ? "-" : event.severity().name();
        String data = render(event.data());
        TraceContextUtil.withMdc(TraceContextUtil.SOURCE_KEY, event.source(), () -> {
            switch (event.type()) {
                case INFO -> events.info("[{}] {} severity={} data={}", event.source(), event.message(), severity, data);
                case WARNING -> events.warn("[{}] {} severity={} data={}", event.source(), event.message(), severity, data);
                case ERROR -> events.error("[{}] {} severity={} data={}", event.source(), event.message(), severity, data);
            }
        });
    }

    private String render(Object data) {
        if (data == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException | RuntimeException e) {
            return String.valueOf(data);
        }
    }
}
