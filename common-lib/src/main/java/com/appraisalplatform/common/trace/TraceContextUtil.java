package com.appraisalplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Lightweight reactive tracing utility for message correlation.
 *
 * <p>Reactor Context is the single source of truth for the correlation id inside
 * reactive pipelines. MDC is only ever written as a temporary bridge during a log
 * statement, never as a persistent ThreadLocal store.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withCorrelationId(pipeline, message.correlationId());
 * </pre>
 *
 * <p>Usage pattern inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getCorrelationId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String SOURCE_KEY = "source";

    private TraceContextUtil() {}

    /**
     * Stores {@code correlationId} in the Reactor Context so every operator upstream of
     * {@code contextWrite} can read it via {@link #getCorrelationId(ContextView)}.
     *
     * @param mono          the reactive pipeline to enrich
     * @param correlationId the correlation identifier to propagate
     * @param <T>           pipeline element type
     * @return the same pipeline with the correlation id stored in its Reactor Context
     */
    public static <T> Mono<T> withCorrelationId(Mono<T> mono, String correlationId) {
        return mono.contextWrite(ctx -> ctx.put(CORRELATION_ID_KEY, correlationId));
    }

    /**
     * Retrieves the correlation id from the Reactor {@link ContextView}.
     * Returns {@code "unknown"} if not present, never {@code null}.
     */
    public static String getCorrelationId(ContextView ctx) {
        return ctx.getOrDefault(CORRELATION_ID_KEY, "unknown");
    }

    /**
     * Temporarily bridges {@code correlationId} into MDC for the duration of
     * {@code logAction}, then removes the entry. ONLY use this inside logging side-effects.
     */
    public static void withMdc(String correlationId, Runnable logAction) {
        withMdc(CORRELATION_ID_KEY, correlationId, logAction);
    }

    /**
     * Same as {@link #withMdc(String, Runnable)} for an arbitrary MDC key.
     * A {@code null} value runs the action without touching MDC.
     */
    public static void withMdc(String key, String value, Runnable logAction) {
        if (value == null) {
            logAction.run();
            return;
        }
        MDC.put(key, value);
        try {
            logAction.run();
        } finally {
            MDC.remove(key);
        }
    }
}
