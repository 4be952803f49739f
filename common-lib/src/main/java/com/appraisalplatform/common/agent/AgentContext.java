package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.model.Payloads;
import com.appraisalplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call execution context handed to {@link Agent#process}.
 */
public record AgentContext(
    String executionId,
    String correlationId,
    AccessLevel accessLevel,
    Map<String, Object> parameters,
    Instant timestamp,
    String agentId
) {
    private static final Logger log = LoggerFactory.getLogger(AgentContext.class);

    public AgentContext {
        Objects.requireNonNull(executionId, "executionId");
        accessLevel = accessLevel == null ? AccessLevel.USER : accessLevel;
        parameters = Payloads.copyOf(parameters);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /**
     * Logs on behalf of the executing agent with the correlation id bridged into MDC.
     */
    public void log(Level level, String message, Object data) {
        TraceContextUtil.withMdc(correlationId, () -> {
            if (data == null) {
                log.atLevel(level).log("[{}] {} executionId={}", agentId, message, executionId);
            } else {
                log.atLevel(level).log("[{}] {} executionId={} data={}", agentId, message, executionId, data);
            }
        });
    }

    public void log(Level level, String message) {
        log(level, message, null);
    }
}
