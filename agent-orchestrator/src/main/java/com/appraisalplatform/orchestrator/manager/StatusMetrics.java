package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.agent.AgentMetrics;
import com.appraisalplatform.common.model.Payloads;

import java.time.Instant;
import java.util.Map;

/**
 * Supervisor's copy of an agent's counters, refreshed on every successful health check.
 */
public record StatusMetrics(
    long requestsProcessed,
    long errorsEncountered,
    double avgProcessingTimeMs,
    int consecutiveFailures,
    Instant lastHealthCheckTime,
    Map<String, Object> custom
) {
    public StatusMetrics {
        if (errorsEncountered > requestsProcessed) {
            throw new IllegalArgumentException(
                "errorsEncountered (" + errorsEncountered + ") exceeds requestsProcessed (" + requestsProcessed + ")");
        }
        custom = Payloads.copyOf(custom);
    }

    public static StatusMetrics zero() {
        return new StatusMetrics(0, 0, 0.0, 0, null, Map.of());
    }

    public static StatusMetrics from(AgentMetrics metrics, Instant checkedAt) {
        return new StatusMetrics(metrics.requestsProcessed(), metrics.errorsEncountered(),
                                 metrics.avgProcessingTimeMs(), metrics.consecutiveFailures(),
                                 checkedAt, metrics.custom());
    }

    public double errorRate() {
        return requestsProcessed == 0 ? 0.0 : (double) errorsEncountered / requestsProcessed;
    }
}
