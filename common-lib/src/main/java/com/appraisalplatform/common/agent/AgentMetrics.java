package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counters reported by an agent in its health report.
 *
 * <p>{@code errorsEncountered <= requestsProcessed} holds for every instance; a report
 * that would break it cannot be constructed.
 */
public record AgentMetrics(
    @JsonProperty("requestsProcessed")   long requestsProcessed,
    @JsonProperty("errorsEncountered")   long errorsEncountered,
    @JsonProperty("avgProcessingTimeMs") double avgProcessingTimeMs,
    @JsonProperty("consecutiveFailures") int consecutiveFailures,
    @JsonProperty("custom")              Map<String, Object> custom
) {
    public AgentMetrics {
        if (requestsProcessed < 0 || errorsEncountered < 0 || avgProcessingTimeMs < 0 || consecutiveFailures < 0) {
            throw new IllegalArgumentException("Agent metrics must not be negative");
        }
        if (errorsEncountered > requestsProcessed) {
            throw new IllegalArgumentException(
                "errorsEncountered (" + errorsEncountered + ") exceeds requestsProcessed (" + requestsProcessed + ")");
        }
        custom = Payloads.copyOf(custom);
    }

    public static AgentMetrics zero() {
        return new AgentMetrics(0, 0, 0.0, 0, Map.of());
    }

    public double errorRate() {
        return requestsProcessed == 0 ? 0.0 : (double) errorsEncountered / requestsProcessed;
    }
}
