package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

public record AgentHealthReport(
    @JsonProperty("healthy") boolean healthy,
    @JsonProperty("metrics") AgentMetrics metrics,
    @JsonProperty("details") Map<String, Object> details
) {
    public AgentHealthReport {
        Objects.requireNonNull(metrics, "metrics");
        details = Payloads.copyOf(details);
    }

    public static AgentHealthReport healthy(AgentMetrics metrics) {
        return new AgentHealthReport(true, metrics, Map.of());
    }

    public static AgentHealthReport unhealthy(AgentMetrics metrics, Map<String, Object> details) {
        return new AgentHealthReport(false, metrics, details);
    }
}
