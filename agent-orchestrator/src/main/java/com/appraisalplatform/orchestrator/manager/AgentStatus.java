package com.appraisalplatform.orchestrator.manager;

import java.util.Objects;

/**
 * Supervisor view of one agent. Replaced wholesale on every update.
 */
public record AgentStatus(String id, boolean active, boolean healthy, StatusMetrics metrics, LastError lastError) {

    public AgentStatus {
        Objects.requireNonNull(id, "id");
        metrics = metrics == null ? StatusMetrics.zero() : metrics;
    }

    public static AgentStatus initial(String id) {
        return new AgentStatus(id, true, true, StatusMetrics.zero(), null);
    }

    public AgentStatus withHealth(boolean healthy, StatusMetrics metrics) {
        return new AgentStatus(id, active, healthy, metrics, lastError);
    }

    public AgentStatus withFailure(LastError lastError) {
        return new AgentStatus(id, active, false, metrics, lastError);
    }

    public AgentStatus inactive() {
        return new AgentStatus(id, false, healthy, metrics, lastError);
    }
}
