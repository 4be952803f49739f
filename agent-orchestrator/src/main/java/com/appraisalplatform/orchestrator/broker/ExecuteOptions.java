package com.appraisalplatform.orchestrator.broker;

import com.appraisalplatform.common.agent.AccessLevel;
import com.appraisalplatform.common.model.Payloads;

import java.util.Map;

/**
 * Caller-supplied options for {@link MasterControlProgram#executeAgent}. A {@code null}
 * correlation id lets the broker generate one.
 */
public record ExecuteOptions(AccessLevel accessLevel, String correlationId, Map<String, Object> parameters) {

    public ExecuteOptions {
        accessLevel = accessLevel == null ? AccessLevel.SYSTEM : accessLevel;
        parameters = Payloads.copyOf(parameters);
    }

    public static ExecuteOptions defaults() {
        return new ExecuteOptions(AccessLevel.SYSTEM, null, Map.of());
    }

    public static ExecuteOptions withCorrelationId(String correlationId) {
        return new ExecuteOptions(AccessLevel.SYSTEM, correlationId, Map.of());
    }
}
