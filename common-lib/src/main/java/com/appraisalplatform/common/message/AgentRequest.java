package com.appraisalplatform.common.message;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Operation invoked on an agent; {@code data} is opaque to the core.
 */
public record AgentRequest(
    @JsonProperty("operation") String operation,
    @JsonProperty("data")      Map<String, Object> data
) implements MessageContent {

    public AgentRequest {
        Objects.requireNonNull(operation, "operation");
        data = Payloads.copyOf(data);
    }

    public static AgentRequest of(String operation) {
        return new AgentRequest(operation, Map.of());
    }

    public static AgentRequest of(String operation, Map<String, Object> data) {
        return new AgentRequest(operation, data);
    }

    @Override
    public String action() {
        return operation;
    }
}
