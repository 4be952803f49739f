package com.appraisalplatform.common.message;

import com.appraisalplatform.common.agent.ValidationIssue;
import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform result of {@code Agent.process}. Failures are carried as
 * {@link ResponseStatus#ERROR} values rather than thrown.
 *
 * <p>{@code executionTimeMs} is {@code null} until the agent base or the broker stamps it.
 */
public record AgentResponse(
    @JsonProperty("status")          ResponseStatus status,
    @JsonProperty("message")         String message,
    @JsonProperty("data")            Map<String, Object> data,
    @JsonProperty("issues")          List<ValidationIssue> issues,
    @JsonProperty("executionTimeMs") Long executionTimeMs
) implements MessageContent {

    public static final String ACTION = "response";

    public AgentResponse {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
        data = Payloads.copyOf(data);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static AgentResponse success(String message, Map<String, Object> data) {
        return new AgentResponse(ResponseStatus.SUCCESS, message, data, List.of(), null);
    }

    public static AgentResponse error(String message) {
        return new AgentResponse(ResponseStatus.ERROR, message, Map.of(), List.of(), null);
    }

    public static AgentResponse error(String message, List<ValidationIssue> issues) {
        return new AgentResponse(ResponseStatus.ERROR, message, Map.of(), issues, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status != ResponseStatus.ERROR;
    }

    public AgentResponse withExecutionTime(long executionTimeMs) {
        return new AgentResponse(status, message, data, issues, executionTimeMs);
    }

    @Override
    public String action() {
        return ACTION;
    }
}
