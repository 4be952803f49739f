package com.appraisalplatform.orchestrator.controller;

import com.appraisalplatform.common.agent.AccessLevel;
import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.orchestrator.broker.ExecuteOptions;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/agents/{id}/execute}. HTTP callers run with
 * {@link AccessLevel#USER} unless they ask for another level.
 */
public record ExecuteRequest(
    @JsonProperty("operation")     @NotBlank String operation,
    @JsonProperty("data")          Map<String, Object> data,
    @JsonProperty("correlationId") String correlationId,
    @JsonProperty("accessLevel")   AccessLevel accessLevel,
    @JsonProperty("parameters")    Map<String, Object> parameters
) {
    AgentRequest toAgentRequest() {
        return AgentRequest.of(operation, data);
    }

    ExecuteOptions toOptions() {
        return new ExecuteOptions(accessLevel == null ? AccessLevel.USER : accessLevel, correlationId, parameters);
    }
}
