package com.appraisalplatform.orchestrator.workflow;

import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one workflow execution. {@code stepResults} holds the steps that ran, in
 * order; skipped steps are absent.
 */
public record WorkflowResult(
    @JsonProperty("workflowId")  String workflowId,
    @JsonProperty("executionId") String executionId,
    @JsonProperty("status")      WorkflowStatus status,
    @JsonProperty("stepResults") Map<String, AgentResponse> stepResults,
    @JsonProperty("output")      Map<String, Object> output,
    @JsonProperty("startTime")   Instant startTime,
    @JsonProperty("endTime")     Instant endTime,
    @JsonProperty("errors")      List<StepError> errors
) {
    public WorkflowResult {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(status, "status");
        stepResults = stepResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
        output = Payloads.copyOf(output);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @JsonIgnore
    public Duration duration() {
        return startTime == null || endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
    }
}
