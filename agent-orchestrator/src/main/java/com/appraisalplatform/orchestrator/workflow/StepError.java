package com.appraisalplatform.orchestrator.workflow;

import com.appraisalplatform.common.agent.ValidationIssue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StepError(
    @JsonProperty("stepId")  String stepId,
    @JsonProperty("message") String message,
    @JsonProperty("issues")  List<ValidationIssue> issues
) {
    public StepError {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
