package com.appraisalplatform.orchestrator.workflow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One agent call inside an {@link AgentWorkflow}.
 *
 * <p>Mappings are {@code target -> source} dot paths. {@code inputMapping} reads from the
 * workflow data ({@code input}, {@code output}, {@code lastStepResult}) and builds the request
 * data; {@code outputMapping} reads from the step's response ({@code status}, {@code message},
 * {@code data}, {@code issues}, {@code executionTimeMs}) and writes into the workflow data.
 * A step with a {@code condition} runs only when that path of the workflow data is truthy.
 */
public record WorkflowStep(
    @JsonProperty("id")              String id,
    @JsonProperty("agentId")         String agentId,
    @JsonProperty("operation")       String operation,
    @JsonProperty("inputMapping")    Map<String, String> inputMapping,
    @JsonProperty("outputMapping")   Map<String, String> outputMapping,
    @JsonProperty("condition")       String condition,
    @JsonProperty("continueOnError") boolean continueOnError
) {
    public WorkflowStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(operation, "operation");
        inputMapping = ordered(inputMapping);
        outputMapping = ordered(outputMapping);
        condition = condition == null || condition.isBlank() ? null : condition;
    }

    public static WorkflowStep of(String id, String agentId, String operation) {
        return new WorkflowStep(id, agentId, operation, Map.of(), Map.of(), null, false);
    }

    public WorkflowStep mapInput(String target, String source) {
        Map<String, String> mapping = new LinkedHashMap<>(inputMapping);
        mapping.put(target, source);
        return new WorkflowStep(id, agentId, operation, mapping, outputMapping, condition, continueOnError);
    }

    public WorkflowStep mapOutput(String target, String source) {
        Map<String, String> mapping = new LinkedHashMap<>(outputMapping);
        mapping.put(target, source);
        return new WorkflowStep(id, agentId, operation, inputMapping, mapping, condition, continueOnError);
    }

    public WorkflowStep when(String condition) {
        return new WorkflowStep(id, agentId, operation, inputMapping, outputMapping, condition, continueOnError);
    }

    public WorkflowStep continuingOnError() {
        return new WorkflowStep(id, agentId, operation, inputMapping, outputMapping, condition, true);
    }

    private static Map<String, String> ordered(Map<String, String> mapping) {
        if (mapping == null || mapping.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }
}
