package com.appraisalplatform.orchestrator.workflow;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named sequence of agent calls run by {@link WorkflowEngine}. {@code parameters} are
 * passed to every step's agent context.
 */
public record AgentWorkflow(
    @JsonProperty("id")          String id,
    @JsonProperty("name")        String name,
    @JsonProperty("description") String description,
    @JsonProperty("enabled")     boolean enabled,
    @JsonProperty("steps")       List<WorkflowStep> steps,
    @JsonProperty("parameters")  Map<String, Object> parameters
) {
    public AgentWorkflow {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        steps = steps == null ? List.of() : List.copyOf(steps);
        parameters = Payloads.copyOf(parameters);
        Set<String> stepIds = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!stepIds.add(step.id())) {
                throw new IllegalArgumentException("Duplicate step id " + step.id() + " in workflow " + id);
            }
        }
    }

    public static AgentWorkflow of(String id, String name, List<WorkflowStep> steps) {
        return new AgentWorkflow(id, name, null, true, steps, Map.of());
    }

    public AgentWorkflow withParameters(Map<String, Object> parameters) {
        return new AgentWorkflow(id, name, description, enabled, steps, parameters);
    }

    public AgentWorkflow disabled() {
        return new AgentWorkflow(id, name, description, false, steps, parameters);
    }
}
