package com.appraisalplatform.orchestrator.workflow;

import com.appraisalplatform.common.message.AgentResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable state of one execution. Steps run one after another, so no locking.
 */
final class WorkflowRun {

    private final AgentWorkflow workflow;
    private final String executionId;
    private final Instant startTime;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private final Map<String, AgentResponse> stepResults = new LinkedHashMap<>();
    private final List<StepError> errors = new ArrayList<>();
    private WorkflowStatus status = WorkflowStatus.SUCCESS;
    private boolean halted;

    WorkflowRun(AgentWorkflow workflow, String executionId, Map<String, Object> input, Instant startTime) {
        this.workflow = workflow;
        this.executionId = executionId;
        this.startTime = startTime;
        data.put("input", input == null ? Map.of() : new LinkedHashMap<>(input));
    }

    AgentWorkflow workflow() {
        return workflow;
    }

    String executionId() {
        return executionId;
    }

    boolean halted() {
        return halted;
    }

    boolean shouldRun(WorkflowStep step) {
        return step.condition() == null || WorkflowPaths.isTruthy(WorkflowPaths.get(data, step.condition()));
    }

    Map<String, Object> inputFor(WorkflowStep step) {
        Map<String, Object> input = new LinkedHashMap<>();
        step.inputMapping().forEach((target, source) -> WorkflowPaths.put(input, target, WorkflowPaths.get(data, source)));
        return input;
    }

    /**
     * Stores the response, applies the output mapping and folds a failure into the status.
     */
    void record(WorkflowStep step, AgentResponse response) {
        stepResults.put(step.id(), response);
        Map<String, Object> view = view(response);
        data.putIfAbsent("output", new LinkedHashMap<String, Object>());
        data.put("lastStepResult", view);
        step.outputMapping().forEach((target, source) -> WorkflowPaths.put(data, target, WorkflowPaths.get(view, source)));

        if (response.isSuccess()) {
            return;
        }
        String message = response.message().isBlank() ? null : response.message();
        if (step.continueOnError()) {
            if (status != WorkflowStatus.ERROR) {
                status = WorkflowStatus.PARTIAL_SUCCESS;
            }
            errors.add(new StepError(step.id(),
                message != null ? message : "Step execution failed, continuing as specified", response.issues()));
        } else {
            status = WorkflowStatus.ERROR;
            errors.add(new StepError(step.id(), message != null ? message : "Step execution failed", response.issues()));
            halted = true;
        }
    }

    WorkflowResult finish(Instant endTime) {
        Object output = data.get("output");
        @SuppressWarnings("unchecked")
        Map<String, Object> finalOutput = output instanceof Map<?, ?> ? (Map<String, Object>) output : Map.of();
        return new WorkflowResult(workflow.id(), executionId, status, stepResults, finalOutput,
                                  startTime, endTime, errors);
    }

    private static Map<String, Object> view(AgentResponse response) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", response.status().name().toLowerCase(Locale.ROOT));
        view.put("message", response.message());
        view.put("data", response.data());
        view.put("issues", response.issues());
        view.put("executionTimeMs", response.executionTimeMs());
        return view;
    }
}
