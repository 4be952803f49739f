package com.appraisalplatform.orchestrator.workflow;

/**
 * Raised when a workflow cannot be started: unknown id or disabled.
 */
public class WorkflowException extends RuntimeException {
    private final String workflowId;

    public WorkflowException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
