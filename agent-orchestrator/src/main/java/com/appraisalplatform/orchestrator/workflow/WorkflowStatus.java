package com.appraisalplatform.orchestrator.workflow;

public enum WorkflowStatus {
    SUCCESS,
    /** At least one step failed with {@code continueOnError} set */
    PARTIAL_SUCCESS,
    ERROR
}
