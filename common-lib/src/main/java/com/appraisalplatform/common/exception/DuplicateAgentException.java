package com.appraisalplatform.common.exception;

public class DuplicateAgentException extends AgentException {

    public DuplicateAgentException(String agentId) {
        super(agentId, "Agent with ID " + agentId + " is already registered");
    }
}
