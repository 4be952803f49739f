package com.appraisalplatform.common.exception;

/**
 * Raised when a caller addresses an agent id that was never registered.
 *
 * <p>This is the one failure {@code executeAgent} signals as an error rather than
 * folding into an error response, so "no such agent" cannot be mistaken for
 * "agent returned an error".
 */
public class AgentNotFoundException extends AgentException {

    public AgentNotFoundException(String agentId) {
        super(agentId, "Agent with ID " + agentId + " not found");
    }
}
