package com.appraisalplatform.common.exception;

/**
 * Configuration faults: a factory that builds the wrong agent, two factories
 * claiming the same id, or a threshold outside its allowed range.
 */
public class AgentConfigurationException extends AgentException {

    public AgentConfigurationException(String agentId, String message) {
        super(agentId, message);
    }
}
