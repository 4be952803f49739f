package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.config.AgentConfig;

/**
 * Builds the concrete agent for one configured id. Implementations are Spring beans
 * collected into the {@link AgentFactoryRegistry}.
 */
public interface AgentFactory {

    String agentId();

    Agent create(AgentConfig config);
}
