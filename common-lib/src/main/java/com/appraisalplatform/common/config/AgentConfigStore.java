package com.appraisalplatform.common.config;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the agent configuration for the active environment.
 *
 * <p>The orchestration core only reads from this store; nothing in the core mutates
 * configuration at runtime.
 */
public interface AgentConfigStore {

    DeploymentEnvironment environment();

    List<AgentConfig> agents();

    default List<AgentConfig> enabledAgents() {
        return agents().stream().filter(AgentConfig::enabled).toList();
    }

    default Optional<AgentConfig> find(String agentId) {
        return agents().stream().filter(a -> a.id().equals(agentId)).findFirst();
    }
}
