package com.appraisalplatform.common.config;

import java.util.List;
import java.util.Objects;

/**
 * {@link AgentConfigStore} over a fixed list, selected once per environment at startup.
 */
public final class StaticAgentConfigStore implements AgentConfigStore {

    private final DeploymentEnvironment environment;
    private final List<AgentConfig> agents;

    public StaticAgentConfigStore(DeploymentEnvironment environment, List<AgentConfig> agents) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.agents = List.copyOf(agents);
    }

    public static StaticAgentConfigStore of(AgentConfig... agents) {
        return new StaticAgentConfigStore(DeploymentEnvironment.DEVELOPMENT, List.of(agents));
    }

    @Override
    public DeploymentEnvironment environment() {
        return environment;
    }

    @Override
    public List<AgentConfig> agents() {
        return agents;
    }
}
