package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.exception.AgentConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed dispatch table from configured agent id to its factory, fixed at startup.
 */
public final class AgentFactoryRegistry {

    private final Map<String, AgentFactory> factories;

    public AgentFactoryRegistry(Collection<? extends AgentFactory> factories) {
        Map<String, AgentFactory> byId = new LinkedHashMap<>();
        for (AgentFactory factory : factories) {
            AgentFactory previous = byId.putIfAbsent(factory.agentId(), factory);
            if (previous != null) {
                throw new AgentConfigurationException(factory.agentId(),
                    "Two factories declared for the same agent id: "
                        + previous.getClass().getName() + ", " + factory.getClass().getName());
            }
        }
        this.factories = Collections.unmodifiableMap(byId);
    }

    public Optional<AgentFactory> find(String agentId) {
        return Optional.ofNullable(factories.get(agentId));
    }

    public Set<String> agentIds() {
        return factories.keySet();
    }
}
