package com.appraisalplatform.orchestrator.agent;

import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.config.AgentConfig;
import com.appraisalplatform.common.model.AgentIdentity;
import com.appraisalplatform.orchestrator.manager.AgentFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class DiagnosticsAgentFactory implements AgentFactory {

    private final Clock clock;

    public DiagnosticsAgentFactory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String agentId() {
        return DiagnosticsAgent.ID;
    }

    @Override
    public Agent create(AgentConfig config) {
        return new DiagnosticsAgent(AgentIdentity.of(config.id(), config.name(), config.capabilities()), clock);
    }
}
