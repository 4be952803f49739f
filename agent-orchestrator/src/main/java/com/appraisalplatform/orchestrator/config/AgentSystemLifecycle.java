package com.appraisalplatform.orchestrator.config;

import com.appraisalplatform.orchestrator.manager.AgentManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the agent system once the application is ready and stops it on context close.
 */
@Component
public class AgentSystemLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentSystemLifecycle.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final AgentManager agentManager;
    private final AgentSystemProperties properties;

    public AgentSystemLifecycle(AgentManager agentManager, AgentSystemProperties properties) {
        this.agentManager = agentManager;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting agent system. settings={}", properties.startupSummary());
        AgentSystemProperties.Security security = properties.getSecurity();
        if (security.isEncryptSensitiveData() && !security.hasEncryptionKey()) {
            log.warn("Sensitive data encryption is requested but no encryption key is configured");
        }
        agentManager.initializeAgents().subscribe(
            ignored -> { },
            e -> log.error("Agent system start failed", e),
            () -> log.info("Agent system started. agents={}", agentManager.getAllAgents().size()));
    }

    @PreDestroy
    public void stop() {
        agentManager.shutdown().block(SHUTDOWN_TIMEOUT);
    }
}
