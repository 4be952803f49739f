package com.appraisalplatform.orchestrator.config;

import com.appraisalplatform.common.config.AgentConfigStore;
import com.appraisalplatform.common.config.DeploymentEnvironment;
import com.appraisalplatform.common.config.StaticAgentConfigStore;
import com.appraisalplatform.common.event.EventLog;
import com.appraisalplatform.common.event.EventSeverity;
import com.appraisalplatform.common.event.Slf4jEventLog;
import com.appraisalplatform.common.exception.AgentConfigurationException;
import com.appraisalplatform.common.replay.InMemoryReplayStore;
import com.appraisalplatform.common.replay.JsonLinesReplayStore;
import com.appraisalplatform.common.replay.ReplayBackend;
import com.appraisalplatform.common.replay.ReplayStore;
import com.appraisalplatform.orchestrator.broker.MasterControlProgram;
import com.appraisalplatform.orchestrator.manager.AgentFactory;
import com.appraisalplatform.orchestrator.manager.AgentFactoryRegistry;
import com.appraisalplatform.orchestrator.manager.AgentManager;
import com.appraisalplatform.orchestrator.manager.SupervisionSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Wires the orchestration core from {@link AgentSystemProperties}. Backends without an
 * implementation here fall back to in-memory with a WARNING event.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);
    private static final String SOURCE = "OrchestratorConfig";

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventLog eventLog(ObjectMapper objectMapper, AgentSystemProperties properties) {
        AgentSystemProperties.Logger logger = properties.getLogger();
        Slf4jEventLog eventLog = new Slf4jEventLog(objectMapper, logger.getHistorySize());
        if (logger.isRemote()) {
            eventLog.warning(EventSeverity.LOW, SOURCE,
                "Remote event logging requested but no remote transport is available; events stay local",
                Map.of("console", logger.isConsole(), "file", logger.isFile()));
        }
        return eventLog;
    }

    @Bean
    public ReplayStore replayStore(AgentSystemProperties properties, ObjectMapper objectMapper,
                                   EventLog eventLog, Clock clock) {
        ReplayBackend backend;
        try {
            backend = ReplayBackend.fromName(properties.getReplayBuffer().getType());
        } catch (IllegalArgumentException e) {
            throw new AgentConfigurationException("replay-buffer",
                "Unknown replay backend: " + properties.getReplayBuffer().getType());
        }
        InMemoryReplayStore inMemory = new InMemoryReplayStore(properties.toReplaySettings(backend), clock);
        switch (backend) {
            case IN_MEMORY:
                break;
            case FILE:
                if (properties.getReplayBuffer().isPersistExperiences()) {
                    Path file = Path.of(properties.getReplayBuffer().getFilePath());
                    log.info("Replay store backend selected. type=file path={}", file.toAbsolutePath());
                    return new JsonLinesReplayStore(inMemory, objectMapper, file);
                }
                log.info("File replay backend with persistence disabled, keeping records in memory");
                break;
            default:
                eventLog.warning(EventSeverity.MEDIUM, SOURCE,
                    "Replay backend " + backend + " is not available, using in-memory",
                    Map.of("requested", backend.name()));
        }
        log.info("Replay store backend selected. type=in-memory maxSize={} prioritized={}",
                 properties.getReplayBuffer().getMaxSize(), properties.getReplayBuffer().isUsePrioritizedSampling());
        return inMemory;
    }

    @Bean
    public MasterControlProgram masterControlProgram(AgentSystemProperties properties, EventLog eventLog,
                                                     ReplayStore replayStore) {
        AgentSystemProperties.MessageBroker broker = properties.getMessageBroker();
        BrokerType type;
        try {
            type = BrokerType.fromName(broker.getType());
        } catch (IllegalArgumentException e) {
            throw new AgentConfigurationException("message-broker", "Unknown message broker type: " + broker.getType());
        }
        if (type != BrokerType.IN_MEMORY) {
            eventLog.warning(EventSeverity.MEDIUM, SOURCE,
                "Message broker " + type + " is not available, using in-memory",
                Map.of("requested", type.name()));
        }
        return new MasterControlProgram(eventLog, replayStore, broker.getResponseTimeout(), broker.getHistorySize());
    }

    @Bean
    public AgentConfigStore agentConfigStore(AgentSystemProperties properties) {
        return new StaticAgentConfigStore(DeploymentEnvironment.fromName(properties.getEnvironment()),
                                          properties.toAgentConfigs());
    }

    @Bean
    public AgentFactoryRegistry agentFactoryRegistry(List<AgentFactory> factories) {
        return new AgentFactoryRegistry(factories);
    }

    @Bean
    public AgentManager agentManager(AgentConfigStore configStore, AgentFactoryRegistry factories,
                                     MasterControlProgram broker, ReplayStore replayStore, EventLog eventLog,
                                     AgentSystemProperties properties, Clock clock) {
        SupervisionSettings settings = properties.toSupervisionSettings();
        return new AgentManager(configStore, factories, broker, replayStore, eventLog, settings, clock);
    }
}
