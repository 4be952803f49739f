package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.agent.AgentLifecycleState;
import com.appraisalplatform.common.agent.AgentMetrics;
import com.appraisalplatform.common.config.AgentConfig;
import com.appraisalplatform.common.config.DeploymentEnvironment;
import com.appraisalplatform.common.config.PerformanceThresholds;
import com.appraisalplatform.common.config.StaticAgentConfigStore;
import com.appraisalplatform.common.event.EventSeverity;
import com.appraisalplatform.common.event.EventType;
import com.appraisalplatform.common.event.Slf4jEventLog;
import com.appraisalplatform.common.message.AgentEvent;
import com.appraisalplatform.common.message.AssistanceRequest;
import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageFilter;
import com.appraisalplatform.common.message.MessagePriority;
import com.appraisalplatform.common.message.MessageType;
import com.appraisalplatform.common.replay.InMemoryReplayStore;
import com.appraisalplatform.common.replay.ReplaySettings;
import com.appraisalplatform.orchestrator.broker.MasterControlProgram;
import com.appraisalplatform.orchestrator.support.Events;
import com.appraisalplatform.orchestrator.support.ScriptedAgent;
import com.appraisalplatform.orchestrator.support.TestAgentFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AgentManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private Slf4jEventLog eventLog;
    private InMemoryReplayStore replayStore;
    private MasterControlProgram broker;

    @BeforeEach
    void setUp() {
        eventLog = Events.newLog();
        replayStore = new InMemoryReplayStore(ReplaySettings.inMemory(100, true));
        broker = new MasterControlProgram(eventLog, replayStore, Duration.ofSeconds(2), 100);
    }

    private AgentManager manager(List<AgentConfig> configs, List<AgentFactory> factories) {
        return manager(configs, factories, SupervisionSettings.defaults().withoutLoops());
    }

    private AgentManager manager(List<AgentConfig> configs, List<AgentFactory> factories,
                                 SupervisionSettings settings) {
        return new AgentManager(new StaticAgentConfigStore(DeploymentEnvironment.DEVELOPMENT, configs),
                                new AgentFactoryRegistry(factories), broker, replayStore, eventLog, settings, clock);
    }

    /** Manager over a single running agent with the given thresholds. */
    private AgentManager running(ScriptedAgent agent, PerformanceThresholds thresholds) {
        AgentConfig config = AgentConfig.of(agent.id(), agent.name(), List.copyOf(agent.capabilities()))
            .withThresholds(thresholds);
        AgentManager manager = manager(List.of(config), List.of(TestAgentFactory.returning(agent)));
        manager.initializeAgents().block();
        return manager;
    }

    private List<Message> captureAssistanceRequests() {
        return capture(AssistanceRequest.ACTION);
    }

    private List<Message> capture(String contentAction) {
        List<Message> captured = new CopyOnWriteArrayList<>();
        broker.subscribeToMessages("observer", message -> {
            captured.add(message);
            return Mono.empty();
        }, MessageFilter.any().withContentAction(contentAction));
        return captured;
    }

    private static Map<String, Object> eventData(Message message) {
        return assertInstanceOf(AgentEvent.class, message.content()).data();
    }

    private static final SupervisionSettings IMMEDIATE_RECOVERY =
        SupervisionSettings.defaults().withoutLoops().withRecovery(3, Duration.ZERO);

    // ── initialization ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("enabled agents start, unknown and failing ones are left out")
        void partialFailure() {
            List<AgentConfig> configs = List.of(
                AgentConfig.of("valuation-agent", "Valuation", List.of("valuation:market")),
                AgentConfig.of("workflow-agent", "Workflow", List.of("workflow:route")),
                AgentConfig.of("ghost-agent", "Ghost", List.of()),
                AgentConfig.of("broken-agent", "Broken", List.of()),
                AgentConfig.of("idle-agent", "Idle", List.of()).disabled());
            List<AgentFactory> factories = List.of(
                TestAgentFactory.of("valuation-agent", c -> new ScriptedAgent(c.id(), "valuation:market")),
                TestAgentFactory.of("workflow-agent", c -> new ScriptedAgent(c.id(), "workflow:route")),
                TestAgentFactory.of("broken-agent", c -> {
                    throw new IllegalStateException("missing credentials");
                }),
                TestAgentFactory.of("idle-agent", c -> new ScriptedAgent(c.id())));
            AgentManager manager = manager(configs, factories);

            StepVerifier.create(manager.initializeAgents()).verifyComplete();

            Set<String> ids = manager.getAllAgents().stream().map(Agent::id).collect(Collectors.toSet());
            assertEquals(Set.of("valuation-agent", "workflow-agent"), ids);
            assertEquals(2, broker.getRegisteredAgents().size());
            assertEquals(2, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());
            assertEquals(1, Events.mentioning(eventLog, "Initialized 2 of 4 agents").size());

            AgentStatus status = manager.getAgentStatus("valuation-agent").orElseThrow();
            assertTrue(status.active());
            assertTrue(status.healthy());
            assertEquals(0, status.metrics().requestsProcessed());
            assertNull(status.lastError());
            assertFalse(manager.isMonitoring());
        }

        @Test
        @DisplayName("unknown agent id completes empty and registers nothing")
        void unknownAgentId() {
            AgentManager manager = manager(List.of(), List.of());

            StepVerifier.create(manager.initializeAgent(AgentConfig.of("ghost-agent", "Ghost", List.of())))
                .verifyComplete();

            assertTrue(manager.getAgent("ghost-agent").isEmpty());
            assertTrue(broker.getAgent("ghost-agent").isEmpty());
            assertEquals(1, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());
            assertEquals(1, Events.mentioning(eventLog, "ghost-agent").size());
        }

        @Test
        @DisplayName("initializing the same id twice yields the running agent")
        void duplicateInitialization() {
            AgentConfig config = AgentConfig.of("valuation-agent", "Valuation", List.of());
            AgentManager manager = manager(List.of(config),
                List.of(TestAgentFactory.of("valuation-agent", c -> new ScriptedAgent(c.id()))));

            Agent first = manager.initializeAgent(config).block();
            Agent second = manager.initializeAgent(config).block();

            assertNotNull(first);
            assertSame(first, second);
            assertEquals(1, broker.getRegisteredAgents().size());
            assertEquals(1, Events.of(eventLog, EventType.WARNING, EventSeverity.LOW).size());
        }

        @Test
        @DisplayName("concurrent initialization of one id builds and registers the agent once")
        void concurrentInitialization() {
            AgentConfig config = AgentConfig.of("valuation-agent", "Valuation", List.of());
            AtomicInteger built = new AtomicInteger();
            AgentManager manager = manager(List.of(config), List.of(TestAgentFactory.of("valuation-agent", c -> {
                built.incrementAndGet();
                return new ScriptedAgent(c.id()).initializeDelay(Duration.ofMillis(200));
            })));

            List<Agent> results = Flux.merge(manager.initializeAgent(config), manager.initializeAgent(config))
                .collectList()
                .block(Duration.ofSeconds(5));

            assertNotNull(results);
            assertEquals(2, results.size());
            assertSame(results.get(0), results.get(1));
            assertEquals(1, built.get());
            assertEquals(1, broker.getRegisteredAgents().size());
            assertEquals(1, Events.of(eventLog, EventType.WARNING, EventSeverity.LOW).size());
            assertTrue(Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).isEmpty());
        }

        @Test
        @DisplayName("an agent whose registration fails is shut down and not tracked")
        void registrationFailure() {
            ScriptedAgent squatter = new ScriptedAgent("valuation-agent");
            broker.registerAgent(squatter).block();
            ScriptedAgent created = new ScriptedAgent("valuation-agent");
            AgentConfig config = AgentConfig.of("valuation-agent", "Valuation", List.of());
            AgentManager manager = manager(List.of(config), List.of(TestAgentFactory.returning(created)));

            StepVerifier.create(manager.initializeAgent(config)).verifyComplete();

            assertEquals(AgentLifecycleState.SHUTDOWN, created.lifecycleState());
            assertTrue(manager.getAgent("valuation-agent").isEmpty());
            assertTrue(manager.getAgentStatus("valuation-agent").isEmpty());
            assertSame(squatter, broker.getAgent("valuation-agent").orElseThrow());
            assertEquals(1, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());
        }

        @Test
        @DisplayName("a failed initialization releases the id for a later attempt")
        void retryAfterFailure() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent").failInitialize(true);
            AgentConfig config = AgentConfig.of("valuation-agent", "Valuation", List.of());
            AgentManager manager = manager(List.of(config), List.of(TestAgentFactory.returning(agent)));

            StepVerifier.create(manager.initializeAgent(config)).verifyComplete();
            agent.failInitialize(false);

            assertNotNull(manager.initializeAgent(config).block());
            assertTrue(broker.getAgent("valuation-agent").isPresent());
        }

        @Test
        @DisplayName("a factory producing an agent with another id is rejected")
        void factoryIdMismatch() {
            AgentConfig config = AgentConfig.of("valuation-agent", "Valuation", List.of());
            AgentManager manager = manager(List.of(config),
                List.of(TestAgentFactory.of("valuation-agent", c -> new ScriptedAgent("impostor"))));

            StepVerifier.create(manager.initializeAgent(config)).verifyComplete();

            assertTrue(manager.getAllAgents().isEmpty());
            assertTrue(broker.getAgent("impostor").isEmpty());
            assertEquals(1, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());
        }

        @Test
        @DisplayName("monitoring loops run after initialization when enabled")
        void monitoringStarts() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = manager(List.of(AgentConfig.of(agent.id(), null, List.of())),
                List.of(TestAgentFactory.returning(agent)), SupervisionSettings.defaults());

            manager.initializeAgents().block();
            assertTrue(manager.isMonitoring());

            manager.shutdown().block();
            assertFalse(manager.isMonitoring());
        }
    }

    // ── health ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Health checks")
    class HealthChecks {

        @Test
        @DisplayName("reported metrics are copied into the status")
        void metricsCopied() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent")
                .reportMetrics(new AgentMetrics(10, 2, 35.0, 1, Map.of("cacheHits", 7)));
            AgentManager manager = running(agent, null);

            manager.runHealthChecks().block();

            StatusMetrics metrics = manager.getAgentStatus("valuation-agent").orElseThrow().metrics();
            assertEquals(10, metrics.requestsProcessed());
            assertEquals(2, metrics.errorsEncountered());
            assertEquals(35.0, metrics.avgProcessingTimeMs());
            assertEquals(NOW, metrics.lastHealthCheckTime());
            assertEquals(7, metrics.custom().get("cacheHits"));
        }

        @Test
        @DisplayName("a healthy→unhealthy flip is reported once and recovery is reported")
        void healthFlip() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent").reportHealthy(false);
            AgentManager manager = running(agent, null);

            manager.runHealthChecks().block();
            manager.runHealthChecks().block();

            assertFalse(manager.getAgentStatus("valuation-agent").orElseThrow().healthy());
            assertEquals(1, Events.of(eventLog, EventType.WARNING, EventSeverity.HIGH).size());
            assertEquals(AgentLifecycleState.UNHEALTHY, agent.lifecycleState());

            agent.reportHealthy(true);
            manager.runHealthChecks().block();

            assertTrue(manager.getAgentStatus("valuation-agent").orElseThrow().healthy());
            assertEquals(1, Events.mentioning(eventLog, "healthy again").size());
            assertEquals(AgentLifecycleState.IDLE, agent.lifecycleState());
        }

        @Test
        @DisplayName("a throwing status check marks the agent unhealthy and the pass continues")
        void statusThrows() {
            ScriptedAgent failing = new ScriptedAgent("valuation-agent").failNextStatusChecks(1);
            ScriptedAgent healthy = new ScriptedAgent("workflow-agent");
            AgentManager manager = manager(
                List.of(AgentConfig.of(failing.id(), null, List.of()), AgentConfig.of(healthy.id(), null, List.of())),
                List.of(TestAgentFactory.returning(failing), TestAgentFactory.returning(healthy)));
            manager.initializeAgents().block();

            StepVerifier.create(manager.runHealthChecks()).verifyComplete();

            AgentStatus failed = manager.getAgentStatus("valuation-agent").orElseThrow();
            assertFalse(failed.healthy());
            assertNotNull(failed.lastError());
            assertTrue(failed.lastError().message().contains("status unavailable"));
            assertEquals(NOW, failed.lastError().timestamp());
            assertEquals(1, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());

            AgentStatus other = manager.getAgentStatus("workflow-agent").orElseThrow();
            assertTrue(other.healthy());
            assertEquals(NOW, other.metrics().lastHealthCheckTime());
        }

        @Test
        @DisplayName("a status check that never answers times out")
        void statusTimeout() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent").hangStatus();
            SupervisionSettings settings = new SupervisionSettings(
                Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofMillis(100), false);
            AgentManager manager = manager(List.of(AgentConfig.of(agent.id(), null, List.of())),
                List.of(TestAgentFactory.returning(agent)), settings);
            manager.initializeAgents().block();

            StepVerifier.create(manager.runHealthChecks())
                .expectComplete()
                .verify(Duration.ofSeconds(2));

            AgentStatus status = manager.getAgentStatus("valuation-agent").orElseThrow();
            assertFalse(status.healthy());
            assertTrue(status.lastError().message().contains("timed out"));
        }
    }

    // ── recovery and system health ───────────────────────────────────────────

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        private AgentManager unhealthy(ScriptedAgent agent, SupervisionSettings settings) {
            agent.reportHealthy(false);
            AgentManager manager = manager(List.of(AgentConfig.of(agent.id(), null, List.of())),
                List.of(TestAgentFactory.returning(agent)), settings);
            manager.initializeAgents().block();
            return manager;
        }

        @Test
        @DisplayName("an unhealthy agent is reinitialized but stays unhealthy until the next check")
        void reinitializes() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent, IMMEDIATE_RECOVERY);

            manager.runHealthChecks().block();

            assertEquals(2, agent.initializations.get());
            assertEquals(1, Events.mentioning(eventLog,
                "Attempting recovery for agent valuation-agent (attempt 1 of 3)").size());
            assertEquals(1, Events.mentioning(eventLog, "Reinitialized agent valuation-agent").size());
            assertFalse(manager.getAgentStatus("valuation-agent").orElseThrow().healthy());
            assertEquals(AgentLifecycleState.UNHEALTHY, agent.lifecycleState());

            agent.reportHealthy(true);
            manager.runHealthChecks().block();
            assertTrue(manager.getAgentStatus("valuation-agent").orElseThrow().healthy());
            assertEquals(AgentLifecycleState.IDLE, agent.lifecycleState());
        }

        @Test
        @DisplayName("no second attempt is made within the cooldown")
        void cooldownRespected() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent,
                SupervisionSettings.defaults().withoutLoops().withRecovery(3, Duration.ofSeconds(60)));

            manager.runHealthChecks().block();
            manager.runHealthChecks().block();
            manager.runHealthChecks().block();

            assertEquals(2, agent.initializations.get());
            assertEquals(1, Events.mentioning(eventLog, "Attempting recovery").size());
        }

        @Test
        @DisplayName("exhausted attempts raise one high-severity error and one admin alert")
        void attemptsExhausted() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent, IMMEDIATE_RECOVERY);
            List<Message> alerts = capture(AgentManager.ADMIN_ALERT);

            for (int pass = 0; pass < 5; pass++) {
                manager.runHealthChecks().block();
            }

            assertEquals(4, agent.initializations.get());
            assertEquals(1, Events.mentioning(eventLog,
                "Maximum recovery attempts (3) reached for agent valuation-agent, manual intervention required").size());
            assertEquals(1, Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).size());
            assertEquals(1, alerts.size());
            Message alert = alerts.get(0);
            assertEquals(MessageType.NOTIFICATION, alert.type());
            assertEquals(AgentManager.HEALTH_MONITOR_ID, alert.senderId());
            assertEquals(MessagePriority.HIGH, alert.priority());
            assertEquals("valuation-agent", eventData(alert).get("agentId"));
            assertEquals(3, eventData(alert).get("recoveryAttempts"));
        }

        @Test
        @DisplayName("the attempt counter resets once the agent is healthy again")
        void counterResets() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent, IMMEDIATE_RECOVERY);
            manager.runHealthChecks().block();
            manager.runHealthChecks().block();

            agent.reportHealthy(true);
            manager.runHealthChecks().block();
            agent.reportHealthy(false);
            manager.runHealthChecks().block();

            assertEquals(2, Events.mentioning(eventLog, "(attempt 1 of 3)").size());
            assertEquals(1, Events.mentioning(eventLog, "(attempt 2 of 3)").size());
        }

        @Test
        @DisplayName("a failing reinitialization is logged and the pass completes")
        void reinitializationFails() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent, IMMEDIATE_RECOVERY);
            agent.failInitialize(true);

            StepVerifier.create(manager.runHealthChecks()).verifyComplete();

            assertEquals(1, Events.mentioning(eventLog, "Failed to reinitialize valuation-agent").size());
            assertFalse(manager.getAgentStatus("valuation-agent").orElseThrow().healthy());
            assertEquals(AgentLifecycleState.UNHEALTHY, agent.lifecycleState());
        }

        @Test
        @DisplayName("zero attempts disables recovery")
        void recoveryDisabled() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent");
            AgentManager manager = unhealthy(agent,
                SupervisionSettings.defaults().withoutLoops().withRecovery(0, Duration.ZERO));

            manager.runHealthChecks().block();
            manager.runHealthChecks().block();

            assertEquals(1, agent.initializations.get());
            assertTrue(Events.mentioning(eventLog, "Attempting recovery").isEmpty());
            assertTrue(Events.of(eventLog, EventType.ERROR, EventSeverity.HIGH).isEmpty());
        }
    }

    @Nested
    @DisplayName("System health broadcast")
    class SystemHealth {

        @Test
        @DisplayName("each pass broadcasts degraded with the unhealthy agents, then healthy")
        void degradedThenHealthy() {
            ScriptedAgent sick = new ScriptedAgent("valuation-agent").reportHealthy(false);
            ScriptedAgent fine = new ScriptedAgent("workflow-agent");
            AgentManager manager = manager(
                List.of(AgentConfig.of(sick.id(), null, List.of()), AgentConfig.of(fine.id(), null, List.of())),
                List.of(TestAgentFactory.returning(sick), TestAgentFactory.returning(fine)));
            manager.initializeAgents().block();
            List<Message> reports = capture(AgentManager.SYSTEM_HEALTH);

            manager.runHealthChecks().block();

            assertEquals(1, reports.size());
            Message degraded = reports.get(0);
            assertEquals(MessageType.NOTIFICATION, degraded.type());
            assertEquals(AgentManager.HEALTH_MONITOR_ID, degraded.senderId());
            assertEquals(Message.BROADCAST, degraded.recipientId());
            assertEquals("degraded", eventData(degraded).get("status"));
            assertEquals(1, eventData(degraded).get("unhealthyAgentCount"));
            assertEquals(List.of("valuation-agent"), eventData(degraded).get("unhealthyAgents"));
            assertEquals(2, eventData(degraded).get("totalAgents"));
            assertEquals(1, Events.mentioning(eventLog, "1 unhealthy agents detected during health check").size());
            assertTrue(fine.received.stream().anyMatch(m -> m.id().equals(degraded.id())));

            sick.reportHealthy(true);
            manager.runHealthChecks().block();

            assertEquals(2, reports.size());
            assertEquals("healthy", eventData(reports.get(1)).get("status"));
            assertEquals(0, eventData(reports.get(1)).get("unhealthyAgentCount"));
        }

        @Test
        @DisplayName("the broadcast can be switched off")
        void broadcastDisabled() {
            SupervisionSettings quiet = new SupervisionSettings(Duration.ofSeconds(60), Duration.ofSeconds(300),
                Duration.ofSeconds(5), false, 3, Duration.ofSeconds(60), false);
            AgentManager manager = manager(List.of(AgentConfig.of("valuation-agent", null, List.of())),
                List.of(TestAgentFactory.of("valuation-agent", c -> new ScriptedAgent(c.id()))), quiet);
            manager.initializeAgents().block();
            List<Message> reports = capture(AgentManager.SYSTEM_HEALTH);

            manager.runHealthChecks().block();

            assertTrue(reports.isEmpty());
        }
    }

    // ── performance ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Performance checks")
    class PerformanceChecks {

        @Test
        @DisplayName("error rate above threshold raises exactly one warning and one assistance request")
        void highErrorRate() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent")
                .reportMetrics(new AgentMetrics(100, 20, 50.0, 0, Map.of()));
            AgentManager manager = running(agent, PerformanceThresholds.maxErrorRate(0.1));
            manager.runHealthChecks().block();
            List<Message> assistance = captureAssistanceRequests();

            manager.runPerformanceChecks().block();

            assertEquals(1, Events.of(eventLog, EventType.WARNING).size());
            assertEquals("valuation-agent", Events.of(eventLog, EventType.WARNING).get(0).source());
            assertEquals(1, assistance.size());

            Message message = assistance.get(0);
            assertEquals(MessageType.QUERY, message.type());
            assertEquals("valuation-agent", message.senderId());
            assertEquals(Message.BROADCAST, message.recipientId());
            assertEquals(MessagePriority.HIGH, message.priority());
            assertTrue(message.requiresAcknowledgment());
            AssistanceRequest request = assertInstanceOf(AssistanceRequest.class, message.content());
            assertEquals(AgentManager.HIGH_ERROR_RATE, request.issueType());
            assertEquals("valuation-agent", request.agentId());
            assertEquals(0.2, (Double) request.data().get("errorRate"), 1e-9);
        }

        @Test
        @DisplayName("slow average processing is escalated")
        void slowProcessing() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent")
                .reportMetrics(new AgentMetrics(10, 0, 250.0, 0, Map.of()));
            AgentManager manager = running(agent, new PerformanceThresholds(null, 100L, null));
            manager.runHealthChecks().block();
            List<Message> assistance = captureAssistanceRequests();

            manager.runPerformanceChecks().block();

            assertEquals(1, assistance.size());
            assertEquals(AgentManager.SLOW_PROCESSING,
                ((AssistanceRequest) assistance.get(0).content()).issueType());
        }

        @Test
        @DisplayName("consecutive failures at the threshold are escalated")
        void consecutiveFailures() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent")
                .reportMetrics(new AgentMetrics(10, 3, 20.0, 3, Map.of()));
            AgentManager manager = running(agent, new PerformanceThresholds(null, null, 3));
            manager.runHealthChecks().block();
            List<Message> assistance = captureAssistanceRequests();

            manager.runPerformanceChecks().block();

            assertEquals(1, assistance.size());
            assertEquals(AgentManager.CONSECUTIVE_FAILURES,
                ((AssistanceRequest) assistance.get(0).content()).issueType());
        }

        @Test
        @DisplayName("no requests processed means no error-rate breach")
        void noRequestsNoBreach() {
            AgentManager manager = running(new ScriptedAgent("valuation-agent"), PerformanceThresholds.maxErrorRate(0.0));
            manager.runHealthChecks().block();
            List<Message> assistance = captureAssistanceRequests();

            manager.runPerformanceChecks().block();

            assertTrue(assistance.isEmpty());
            assertTrue(Events.of(eventLog, EventType.WARNING).isEmpty());
        }

        @Test
        @DisplayName("unhealthy agents are skipped until they recover")
        void unhealthySkipped() {
            ScriptedAgent agent = new ScriptedAgent("valuation-agent")
                .reportHealthy(false)
                .reportMetrics(new AgentMetrics(100, 50, 10.0, 0, Map.of()));
            AgentManager manager = running(agent, PerformanceThresholds.maxErrorRate(0.1));
            manager.runHealthChecks().block();
            List<Message> assistance = captureAssistanceRequests();

            manager.runPerformanceChecks().block();
            assertTrue(assistance.isEmpty());

            agent.reportHealthy(true);
            manager.runHealthChecks().block();
            manager.runPerformanceChecks().block();
            assertEquals(1, assistance.size());
        }

        @Test
        @DisplayName("assistance for an unknown agent sends nothing")
        void assistanceForUnknownAgent() {
            AgentManager manager = manager(List.of(), List.of());
            List<Message> assistance = captureAssistanceRequests();

            StepVerifier.create(manager.requestAssistance("ghost-agent", AgentManager.HIGH_ERROR_RATE, Map.of()))
                .verifyComplete();

            assertTrue(assistance.isEmpty());
        }

        @Test
        @DisplayName("a missing issue type is logged as an error instead of failing the caller")
        void assistanceWithoutIssueType() {
            AgentManager manager = running(new ScriptedAgent("valuation-agent"), null);
            List<Message> assistance = captureAssistanceRequests();

            StepVerifier.create(manager.requestAssistance("valuation-agent", null, Map.of()))
                .verifyComplete();

            assertTrue(assistance.isEmpty());
            List<?> errors = Events.of(eventLog, EventType.ERROR, EventSeverity.ERROR);
            assertEquals(1, errors.size());
            assertEquals(1, Events.mentioning(eventLog, "Failed to request assistance for agent valuation-agent").size());
        }

        @Test
        @DisplayName("other agents acknowledge the assistance request")
        void assistanceAcknowledged() {
            ScriptedAgent troubled = new ScriptedAgent("valuation-agent");
            ScriptedAgent helper = new ScriptedAgent("workflow-agent");
            AgentManager manager = manager(
                List.of(AgentConfig.of(troubled.id(), null, List.of()), AgentConfig.of(helper.id(), null, List.of())),
                List.of(TestAgentFactory.returning(troubled), TestAgentFactory.returning(helper)));
            manager.initializeAgents().block();

            manager.requestAssistance("valuation-agent", AgentManager.SLOW_PROCESSING, Map.of("avg", 900)).block();

            assertTrue(helper.received.stream().anyMatch(m -> m.content() instanceof AssistanceRequest));
            assertTrue(troubled.received.stream().anyMatch(m ->
                m.type() == MessageType.RESPONSE && "workflow-agent".equals(m.senderId())));
        }
    }

    // ── shutdown ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("shutdown stops and unregisters every agent, and repeating it is a no-op")
    void shutdownIsIdempotent() {
        ScriptedAgent agent = new ScriptedAgent("valuation-agent");
        AgentManager manager = running(agent, null);

        StepVerifier.create(manager.shutdown()).verifyComplete();
        StepVerifier.create(manager.shutdown()).verifyComplete();

        assertEquals(AgentLifecycleState.SHUTDOWN, agent.lifecycleState());
        assertTrue(broker.getRegisteredAgents().isEmpty());
        assertTrue(manager.getAllAgents().isEmpty());
        assertTrue(manager.getAllAgentStatus().isEmpty());
        assertEquals(1, Events.mentioning(eventLog, "Agent system shut down").size());
    }
}
