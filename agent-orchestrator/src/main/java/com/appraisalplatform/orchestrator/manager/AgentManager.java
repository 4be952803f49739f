package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.agent.AgentHealthReport;
import com.appraisalplatform.common.config.AgentConfig;
import com.appraisalplatform.common.config.AgentConfigStore;
import com.appraisalplatform.common.config.PerformanceThresholds;
import com.appraisalplatform.common.event.EventLog;
import com.appraisalplatform.common.event.EventSeverity;
import com.appraisalplatform.common.exception.AgentConfigurationException;
import com.appraisalplatform.common.exception.AgentException;
import com.appraisalplatform.common.message.AgentEvent;
import com.appraisalplatform.common.message.AssistanceRequest;
import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageOptions;
import com.appraisalplatform.common.message.MessagePriority;
import com.appraisalplatform.common.message.MessageType;
import com.appraisalplatform.common.replay.ReplayStore;
import com.appraisalplatform.orchestrator.broker.MasterControlProgram;
import com.appraisalplatform.orchestrator.schedule.PeriodicTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supervisor of the agent system.
 *
 * <p>Builds agents from configuration through the {@link AgentFactoryRegistry}, wires and
 * registers them with the broker, and keeps one {@link AgentStatus} per agent. Two
 * {@link PeriodicTask} loops run after {@link #initializeAgents()}:
 * <pre>
 *   health      : getStatus() per agent, sequential, bounded by the health-check timeout;
 *                 unhealthy agents are re-initialized, then a system_health notification
 *   performance : active + healthy agents with thresholds, breach → assistance request
 * </pre>
 *
 * <p>A recovery attempt never marks an agent healthy; the next health check decides.
 * Once the attempts are used up the manager raises one admin alert per outage.
 *
 * <p>Failures are contained here: they become events and status fields, never errors
 * on the returned {@code Mono}s.
 */
public class AgentManager {

    private static final Logger log = LoggerFactory.getLogger(AgentManager.class);

    public static final String SOURCE = "AgentManager";

    public static final String HIGH_ERROR_RATE = "high_error_rate";
    public static final String SLOW_PROCESSING = "slow_processing";
    public static final String CONSECUTIVE_FAILURES = "consecutive_failures";

    public static final String HEALTH_MONITOR_ID = "agent-health-monitor";
    public static final String SYSTEM_HEALTH = "system_health";
    public static final String ADMIN_ALERT = "admin_alert";

    private final AgentConfigStore configStore;
    private final AgentFactoryRegistry factories;
    private final MasterControlProgram broker;
    private final ReplayStore replayStore;
    private final EventLog eventLog;
    private final SupervisionSettings settings;
    private final Clock clock;

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, AgentConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, AgentStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Sinks.One<Agent>> initializing = new ConcurrentHashMap<>();
    private final Map<String, Recovery> recoveries = new ConcurrentHashMap<>();

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private PeriodicTask healthTask;
    private PeriodicTask performanceTask;

    public AgentManager(AgentConfigStore configStore, AgentFactoryRegistry factories,
                        MasterControlProgram broker, ReplayStore replayStore, EventLog eventLog,
                        SupervisionSettings settings, Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.factories = Objects.requireNonNull(factories, "factories");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.replayStore = Objects.requireNonNull(replayStore, "replayStore");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ── initialization ───────────────────────────────────────────────────────

    /**
     * Initializes every enabled agent one after another, then starts the monitoring
     * loops. An agent that fails is logged and left out; the rest still start.
     */
    public Mono<Void> initializeAgents() {
        return Mono.defer(() -> {
            List<AgentConfig> enabled = configStore.enabledAgents();
            log.info("Initializing agents. environment={} enabled={}", configStore.environment(), enabled.size());
            return Flux.fromIterable(enabled)
                .concatMap(config -> initializeAgent(config).map(agent -> 1).defaultIfEmpty(0))
                .reduce(0, Integer::sum)
                .doOnNext(initialized -> {
                    startMonitoring();
                    eventLog.info(SOURCE, "Initialized " + initialized + " of " + enabled.size() + " agents",
                        Map.of("initialized", initialized, "configured", enabled.size(),
                               "environment", configStore.environment().name()));
                })
                .then();
        });
    }

    /**
     * Builds, initializes and registers the agent for {@code config}. Completes empty
     * for an unknown id or any failure along the way; a duplicate id yields the agent
     * already running. Concurrent calls for one id build it once: later callers wait
     * for the first and are answered as duplicates.
     */
    public Mono<Agent> initializeAgent(AgentConfig config) {
        return Mono.defer(() -> {
            Sinks.One<Agent> claim = Sinks.one();
            Sinks.One<Agent> inFlight = initializing.putIfAbsent(config.id(), claim);
            if (inFlight != null) {
                return inFlight.asMono().map(this::alreadyInitialized);
            }
            Agent existing = agents.get(config.id());
            if (existing != null) {
                release(config.id(), claim);
                return Mono.just(alreadyInitialized(existing));
            }
            return build(config)
                .onErrorResume(e -> {
                    log.error("Agent initialization failed. agentId={}", config.id(), e);
                    eventLog.error(EventSeverity.HIGH, SOURCE,
                        "Failed to initialize agent " + config.id() + ": " + describe(e),
                        Map.of("agentId", config.id(), "error", describe(e)));
                    return Mono.empty();
                })
                .doOnNext(claim::tryEmitValue)
                .doFinally(signal -> release(config.id(), claim));
        });
    }

    private Mono<Agent> build(AgentConfig config) {
        return Mono.defer(() -> {
            Optional<AgentFactory> factory = factories.find(config.id());
            if (factory.isEmpty()) {
                log.error("Unknown agent id. agentId={} known={}", config.id(), factories.agentIds());
                eventLog.error(EventSeverity.HIGH, SOURCE, "Unknown agent ID: " + config.id(),
                    Map.of("agentId", config.id()));
                return Mono.empty();
            }
            Agent agent = factory.get().create(config);
            if (agent == null || !config.id().equals(agent.id())) {
                throw new AgentConfigurationException(config.id(),
                    "Factory produced " + (agent == null ? "no agent" : "agent " + agent.id()));
            }
            return agent.initialize(broker, replayStore)
                .then(Mono.defer(() -> broker.registerAgent(agent)))
                .onErrorResume(e -> discard(agent).then(Mono.error(e)))
                .then(Mono.fromSupplier(() -> track(agent, config)));
        });
    }

    private Agent alreadyInitialized(Agent existing) {
        log.warn("Agent already initialized. agentId={}", existing.id());
        eventLog.warning(EventSeverity.LOW, SOURCE,
            "Agent with ID " + existing.id() + " already initialized",
            Map.of("agentId", existing.id()));
        return existing;
    }

    private void release(String agentId, Sinks.One<Agent> claim) {
        initializing.remove(agentId, claim);
        claim.tryEmitEmpty();
    }

    /**
     * Shuts down an agent that never made it into the registry.
     */
    private Mono<Void> discard(Agent agent) {
        return Mono.defer(agent::shutdown)
            .onErrorResume(e -> {
                log.warn("Shutdown of discarded agent failed. agentId={}", agent.id(), e);
                return Mono.empty();
            });
    }

    private Agent track(Agent agent, AgentConfig config) {
        agents.put(agent.id(), agent);
        configs.put(agent.id(), config);
        statuses.put(agent.id(), AgentStatus.initial(agent.id()));
        log.info("Agent initialized. agentId={} name={} capabilities={}", agent.id(), agent.name(), agent.capabilities());
        eventLog.info(SOURCE, "Agent " + agent.id() + " initialized",
            Map.of("agentId", agent.id(), "name", agent.name(), "capabilities", List.copyOf(agent.capabilities())));
        return agent;
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<Agent> getAllAgents() {
        return List.copyOf(agents.values());
    }

    public Optional<AgentStatus> getAgentStatus(String agentId) {
        return Optional.ofNullable(statuses.get(agentId));
    }

    public List<AgentStatus> getAllAgentStatus() {
        return List.copyOf(statuses.values());
    }

    public boolean isMonitoring() {
        synchronized (this) {
            return healthTask != null && healthTask.isRunning();
        }
    }

    // ── health checks ────────────────────────────────────────────────────────

    /**
     * One sequential health pass over every agent, followed by recovery of the unhealthy
     * ones and the system status report. Never fails.
     */
    public Mono<Void> runHealthChecks() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(agents.values())))
            .concatMap(agent -> checkHealth(agent).then(Mono.defer(() -> recoverIfUnhealthy(agent))))
            .then(Mono.defer(this::reportSystemHealth));
    }

    private Mono<Void> checkHealth(Agent agent) {
        return Mono.defer(agent::getStatus)
            .timeout(settings.healthCheckTimeout())
            .switchIfEmpty(Mono.error(() -> new AgentException(agent.id(), "Status report was empty")))
            .doOnNext(report -> healthReported(agent, report))
            .onErrorResume(e -> {
                healthCheckFailed(agent, e);
                return Mono.empty();
            })
            .then();
    }

    private void healthReported(Agent agent, AgentHealthReport report) {
        Instant now = clock.instant();
        AtomicReference<AgentStatus> previous = new AtomicReference<>();
        AgentStatus updated = statuses.computeIfPresent(agent.id(), (id, current) -> {
            previous.set(current);
            return current.withHealth(report.healthy(), StatusMetrics.from(report.metrics(), now));
        });
        if (updated != null && report.healthy()) {
            recoveries.remove(agent.id());
        }
        if (updated == null || previous.get().healthy() == report.healthy()) {
            return;
        }
        if (report.healthy()) {
            log.info("Agent recovered. agentId={}", agent.id());
            eventLog.info(SOURCE, "Agent " + agent.id() + " is healthy again", Map.of("agentId", agent.id()));
        } else {
            log.warn("Agent became unhealthy. agentId={} details={}", agent.id(), report.details());
            eventLog.warning(EventSeverity.HIGH, SOURCE, "Agent " + agent.id() + " reported unhealthy status",
                Map.of("agentId", agent.id(), "details", report.details()));
        }
        notifyHealthChanged(agent, report.healthy());
    }

    private void healthCheckFailed(Agent agent, Throwable e) {
        Instant now = clock.instant();
        String message = e instanceof TimeoutException
            ? "Health check timed out after " + settings.healthCheckTimeout().toMillis() + "ms"
            : describe(e);
        AtomicReference<AgentStatus> previous = new AtomicReference<>();
        AgentStatus updated = statuses.computeIfPresent(agent.id(), (id, current) -> {
            previous.set(current);
            return current.withFailure(new LastError(message, now, Map.of("exception", e.getClass().getName())));
        });
        log.error("Health check failed. agentId={} reason={}", agent.id(), message, e);
        eventLog.error(EventSeverity.HIGH, SOURCE, "Health check failed for agent " + agent.id() + ": " + message,
            Map.of("agentId", agent.id(), "error", message));
        if (updated != null && previous.get().healthy()) {
            notifyHealthChanged(agent, false);
        }
    }

    private void notifyHealthChanged(Agent agent, boolean healthy) {
        try {
            agent.onHealthChanged(healthy);
        } catch (RuntimeException e) {
            log.warn("Health change callback failed. agentId={} healthy={}", agent.id(), healthy, e);
        }
    }

    // ── recovery ─────────────────────────────────────────────────────────────

    private Mono<Void> recoverIfUnhealthy(Agent agent) {
        AgentStatus status = statuses.get(agent.id());
        if (status == null || status.healthy() || !settings.recoveryEnabled() || shutdown.get()) {
            return Mono.empty();
        }
        Recovery recovery = recoveries.getOrDefault(agent.id(), Recovery.NONE);
        if (recovery.attempts() >= settings.maxRecoveryAttempts()) {
            return recovery.alerted() ? Mono.empty() : recoveryExhausted(agent, status, recovery);
        }
        Instant now = clock.instant();
        if (recovery.lastAttempt() != null && now.isBefore(recovery.lastAttempt().plus(settings.recoveryCooldown()))) {
            log.debug("Recovery cooling down. agentId={} lastAttempt={}", agent.id(), recovery.lastAttempt());
            return Mono.empty();
        }
        Recovery attempt = recovery.attempted(now);
        recoveries.put(agent.id(), attempt);
        log.info("Attempting agent recovery. agentId={} attempt={} max={}",
                 agent.id(), attempt.attempts(), settings.maxRecoveryAttempts());
        eventLog.info(SOURCE, "Attempting recovery for agent " + agent.id() + " (attempt " + attempt.attempts()
                + " of " + settings.maxRecoveryAttempts() + ")",
            Map.of("agentId", agent.id(), "attempt", attempt.attempts(), "maxAttempts", settings.maxRecoveryAttempts()));
        return Mono.defer(() -> agent.initialize(broker, replayStore))
            .timeout(settings.healthCheckTimeout())
            .doOnSuccess(ignored -> {
                log.info("Agent reinitialized. agentId={}", agent.id());
                eventLog.info(SOURCE, "Reinitialized agent " + agent.id(), Map.of("agentId", agent.id()));
            })
            .onErrorResume(e -> {
                log.error("Agent recovery failed. agentId={} attempt={}", agent.id(), attempt.attempts(), e);
                eventLog.error(EventSeverity.HIGH, SOURCE, "Failed to reinitialize " + agent.id() + ": " + describe(e),
                    Map.of("agentId", agent.id(), "attempt", attempt.attempts(), "error", describe(e)));
                return Mono.empty();
            })
            // the supervisor's view stays unhealthy until a health check says otherwise
            .doFinally(signal -> notifyHealthChanged(agent, false));
    }

    private Mono<Void> recoveryExhausted(Agent agent, AgentStatus status, Recovery recovery) {
        recoveries.put(agent.id(), recovery.alertRaised());
        String message = "Maximum recovery attempts (" + settings.maxRecoveryAttempts() + ") reached for agent "
            + agent.id() + ", manual intervention required";
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agent.id());
        data.put("recoveryAttempts", recovery.attempts());
        data.put("lastError", status.lastError() != null ? status.lastError().message() : "Unknown error");
        log.error("Agent recovery exhausted. agentId={} attempts={}", agent.id(), recovery.attempts());
        eventLog.error(EventSeverity.HIGH, SOURCE, message, data);

        Map<String, Object> alert = new LinkedHashMap<>(data);
        alert.put("message", message);
        alert.put("recommendedActions", List.of(
            "Check agent logs for errors",
            "Verify agent configuration",
            "Manually restart agent or entire system if needed"));
        Message notification = broker.createMessage(MessageType.NOTIFICATION, HEALTH_MONITOR_ID, Message.BROADCAST,
            AgentEvent.of(ADMIN_ALERT, alert),
            MessageOptions.defaults().withPriority(MessagePriority.HIGH));
        return broker.sendMessage(notification)
            .onErrorResume(e -> {
                log.error("Admin alert failed. agentId={}", agent.id(), e);
                eventLog.error(EventSeverity.HIGH, SOURCE, "Error notifying system administrators: " + describe(e),
                    Map.of("agentId", agent.id(), "error", describe(e)));
                return Mono.empty();
            });
    }

    /**
     * Logs the unhealthy agents of the pass and broadcasts a {@code system_health}
     * notification: {@code healthy} when none are unhealthy, {@code degraded} otherwise.
     */
    private Mono<Void> reportSystemHealth() {
        if (shutdown.get()) {
            return Mono.empty();
        }
        List<String> unhealthy = statuses.values().stream()
            .filter(status -> !status.healthy())
            .map(AgentStatus::id)
            .sorted()
            .toList();
        if (!unhealthy.isEmpty()) {
            log.warn("Unhealthy agents detected. agents={}", unhealthy);
            eventLog.warning(EventSeverity.MEDIUM, SOURCE,
                unhealthy.size() + " unhealthy agents detected during health check",
                Map.of("unhealthyAgents", unhealthy));
        }
        if (!settings.broadcastHealthStatus()) {
            return Mono.empty();
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", unhealthy.isEmpty() ? "healthy" : "degraded");
        data.put("unhealthyAgentCount", unhealthy.size());
        data.put("unhealthyAgents", unhealthy);
        data.put("totalAgents", agents.size());
        Message notification = broker.createMessage(MessageType.NOTIFICATION, HEALTH_MONITOR_ID, Message.BROADCAST,
            AgentEvent.of(SYSTEM_HEALTH, data), MessageOptions.defaults().withPriority(MessagePriority.HIGH));
        return broker.sendMessage(notification)
            .onErrorResume(e -> {
                log.error("System health broadcast failed", e);
                eventLog.error(EventSeverity.MEDIUM, SOURCE, "Error broadcasting system health: " + describe(e),
                    Map.of("error", describe(e)));
                return Mono.empty();
            });
    }

    private record Recovery(int attempts, Instant lastAttempt, boolean alerted) {

        static final Recovery NONE = new Recovery(0, null, false);

        Recovery attempted(Instant at) {
            return new Recovery(attempts + 1, at, alerted);
        }

        Recovery alertRaised() {
            return new Recovery(attempts, lastAttempt, true);
        }
    }

    // ── performance checks ───────────────────────────────────────────────────

    /**
     * Compares the last reported metrics of every active and healthy agent with its
     * thresholds; each breach logs a warning and raises an assistance request.
     * Unhealthy agents are skipped until they recover.
     */
    public Mono<Void> runPerformanceChecks() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(statuses.values())))
            .filter(status -> status.active() && status.healthy())
            .concatMap(status -> Mono.justOrEmpty(configs.get(status.id()))
                .flatMap(config -> Mono.justOrEmpty(config.thresholds()))
                .flatMapMany(thresholds -> Flux.fromIterable(breaches(status, thresholds)))
                .concatMap(breach -> {
                    log.warn("Performance threshold breached. agentId={} issueType={} data={}",
                             status.id(), breach.issueType(), breach.data());
                    eventLog.warning(EventSeverity.MEDIUM, status.id(), breach.message(), breach.data());
                    return requestAssistance(status.id(), breach.issueType(), breach.data());
                }))
            .then();
    }

    private List<Breach> breaches(AgentStatus status, PerformanceThresholds thresholds) {
        StatusMetrics metrics = status.metrics();
        List<Breach> breaches = new ArrayList<>();
        if (thresholds.maxErrorRate() != null && metrics.requestsProcessed() > 0
                && metrics.errorRate() > thresholds.maxErrorRate()) {
            breaches.add(new Breach(HIGH_ERROR_RATE,
                String.format("Agent %s has a high error rate of %.2f%%, exceeding threshold of %.2f%%",
                              status.id(), metrics.errorRate() * 100, thresholds.maxErrorRate() * 100),
                breachData("errorRate", metrics.errorRate(), thresholds.maxErrorRate(), metrics)));
        }
        if (thresholds.maxAvgProcessingTimeMs() != null
                && metrics.avgProcessingTimeMs() > thresholds.maxAvgProcessingTimeMs()) {
            breaches.add(new Breach(SLOW_PROCESSING,
                String.format("Agent %s has a high average processing time of %.0fms, exceeding threshold of %dms",
                              status.id(), metrics.avgProcessingTimeMs(), thresholds.maxAvgProcessingTimeMs()),
                breachData("avgProcessingTimeMs", metrics.avgProcessingTimeMs(),
                           thresholds.maxAvgProcessingTimeMs(), metrics)));
        }
        if (thresholds.maxConsecutiveFailures() != null
                && metrics.consecutiveFailures() >= thresholds.maxConsecutiveFailures()) {
            breaches.add(new Breach(CONSECUTIVE_FAILURES,
                "Agent " + status.id() + " failed " + metrics.consecutiveFailures()
                    + " requests in a row, threshold is " + thresholds.maxConsecutiveFailures(),
                breachData("consecutiveFailures", metrics.consecutiveFailures(),
                           thresholds.maxConsecutiveFailures(), metrics)));
        }
        return breaches;
    }

    private static Map<String, Object> breachData(String key, Object observed, Object threshold, StatusMetrics metrics) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, observed);
        data.put("threshold", threshold);
        data.put("metrics", metrics);
        return data;
    }

    private record Breach(String issueType, String message, Map<String, Object> data) {}

    // ── escalation ───────────────────────────────────────────────────────────

    /**
     * Broadcasts a high-priority {@code assistance_request} on behalf of {@code agentId}.
     * Every registered agent receives it; acknowledgment is requested. Send failures are
     * logged, never propagated.
     */
    public Mono<Void> requestAssistance(String agentId, String issueType, Map<String, Object> data) {
        return Mono.defer(() -> {
                if (!agents.containsKey(agentId)) {
                    log.warn("Assistance not requested, agent unknown. agentId={} issueType={}", agentId, issueType);
                    return Mono.empty();
                }
                AssistanceRequest request = AssistanceRequest.create(agentId, issueType, data);
                Message message = broker.createMessage(MessageType.QUERY, agentId, Message.BROADCAST, request,
                    MessageOptions.defaults().withPriority(MessagePriority.HIGH).requiringAcknowledgment());
                return broker.sendMessage(message)
                    .then(Mono.fromRunnable(() -> {
                        Map<String, Object> requested = assistanceData(agentId, issueType);
                        requested.put("assistanceRequestId", request.assistanceRequestId());
                        requested.put("messageId", message.id());
                        eventLog.info(SOURCE, "Assistance requested for agent " + agentId + ": " + issueType, requested);
                    }));
            })
            .onErrorResume(e -> {
                log.error("Assistance request failed. agentId={} issueType={}", agentId, issueType, e);
                Map<String, Object> failed = assistanceData(agentId, issueType);
                failed.put("error", describe(e));
                eventLog.error(EventSeverity.ERROR, SOURCE,
                    "Failed to request assistance for agent " + agentId + ": " + describe(e), failed);
                return Mono.empty();
            })
            .then();
    }

    private static Map<String, Object> assistanceData(String agentId, String issueType) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("issueType", issueType);
        return data;
    }

    // ── loops and shutdown ───────────────────────────────────────────────────

    private synchronized void startMonitoring() {
        if (!settings.loopsEnabled() || shutdown.get() || healthTask != null) {
            return;
        }
        healthTask = PeriodicTask.start("health-check", settings.healthCheckInterval(), this::runHealthChecks);
        performanceTask = PeriodicTask.start("performance-check", settings.performanceCheckInterval(),
                                             this::runPerformanceChecks);
    }

    private synchronized void stopMonitoring() {
        if (healthTask != null) {
            healthTask.stop();
        }
        if (performanceTask != null) {
            performanceTask.stop();
        }
    }

    /**
     * Stops both loops, shuts every agent down and unregisters it from the broker.
     * Only the first call does anything.
     */
    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!shutdown.compareAndSet(false, true)) {
                return Mono.empty();
            }
            stopMonitoring();
            List<Agent> running = List.copyOf(agents.values());
            return Flux.fromIterable(running)
                .concatMap(agent -> Mono.defer(agent::shutdown)
                    .onErrorResume(e -> {
                        log.warn("Agent shutdown failed. agentId={}", agent.id(), e);
                        return Mono.empty();
                    })
                    .doFinally(signal -> broker.unregisterAgent(agent.id())))
                .then(Mono.fromRunnable(() -> {
                    agents.clear();
                    configs.clear();
                    statuses.clear();
                    recoveries.clear();
                    log.info("Agent system shut down. agents={}", running.size());
                    eventLog.info(SOURCE, "Agent system shut down", Map.of("agentsStopped", running.size()));
                }));
        });
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
