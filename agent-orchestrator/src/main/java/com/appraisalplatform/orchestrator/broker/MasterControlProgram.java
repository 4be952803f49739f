package com.appraisalplatform.orchestrator.broker;

import com.appraisalplatform.common.agent.AbstractAgent;
import com.appraisalplatform.common.agent.Agent;
import com.appraisalplatform.common.event.EventLog;
import com.appraisalplatform.common.event.EventSeverity;
import com.appraisalplatform.common.exception.AgentNotFoundException;
import com.appraisalplatform.common.exception.DuplicateAgentException;
import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageBus;
import com.appraisalplatform.common.message.MessageContent;
import com.appraisalplatform.common.message.MessageFilter;
import com.appraisalplatform.common.message.MessageHandler;
import com.appraisalplatform.common.message.MessageOptions;
import com.appraisalplatform.common.message.MessageType;
import com.appraisalplatform.common.message.Subscription;
import com.appraisalplatform.common.replay.ExperiencePriority;
import com.appraisalplatform.common.replay.ReplayOutcome;
import com.appraisalplatform.common.replay.ReplayRecord;
import com.appraisalplatform.common.replay.ReplayStore;
import com.appraisalplatform.common.trace.TraceContextUtil;
import com.appraisalplatform.orchestrator.workflow.AgentWorkflow;
import com.appraisalplatform.orchestrator.workflow.WorkflowEngine;
import com.appraisalplatform.orchestrator.workflow.WorkflowException;
import com.appraisalplatform.orchestrator.workflow.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * In-process message broker: agent registry, routing, topic subscriptions and
 * request/response correlation.
 *
 * <p><strong>Routing:</strong> {@link #sendMessage} fans out concurrently to the concrete
 * recipient (or every registered agent for {@link Message#BROADCAST}) and to every
 * matching subscriber. Each delivery is isolated with {@code onErrorResume}: a failing
 * recipient is logged, recorded as a failed replay experience, and never fails the
 * overall send.
 *
 * <p><strong>Correlation:</strong> {@link #executeAgent} registers a pending call keyed by
 * the request message id. A {@code RESPONSE} carrying an {@link AgentResponse} whose
 * {@code inReplyTo} and correlation id both match resolves it.
 *
 * <p><strong>Workflows:</strong> registered {@link AgentWorkflow}s run their steps one at a
 * time through {@link #executeAgent}; see {@link WorkflowEngine}.
 *
 * <p>The broker owns the registry, the subscription table and the pending-call table;
 * all three are concurrent maps mutated only here.
 */
public class MasterControlProgram implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MasterControlProgram.class);

    /** Sender id of broker-originated messages; replies addressed here resolve pending calls */
    public static final String BROKER_ID = "master-control-program";
    private static final String SOURCE = "MasterControlProgram";

    private final EventLog eventLog;
    private final ReplayStore replayStore;
    private final Duration responseTimeout;
    private final MessageHistory history;
    private final WorkflowEngine workflows;

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> capabilityIndex = new ConcurrentHashMap<>();
    private final Map<String, BrokerSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();

    public MasterControlProgram(EventLog eventLog, ReplayStore replayStore,
                                Duration responseTimeout, int historySize) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.replayStore = Objects.requireNonNull(replayStore, "replayStore");
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
        this.history = new MessageHistory(historySize);
        this.workflows = new WorkflowEngine(this::executeAgent, eventLog, SOURCE, Clock.systemUTC(),
                                            WorkflowEngine.DEFAULT_HISTORY_SIZE);
    }

    // ── registry ─────────────────────────────────────────────────────────────

    /**
     * Adds {@code agent} to the registry and the capability index. A second agent with
     * the same id is rejected with {@link DuplicateAgentException}; the first one stays.
     */
    public Mono<Void> registerAgent(Agent agent) {
        return Mono.defer(() -> {
            Agent existing = agents.putIfAbsent(agent.id(), agent);
            if (existing != null) {
                log.warn("Duplicate agent registration rejected. agentId={}", agent.id());
                eventLog.warning(EventSeverity.LOW, SOURCE,
                    "Agent with ID " + agent.id() + " is already registered",
                    Map.of("agentId", agent.id()));
                return Mono.error(new DuplicateAgentException(agent.id()));
            }
            agent.capabilities().forEach(capability ->
                capabilityIndex.computeIfAbsent(capability, c -> ConcurrentHashMap.newKeySet()).add(agent.id()));
            log.info("Agent registered. agentId={} capabilities={}", agent.id(), agent.capabilities());
            eventLog.info(SOURCE, "Agent " + agent.id() + " registered",
                Map.of("agentId", agent.id(), "capabilities", List.copyOf(agent.capabilities())));
            return Mono.empty();
        });
    }

    /**
     * @return {@code true} if the agent was registered
     */
    public boolean unregisterAgent(String agentId) {
        Agent removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        removed.capabilities().forEach(capability ->
            capabilityIndex.computeIfPresent(capability, (c, ids) -> {
                ids.remove(agentId);
                return ids.isEmpty() ? null : ids;
            }));
        log.info("Agent unregistered. agentId={}", agentId);
        return true;
    }

    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<Agent> getRegisteredAgents() {
        return List.copyOf(agents.values());
    }

    public List<Agent> getAgentsByCapability(String capability) {
        Set<String> ids = capabilityIndex.getOrDefault(capability, Set.of());
        return ids.stream().map(agents::get).filter(Objects::nonNull).toList();
    }

    /**
     * Agents declaring at least one capability matching {@code pattern} in full.
     */
    public List<Agent> findAgents(Pattern pattern) {
        return agents.values().stream()
            .filter(agent -> agent.capabilities().stream().anyMatch(c -> pattern.matcher(c).matches()))
            .toList();
    }

    // ── messaging ────────────────────────────────────────────────────────────

    @Override
    public Message createMessage(MessageType type, String senderId, String recipientId,
                                 MessageContent content, MessageOptions options) {
        return Message.create(type, senderId, recipientId, content, options);
    }

    @Override
    public Mono<Void> sendMessage(Message message) {
        return Mono.defer(() -> {
            history.record(message);
            resolvePendingCall(message);

            List<Mono<Void>> deliveries = new ArrayList<>();
            if (message.isBroadcast()) {
                agents.values().forEach(agent -> deliveries.add(deliver(agent, message)));
            } else if (!BROKER_ID.equals(message.recipientId())) {
                Agent recipient = agents.get(message.recipientId());
                if (recipient == null) {
                    log.error("Recipient not registered. recipientId={} messageId={} senderId={}",
                              message.recipientId(), message.id(), message.senderId());
                    eventLog.error(EventSeverity.MEDIUM, SOURCE,
                        "Recipient agent " + message.recipientId() + " not found",
                        Map.of("messageId", message.id(), "recipientId", message.recipientId(),
                               "senderId", message.senderId()));
                } else {
                    deliveries.add(deliver(recipient, message));
                }
            }
            subscriptions.values().stream()
                .filter(sub -> sub.isActive() && sub.filter().matches(message))
                .forEach(sub -> deliveries.add(notifySubscriber(sub, message)));

            log.debug("Message routed. messageId={} type={} from={} to={} deliveries={}",
                      message.id(), message.type(), message.senderId(), message.recipientId(), deliveries.size());
            return Flux.fromIterable(deliveries).flatMap(delivery -> delivery).then();
        });
    }

    /**
     * Sends {@code message} to every registered agent regardless of its original recipient.
     */
    public Mono<Void> broadcastMessage(Message message) {
        return sendMessage(message.isBroadcast() ? message : message.withRecipient(Message.BROADCAST));
    }

    @Override
    public Subscription subscribeToMessages(String subscriberId, MessageHandler handler, MessageFilter filter) {
        Objects.requireNonNull(handler, "handler");
        BrokerSubscription subscription = new BrokerSubscription(subscriberId, handler, filter,
            sub -> subscriptions.remove(sub.id()));
        subscriptions.put(subscription.id(), subscription);
        log.info("Subscription added. subscriptionId={} subscriberId={} filter={}",
                 subscription.id(), subscriberId, subscription.filter());
        return subscription;
    }

    /**
     * Recent messages addressed to {@code agentId} or broadcast, newest first.
     */
    public List<Message> getMessages(String agentId, MessageFilter filter, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return history.find(agentId, filter, limit);
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public int pendingCallCount() {
        return pendingCalls.size();
    }

    // ── request / response ───────────────────────────────────────────────────

    /**
     * Sends {@code request} to {@code agentId} as a {@code QUERY} and waits for the
     * correlated response.
     *
     * <p>Signals {@link AgentNotFoundException} for an unregistered id. Every other failure
     * (delivery error, no reply within the response timeout) resolves as an
     * {@code ERROR} response.
     */
    public Mono<AgentResponse> executeAgent(String agentId, AgentRequest request, ExecuteOptions options) {
        ExecuteOptions opts = options == null ? ExecuteOptions.defaults() : options;
        return Mono.defer(() -> {
            if (!agents.containsKey(agentId)) {
                return Mono.error(new AgentNotFoundException(agentId));
            }
            MessageOptions messageOptions = MessageOptions.defaults()
                .withCorrelationId(opts.correlationId())
                .withMetadata(AbstractAgent.META_ACCESS_LEVEL, opts.accessLevel().name())
                .withMetadata(AbstractAgent.META_PARAMETERS, opts.parameters());
            Message message = createMessage(MessageType.QUERY, BROKER_ID, agentId, request, messageOptions);
            PendingCall call = new PendingCall(message.id(), message.correlationId(), agentId);
            pendingCalls.put(message.id(), call);

            return TraceContextUtil.withCorrelationId(
                sendMessage(message)
                    .then(call.response())
                    .timeout(responseTimeout, Mono.fromSupplier(() -> timedOut(agentId, message)))
                    .switchIfEmpty(Mono.fromSupplier(() -> AgentResponse.error("No response from agent " + agentId)))
                    .elapsed()
                    .map(timed -> timed.getT2().executionTimeMs() == null
                        ? timed.getT2().withExecutionTime(timed.getT1())
                        : timed.getT2())
                    .doOnEach(signal -> {
                        if (signal.isOnNext()) {
                            AgentResponse response = signal.get();
                            TraceContextUtil.withMdc(TraceContextUtil.getCorrelationId(signal.getContextView()), () ->
                                log.info("Agent executed. agentId={} operation={} status={} executionTimeMs={}",
                                         agentId, request.operation(), response.status(), response.executionTimeMs()));
                        }
                    })
                    .doFinally(signal -> pendingCalls.remove(message.id())),
                message.correlationId());
        });
    }

    public Mono<AgentResponse> executeAgent(String agentId, AgentRequest request) {
        return executeAgent(agentId, request, ExecuteOptions.defaults());
    }

    // ── workflows ────────────────────────────────────────────────────────────

    public void registerWorkflow(AgentWorkflow workflow) {
        workflows.register(Objects.requireNonNull(workflow, "workflow"));
    }

    public Optional<AgentWorkflow> getWorkflow(String workflowId) {
        return workflows.find(workflowId);
    }

    public List<AgentWorkflow> getWorkflows() {
        return workflows.all();
    }

    /**
     * Runs a registered workflow. Signals {@link WorkflowException} when it is unknown or
     * disabled; step failures are reported in the {@link WorkflowResult}.
     */
    public Mono<WorkflowResult> executeWorkflow(String workflowId, Map<String, Object> input, ExecuteOptions options) {
        return workflows.execute(workflowId, input, options);
    }

    public Mono<WorkflowResult> executeWorkflow(String workflowId, Map<String, Object> input) {
        return executeWorkflow(workflowId, input, ExecuteOptions.defaults());
    }

    /**
     * Recent workflow executions, newest first.
     */
    public List<WorkflowResult> getWorkflowHistory(int limit) {
        return workflows.history(limit);
    }

    public Optional<WorkflowResult> getWorkflowExecution(String executionId) {
        return workflows.execution(executionId);
    }

    private void resolvePendingCall(Message message) {
        if (message.type() != MessageType.RESPONSE || message.inReplyTo() == null
                || !(message.content() instanceof AgentResponse response)) {
            return;
        }
        PendingCall call = pendingCalls.get(message.inReplyTo());
        if (call == null) {
            return;
        }
        if (!call.correlationId().equals(message.correlationId())) {
            log.warn("Response correlation mismatch ignored. inReplyTo={} expected={} actual={}",
                     message.inReplyTo(), call.correlationId(), message.correlationId());
            return;
        }
        call.complete(response);
    }

    private AgentResponse timedOut(String agentId, Message message) {
        log.warn("Agent response timed out. agentId={} messageId={} timeoutMs={}",
                 agentId, message.id(), responseTimeout.toMillis());
        eventLog.error(EventSeverity.MEDIUM, SOURCE,
            "Agent " + agentId + " did not respond within " + responseTimeout.toMillis() + "ms",
            Map.of("agentId", agentId, "messageId", message.id()));
        return AgentResponse.error("Agent " + agentId + " did not respond within " + responseTimeout.toMillis() + "ms");
    }

    // ── delivery ─────────────────────────────────────────────────────────────

    private Mono<Void> deliver(Agent agent, Message message) {
        return Mono.defer(() -> agent.processMessage(message))
            .onErrorResume(e -> {
                deliveryFailed(agent.id(), message, e);
                PendingCall call = pendingCalls.get(message.id());
                if (call != null && call.agentId().equals(agent.id())) {
                    call.complete(AgentResponse.error(describe(e)));
                }
                return Mono.empty();
            });
    }

    private Mono<Void> notifySubscriber(BrokerSubscription subscription, Message message) {
        return Mono.defer(() -> subscription.handler().handle(message))
            .onErrorResume(e -> {
                deliveryFailed(subscription.subscriberId(), message, e);
                return Mono.empty();
            });
    }

    private void deliveryFailed(String recipientId, Message message, Throwable e) {
        TraceContextUtil.withMdc(message.correlationId(), () ->
            log.error("Delivery failed. recipientId={} messageId={} type={}",
                      recipientId, message.id(), message.type(), e));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("recipientId", recipientId);
        data.put("messageId", message.id());
        data.put("error", describe(e));
        eventLog.error(EventSeverity.HIGH, SOURCE,
            "Error delivering message " + message.id() + " to " + recipientId, data);

        try {
            double priority = ExperiencePriority.score(message.priority(), message.type(), false,
                                                       message.requiresAcknowledgment());
            replayStore.append(ReplayRecord.of(recipientId, ReplayRecord.TYPE_DELIVERY, message,
                                               Map.of("error", describe(e)), ReplayOutcome.FAILURE, priority));
        } catch (RuntimeException replayError) {
            log.warn("Failed delivery not recorded. recipientId={} messageId={}",
                     recipientId, message.id(), replayError);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
