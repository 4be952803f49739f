package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.message.Acknowledgment;
import com.appraisalplatform.common.message.AgentEvent;
import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.message.AssistanceRequest;
import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageBus;
import com.appraisalplatform.common.message.MessageContent;
import com.appraisalplatform.common.message.MessageOptions;
import com.appraisalplatform.common.message.MessagePriority;
import com.appraisalplatform.common.message.MessageType;
import com.appraisalplatform.common.message.StatusQuery;
import com.appraisalplatform.common.model.AgentIdentity;
import com.appraisalplatform.common.replay.ExperiencePriority;
import com.appraisalplatform.common.replay.ReplayOutcome;
import com.appraisalplatform.common.replay.ReplayRecord;
import com.appraisalplatform.common.replay.ReplayStore;
import com.appraisalplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base lifecycle for agents: message dispatch on the content variant, validation before
 * processing, request counters, replay recording and replies over the bus.
 *
 * <p>Subclasses implement {@link #process} and usually {@link #validateInput}; the
 * {@code handle*} hooks may be overridden to react to events, assistance requests
 * and responses.
 *
 * <p>Counters are updated under one lock so a status snapshot always satisfies
 * {@code errorsEncountered <= requestsProcessed}.
 */
public abstract class AbstractAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(AbstractAgent.class);

    public static final String META_ACCESS_LEVEL = "accessLevel";
    public static final String META_PARAMETERS = "parameters";
    public static final String META_EXECUTION_ID = "executionId";

    private final AgentIdentity identity;
    private final AtomicReference<AgentLifecycleState> state =
        new AtomicReference<>(AgentLifecycleState.UNINITIALIZED);

    private final Object counterLock = new Object();
    private long requestsProcessed;
    private long errorsEncountered;
    private long totalProcessingTimeMs;
    private int consecutiveFailures;

    private volatile MessageBus messageBus;
    private volatile ReplayStore replayStore;

    protected AbstractAgent(AgentIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public AgentIdentity identity() {
        return identity;
    }

    /**
     * Accepts every request by default.
     */
    @Override
    public ValidationResult validateInput(AgentRequest request) {
        return ValidationResult.ok();
    }

    @Override
    public Mono<Void> initialize(MessageBus messageBus, ReplayStore replayStore) {
        return Mono.defer(() -> {
            this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
            this.replayStore = replayStore;
            return onInitialize();
        }).doOnSuccess(ignored -> {
            state.set(AgentLifecycleState.INITIALIZED);
            log.info("Agent initialized. agentId={} capabilities={}", id(), capabilities());
        });
    }

    /**
     * Hook for subclass setup, run after the collaborators are wired.
     */
    protected Mono<Void> onInitialize() {
        return Mono.empty();
    }

    @Override
    public Mono<AgentHealthReport> getStatus() {
        return Mono.fromSupplier(() -> new AgentHealthReport(isHealthy(), metrics(), statusDetails()));
    }

    /**
     * Self-assessed health reported through {@link #getStatus()}.
     */
    protected boolean isHealthy() {
        AgentLifecycleState current = state.get();
        return current != AgentLifecycleState.UNINITIALIZED && current != AgentLifecycleState.SHUTDOWN;
    }

    protected Map<String, Object> statusDetails() {
        return Map.of("state", state.get().name());
    }

    public AgentMetrics metrics() {
        synchronized (counterLock) {
            double avg = requestsProcessed == 0 ? 0.0 : (double) totalProcessingTimeMs / requestsProcessed;
            return new AgentMetrics(requestsProcessed, errorsEncountered, avg, consecutiveFailures,
                                    Map.of("consecutiveFailures", consecutiveFailures));
        }
    }

    public AgentLifecycleState lifecycleState() {
        return state.get();
    }

    @Override
    public void onHealthChanged(boolean healthy) {
        if (healthy) {
            state.compareAndSet(AgentLifecycleState.UNHEALTHY, AgentLifecycleState.IDLE);
        } else if (state.get() != AgentLifecycleState.SHUTDOWN) {
            state.set(AgentLifecycleState.UNHEALTHY);
        }
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            state.set(AgentLifecycleState.SHUTDOWN);
            log.info("Agent shut down. agentId={}", id());
        });
    }

    // ── message dispatch ───────────────────────────────────────────────────

    @Override
    public Mono<Void> processMessage(Message message) {
        return Mono.defer(() -> {
            MessageContent content = message.content();
            if (content instanceof AgentRequest request) {
                return handleRequest(message, request);
            }
            if (content instanceof StatusQuery) {
                return handleStatusQuery(message);
            }
            if (content instanceof AssistanceRequest request) {
                return handleAssistanceRequest(message, request);
            }
            if (content instanceof AgentEvent event) {
                return handleEvent(message, event);
            }
            if (content instanceof AgentResponse || content instanceof Acknowledgment) {
                return handleResponse(message);
            }
            return handleUnrecognized(message);
        });
    }

    protected Mono<Void> handleRequest(Message message, AgentRequest request) {
        AgentContext context = contextFor(message);
        return execute(request, context, message.priority(), message.type(), message.requiresAcknowledgment())
            .flatMap(response -> reply(message, response));
    }

    protected Mono<Void> handleStatusQuery(Message message) {
        return getStatus().flatMap(report -> {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("healthy", report.healthy());
            data.put("metrics", report.metrics());
            data.put("details", report.details());
            return reply(message, AgentResponse.success("Status of " + id(), data));
        });
    }

    /**
     * Default: log the escalation and acknowledge it when the sender asked for one.
     * An agent never acknowledges its own request.
     */
    protected Mono<Void> handleAssistanceRequest(Message message, AssistanceRequest request) {
        log.info("Assistance request received. agentId={} from={} issueType={} assistanceRequestId={}",
                 id(), message.senderId(), request.issueType(), request.assistanceRequestId());
        if (message.requiresAcknowledgment() && !id().equals(message.senderId())) {
            return acknowledgeMessage(message);
        }
        return Mono.empty();
    }

    protected Mono<Void> handleEvent(Message message, AgentEvent event) {
        log.debug("Event received. agentId={} event={} from={}", id(), event.event(), message.senderId());
        if (message.requiresAcknowledgment()) {
            return acknowledgeMessage(message);
        }
        return Mono.empty();
    }

    protected Mono<Void> handleResponse(Message message) {
        log.debug("Response received. agentId={} from={} inReplyTo={}",
                  id(), message.senderId(), message.inReplyTo());
        return Mono.empty();
    }

    protected Mono<Void> handleUnrecognized(Message message) {
        log.warn("Unrecognized message content. agentId={} from={} type={} action={}",
                 id(), message.senderId(), message.type(), message.contentAction());
        boolean expectsReply = message.type() == MessageType.QUERY || message.type() == MessageType.COMMAND;
        if (expectsReply && !id().equals(message.senderId())) {
            return reply(message, AgentResponse.error(
                "Unsupported message content '" + message.contentAction() + "' for agent " + id()));
        }
        return Mono.empty();
    }

    // ── request execution ──────────────────────────────────────────────────

    /**
     * Validates and processes {@code request}, never signalling an error: every failure
     * becomes an {@code ERROR} response. Updates counters and appends a replay record.
     *
     * <p>A subscriber that cancels before the response arrives (a caller's timeout) is
     * counted as a failed request, once.
     */
    public Mono<AgentResponse> execute(AgentRequest request, AgentContext context) {
        return execute(request, context, MessagePriority.NORMAL, MessageType.QUERY, false);
    }

    private Mono<AgentResponse> execute(AgentRequest request, AgentContext context,
                                        MessagePriority priority, MessageType type,
                                        boolean requiresAcknowledgment) {
        return Mono.defer(() -> {
            long startedNanos = System.nanoTime();
            AtomicBoolean recorded = new AtomicBoolean(false);
            return Mono.defer(() -> {
                    ValidationResult validation = validate(request);
                    if (!validation.valid()) {
                        return Mono.just(AgentResponse.error("Input validation failed", validation.issues()));
                    }
                    AgentRequest effective = validation.validatedData() != null ? validation.validatedData() : request;
                    markProcessing();
                    return Mono.defer(() -> process(effective, context))
                        .switchIfEmpty(Mono.fromSupplier(() ->
                            AgentResponse.error("No response produced for operation " + effective.operation())))
                        .onErrorResume(e -> {
                            TraceContextUtil.withMdc(context.correlationId(), () ->
                                log.error("Agent processing failed. agentId={} operation={}",
                                          id(), effective.operation(), e));
                            return Mono.just(AgentResponse.error(errorMessage(e)));
                        });
                })
                .map(response -> {
                    long elapsedMs = elapsedMillis(startedNanos);
                    if (recorded.compareAndSet(false, true)) {
                        record(request, response, elapsedMs, priority, type, requiresAcknowledgment);
                    }
                    return response.executionTimeMs() == null ? response.withExecutionTime(elapsedMs) : response;
                })
                .doOnCancel(() -> {
                    if (recorded.compareAndSet(false, true)) {
                        long elapsedMs = elapsedMillis(startedNanos);
                        TraceContextUtil.withMdc(context.correlationId(), () ->
                            log.warn("Agent processing cancelled. agentId={} operation={} elapsedMs={}",
                                     id(), request.operation(), elapsedMs));
                        record(request, AgentResponse.error("Processing of " + request.operation()
                                   + " cancelled after " + elapsedMs + "ms"),
                               elapsedMs, priority, type, requiresAcknowledgment);
                    }
                });
        });
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private ValidationResult validate(AgentRequest request) {
        try {
            ValidationResult result = validateInput(request);
            return result == null ? ValidationResult.ok() : result;
        } catch (RuntimeException e) {
            log.warn("Input validation threw. agentId={} operation={}", id(), request.operation(), e);
            return ValidationResult.invalid(ValidationIssue.of(
                null, "validation_error", errorMessage(e), IssueSeverity.HIGH));
        }
    }

    private void record(AgentRequest request, AgentResponse response, long elapsedMs,
                        MessagePriority priority, MessageType type, boolean requiresAcknowledgment) {
        boolean success = response.isSuccess();
        synchronized (counterLock) {
            requestsProcessed++;
            totalProcessingTimeMs += elapsedMs;
            if (success) {
                consecutiveFailures = 0;
            } else {
                errorsEncountered++;
                consecutiveFailures++;
            }
        }
        state.compareAndSet(AgentLifecycleState.PROCESSING, AgentLifecycleState.IDLE);

        ReplayStore store = replayStore;
        if (store != null) {
            double score = ExperiencePriority.score(priority, type, success, requiresAcknowledgment);
            store.append(ReplayRecord.of(id(), ReplayRecord.TYPE_REQUEST, request, response,
                                         success ? ReplayOutcome.SUCCESS : ReplayOutcome.FAILURE, score));
        }
    }

    private void markProcessing() {
        state.compareAndSet(AgentLifecycleState.INITIALIZED, AgentLifecycleState.PROCESSING);
        state.compareAndSet(AgentLifecycleState.IDLE, AgentLifecycleState.PROCESSING);
    }

    protected AgentContext contextFor(Message message) {
        Map<String, Object> metadata = message.metadata();
        AccessLevel accessLevel = AccessLevel.parse(metadata.get(META_ACCESS_LEVEL), AccessLevel.USER);
        Object executionId = metadata.get(META_EXECUTION_ID);
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (metadata.get(META_PARAMETERS) instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> parameters.put(String.valueOf(k), v));
        }
        return new AgentContext(
            executionId != null ? executionId.toString() : "exec_" + UUID.randomUUID(),
            message.correlationId(),
            accessLevel,
            parameters,
            message.timestamp(),
            id()
        );
    }

    // ── outbound messaging ─────────────────────────────────────────────────

    protected Message createMessage(MessageType type, String recipientId,
                                    MessageContent content, MessageOptions options) {
        MessageBus bus = messageBus;
        if (bus == null) {
            return Message.create(type, id(), recipientId, content, options);
        }
        return bus.createMessage(type, id(), recipientId, content, options);
    }

    /**
     * Sends through the bus. Before {@link #initialize} there is no bus: the message is
     * dropped and logged.
     */
    protected Mono<Void> sendMessage(Message message) {
        MessageBus bus = messageBus;
        if (bus == null) {
            log.error("Cannot send message: message bus not initialized. agentId={} messageId={}",
                      id(), message.id());
            return Mono.empty();
        }
        return bus.sendMessage(message);
    }

    protected Mono<Void> acknowledgeMessage(Message original) {
        return sendMessage(createMessage(MessageType.RESPONSE, original.senderId(),
                                         new Acknowledgment(original.id()),
                                         MessageOptions.replyTo(original)));
    }

    private Mono<Void> reply(Message original, AgentResponse response) {
        return sendMessage(createMessage(MessageType.RESPONSE, original.senderId(), response,
                                         MessageOptions.replyTo(original)));
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
