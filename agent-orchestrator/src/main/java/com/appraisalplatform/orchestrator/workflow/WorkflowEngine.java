package com.appraisalplatform.orchestrator.workflow;

import com.appraisalplatform.common.event.EventLog;
import com.appraisalplatform.common.event.EventSeverity;
import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.orchestrator.broker.ExecuteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs registered workflows step by step through a {@link StepExecutor}.
 *
 * <p>A step whose response is an error stops the run with status {@code ERROR} unless the step
 * is marked {@code continueOnError}, which downgrades the run to {@code PARTIAL_SUCCESS} and
 * moves on. A step that cannot be executed at all (unknown agent) counts as an error response.
 * Finished runs are kept in a bounded history, oldest evicted first.
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    public static final int DEFAULT_HISTORY_SIZE = 100;

    /**
     * The broker's {@code executeAgent}.
     */
    @FunctionalInterface
    public interface StepExecutor {
        Mono<AgentResponse> execute(String agentId, AgentRequest request, ExecuteOptions options);
    }

    private final StepExecutor executor;
    private final EventLog eventLog;
    private final String source;
    private final Clock clock;
    private final int historySize;

    private final Map<String, AgentWorkflow> workflows = new ConcurrentHashMap<>();
    private final Map<String, WorkflowResult> history;

    public WorkflowEngine(StepExecutor executor, EventLog eventLog, String source, Clock clock, int historySize) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.source = Objects.requireNonNull(source, "source");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.historySize = Math.max(0, historySize);
        this.history = Collections.synchronizedMap(new LinkedHashMap<String, WorkflowResult>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WorkflowResult> eldest) {
                return size() > WorkflowEngine.this.historySize;
            }
        });
    }

    // ── registry ─────────────────────────────────────────────────────────────

    /**
     * Registers {@code workflow}; one with the same id is replaced.
     */
    public void register(AgentWorkflow workflow) {
        AgentWorkflow previous = workflows.put(workflow.id(), workflow);
        if (previous != null) {
            log.warn("Workflow replaced. workflowId={}", workflow.id());
            eventLog.warning(EventSeverity.LOW, source,
                "Workflow with ID " + workflow.id() + " already registered, replacing",
                Map.of("workflowId", workflow.id()));
        }
        log.info("Workflow registered. workflowId={} name={} steps={}",
                 workflow.id(), workflow.name(), workflow.steps().size());
        eventLog.info(source, "Workflow " + workflow.name() + " (" + workflow.id() + ") registered",
            Map.of("workflowId", workflow.id(), "steps", workflow.steps().size()));
    }

    public Optional<AgentWorkflow> find(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    public List<AgentWorkflow> all() {
        return List.copyOf(workflows.values());
    }

    // ── execution ────────────────────────────────────────────────────────────

    /**
     * Runs the workflow against {@code input}. Signals {@link WorkflowException} for an
     * unknown or disabled workflow; every step failure ends up in the result instead.
     */
    public Mono<WorkflowResult> execute(String workflowId, Map<String, Object> input, ExecuteOptions options) {
        return Mono.defer(() -> {
            AgentWorkflow workflow = workflows.get(workflowId);
            if (workflow == null) {
                return Mono.error(new WorkflowException(workflowId, "Workflow with ID " + workflowId + " not found"));
            }
            if (!workflow.enabled()) {
                return Mono.error(new WorkflowException(workflowId, "Workflow with ID " + workflowId + " is disabled"));
            }
            WorkflowRun run = new WorkflowRun(workflow, UUID.randomUUID().toString(), input, clock.instant());
            ExecuteOptions base = options == null ? ExecuteOptions.defaults() : options;
            log.info("Workflow started. workflowId={} executionId={}", workflow.id(), run.executionId());
            eventLog.info(source, "Starting workflow execution: " + workflow.name() + " (" + workflow.id() + ")",
                Map.of("workflowId", workflow.id(), "executionId", run.executionId()));

            return Flux.fromIterable(workflow.steps())
                .concatMap(step -> Mono.defer(() -> run.halted() ? Mono.<Void>empty() : runStep(run, step, base)))
                .then(Mono.fromSupplier(() -> complete(run)));
        });
    }

    private Mono<Void> runStep(WorkflowRun run, WorkflowStep step, ExecuteOptions base) {
        if (!run.shouldRun(step)) {
            log.info("Workflow step skipped. executionId={} stepId={} condition={}",
                     run.executionId(), step.id(), step.condition());
            eventLog.info(source, "Skipping step " + step.id() + " due to condition: " + step.condition(),
                Map.of("executionId", run.executionId(), "stepId", step.id()));
            return Mono.empty();
        }
        AgentRequest request = AgentRequest.of(step.operation(), run.inputFor(step));
        return Mono.defer(() -> executor.execute(step.agentId(), request, stepOptions(run, step, base)))
            .onErrorResume(e -> {
                log.warn("Workflow step could not be executed. executionId={} stepId={} agentId={}",
                         run.executionId(), step.id(), step.agentId(), e);
                return Mono.just(AgentResponse.error("Error executing step: " + describe(e)));
            })
            .doOnNext(response -> {
                log.debug("Workflow step finished. executionId={} stepId={} status={}",
                          run.executionId(), step.id(), response.status());
                run.record(step, response);
            })
            .then();
    }

    private static ExecuteOptions stepOptions(WorkflowRun run, WorkflowStep step, ExecuteOptions base) {
        Map<String, Object> parameters = new LinkedHashMap<>(run.workflow().parameters());
        parameters.putAll(base.parameters());
        parameters.put("workflowId", run.workflow().id());
        parameters.put("executionId", run.executionId());
        parameters.put("stepId", step.id());
        String correlationId = base.correlationId() != null ? base.correlationId() : run.executionId();
        return new ExecuteOptions(base.accessLevel(), correlationId, parameters);
    }

    private WorkflowResult complete(WorkflowRun run) {
        WorkflowResult result = run.finish(clock.instant());
        if (historySize > 0) {
            history.put(result.executionId(), result);
        }
        log.info("Workflow completed. workflowId={} executionId={} status={} durationMs={}",
                 result.workflowId(), result.executionId(), result.status(), result.duration().toMillis());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("executionId", result.executionId());
        data.put("status", result.status().name());
        data.put("durationMs", result.duration().toMillis());
        eventLog.info(source, "Completed workflow execution: " + run.workflow().name()
            + " (" + run.workflow().id() + ")", data);
        return result;
    }

    // ── history ──────────────────────────────────────────────────────────────

    /**
     * Up to {@code limit} finished executions, newest start first.
     */
    public List<WorkflowResult> history(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<WorkflowResult> results;
        synchronized (history) {
            results = new ArrayList<>(history.values());
        }
        Collections.reverse(results);
        results.sort(Comparator.comparing(WorkflowResult::startTime).reversed());
        return List.copyOf(results.subList(0, Math.min(limit, results.size())));
    }

    public Optional<WorkflowResult> execution(String executionId) {
        return Optional.ofNullable(history.get(executionId));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
