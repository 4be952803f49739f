package com.appraisalplatform.orchestrator.agent;

import com.appraisalplatform.common.agent.AbstractAgent;
import com.appraisalplatform.common.agent.AgentContext;
import com.appraisalplatform.common.agent.IssueSeverity;
import com.appraisalplatform.common.agent.ValidationIssue;
import com.appraisalplatform.common.agent.ValidationResult;
import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.model.AgentIdentity;
import org.slf4j.event.Level;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Built-in agent answering liveness checks over the bus.
 *
 * <ul>
 *   <li>{@code ping}   – replies {@code pong} with the current time</li>
 *   <li>{@code echo}   – returns the request data unchanged</li>
 *   <li>{@code status} – uptime and counters of this agent</li>
 * </ul>
 */
public class DiagnosticsAgent extends AbstractAgent {

    public static final String ID = "system-diagnostics";

    private static final Set<String> OPERATIONS = Set.of("ping", "echo", "status");

    private final Clock clock;
    private volatile Instant startedAt;

    public DiagnosticsAgent(AgentIdentity identity, Clock clock) {
        super(identity);
        this.clock = clock;
    }

    @Override
    protected Mono<Void> onInitialize() {
        return Mono.fromRunnable(() -> startedAt = clock.instant());
    }

    @Override
    public ValidationResult validateInput(AgentRequest request) {
        if (!OPERATIONS.contains(request.operation())) {
            return ValidationResult.invalid(ValidationIssue.of("operation", "unsupported_operation",
                "Unsupported operation: " + request.operation(), IssueSeverity.HIGH));
        }
        return ValidationResult.ok();
    }

    @Override
    public Mono<AgentResponse> process(AgentRequest request, AgentContext context) {
        context.log(Level.DEBUG, "Diagnostics operation " + request.operation());
        return Mono.fromSupplier(() -> switch (request.operation()) {
            case "ping" -> AgentResponse.success("pong", Map.of("timestamp", clock.instant().toString()));
            case "echo" -> AgentResponse.success("echo", request.data());
            case "status" -> AgentResponse.success("status", statusData());
            default -> AgentResponse.error("Unsupported operation: " + request.operation());
        });
    }

    @Override
    protected Map<String, Object> statusDetails() {
        Map<String, Object> details = new LinkedHashMap<>(super.statusDetails());
        details.put("operations", OPERATIONS.stream().sorted().toList());
        return details;
    }

    private Map<String, Object> statusData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("state", lifecycleState().name());
        data.put("uptimeSeconds", startedAt == null ? 0 : Duration.between(startedAt, clock.instant()).toSeconds());
        data.put("requestsProcessed", metrics().requestsProcessed());
        data.put("errorsEncountered", metrics().errorsEncountered());
        return data;
    }
}
