package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.message.AgentRequest;
import com.appraisalplatform.common.message.AgentResponse;
import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageBus;
import com.appraisalplatform.common.model.AgentIdentity;
import com.appraisalplatform.common.replay.ReplayStore;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * A supervised unit of work. Concrete agents usually extend {@link AbstractAgent},
 * which supplies message dispatch, counters and replay recording.
 *
 * <p>{@link #process} must not throw across the boundary: unsupported operations and
 * failures are reported as {@code ERROR} responses.
 */
public interface Agent {

    AgentIdentity identity();

    default String id() {
        return identity().id();
    }

    default String name() {
        return identity().name();
    }

    default Set<String> capabilities() {
        return identity().capabilities();
    }

    ValidationResult validateInput(AgentRequest request);

    Mono<AgentResponse> process(AgentRequest request, AgentContext context);

    Mono<AgentHealthReport> getStatus();

    /**
     * Wires the agent to its collaborators. Called once by the manager before the agent
     * is registered with the bus.
     */
    Mono<Void> initialize(MessageBus messageBus, ReplayStore replayStore);

    Mono<Void> processMessage(Message message);

    /**
     * Notification from the supervisor that its view of this agent's health changed.
     */
    default void onHealthChanged(boolean healthy) {
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
