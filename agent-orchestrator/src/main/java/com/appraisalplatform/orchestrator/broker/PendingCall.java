package com.appraisalplatform.orchestrator.broker;

import com.appraisalplatform.common.message.AgentResponse;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One outstanding {@code executeAgent} call, keyed by request message id.
 * Only the first completion wins.
 */
final class PendingCall {

    private final String messageId;
    private final String correlationId;
    private final String agentId;
    private final Sinks.One<AgentResponse> sink = Sinks.one();

    PendingCall(String messageId, String correlationId, String agentId) {
        this.messageId = messageId;
        this.correlationId = correlationId;
        this.agentId = agentId;
    }

    String messageId() {
        return messageId;
    }

    String correlationId() {
        return correlationId;
    }

    String agentId() {
        return agentId;
    }

    boolean complete(AgentResponse response) {
        return sink.tryEmitValue(response).isSuccess();
    }

    Mono<AgentResponse> response() {
        return sink.asMono();
    }
}
