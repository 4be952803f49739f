package com.appraisalplatform.common.message;

/**
 * Payload of a {@link Message}, closed over the variants the orchestration core inspects.
 *
 * <p>Concrete agents exchange their own business payloads through {@link OpaquePayload};
 * the core never looks inside it beyond {@link #action()}.
 */
public sealed interface MessageContent
    permits AgentRequest, AgentResponse, AssistanceRequest, AgentEvent,
            StatusQuery, Acknowledgment, OpaquePayload {

    /**
     * The discriminator used for dispatch and content filters: the operation of a
     * request, the event name of an event, {@code "assistance_request"} for
     * escalations. May be {@code null} for opaque payloads.
     */
    String action();
}
