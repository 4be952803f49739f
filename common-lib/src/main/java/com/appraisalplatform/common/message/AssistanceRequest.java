package com.appraisalplatform.common.message;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Escalation raised on behalf of an agent whose observed metrics breached a threshold.
 */
public record AssistanceRequest(
    @JsonProperty("assistanceRequestId") String assistanceRequestId,
    @JsonProperty("agentId")             String agentId,
    @JsonProperty("issueType")           String issueType,
    @JsonProperty("data")                Map<String, Object> data
) implements MessageContent {

    public static final String ACTION = "assistance_request";

    public AssistanceRequest {
        Objects.requireNonNull(assistanceRequestId, "assistanceRequestId");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(issueType, "issueType");
        data = Payloads.copyOf(data);
    }

    public static AssistanceRequest create(String agentId, String issueType, Map<String, Object> data) {
        return new AssistanceRequest("assist_" + UUID.randomUUID(), agentId, issueType, data);
    }

    @Override
    public String action() {
        return ACTION;
    }
}
