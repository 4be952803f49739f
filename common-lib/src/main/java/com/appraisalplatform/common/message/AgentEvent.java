package com.appraisalplatform.common.message;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

public record AgentEvent(
    @JsonProperty("event") String event,
    @JsonProperty("data")  Map<String, Object> data
) implements MessageContent {

    public AgentEvent {
        Objects.requireNonNull(event, "event");
        data = Payloads.copyOf(data);
    }

    public static AgentEvent of(String event, Map<String, Object> data) {
        return new AgentEvent(event, data);
    }

    @Override
    public String action() {
        return event;
    }
}
