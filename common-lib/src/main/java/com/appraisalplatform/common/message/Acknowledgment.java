package com.appraisalplatform.common.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Acknowledgment(
    @JsonProperty("acknowledgedMessageId") String acknowledgedMessageId
) implements MessageContent {

    public static final String ACTION = "acknowledgment";

    @Override
    public String action() {
        return ACTION;
    }
}
