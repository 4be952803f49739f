package com.appraisalplatform.common.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusQuery() implements MessageContent {

    public static final String ACTION = "status";

    @Override
    @JsonProperty("action")
    public String action() {
        return ACTION;
    }
}
