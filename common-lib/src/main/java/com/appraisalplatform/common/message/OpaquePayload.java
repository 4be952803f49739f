package com.appraisalplatform.common.message;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concrete-agent business payload. {@code action} is optional and only used for filtering.
 */
public record OpaquePayload(
    @JsonProperty("action")  String action,
    @JsonProperty("payload") Object payload
) implements MessageContent {

    public static OpaquePayload of(Object payload) {
        return new OpaquePayload(null, payload);
    }
}
