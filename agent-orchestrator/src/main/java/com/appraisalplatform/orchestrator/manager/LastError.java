package com.appraisalplatform.orchestrator.manager;

import com.appraisalplatform.common.model.Payloads;

import java.time.Instant;
import java.util.Map;

public record LastError(String message, Instant timestamp, Map<String, Object> details) {

    public LastError {
        details = Payloads.copyOf(details);
    }
}
