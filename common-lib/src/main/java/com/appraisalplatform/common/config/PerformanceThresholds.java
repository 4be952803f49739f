package com.appraisalplatform.common.config;

import com.appraisalplatform.common.exception.AgentConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-agent limits that trigger an assistance request when breached.
 * Every field is optional; a {@code null} limit is never checked.
 *
 * <ul>
 *   <li>{@code maxErrorRate}           – errors / requests, in [0.0, 1.0]</li>
 *   <li>{@code maxAvgProcessingTimeMs} – mean processing time per request</li>
 *   <li>{@code maxConsecutiveFailures} – failures in a row before escalating</li>
 * </ul>
 */
public record PerformanceThresholds(
    @JsonProperty("maxErrorRate")           Double  maxErrorRate,
    @JsonProperty("maxAvgProcessingTimeMs") Long    maxAvgProcessingTimeMs,
    @JsonProperty("maxConsecutiveFailures") Integer maxConsecutiveFailures
) {
    public PerformanceThresholds {
        if (maxErrorRate != null && (maxErrorRate < 0.0 || maxErrorRate > 1.0)) {
            throw new AgentConfigurationException("thresholds",
                "maxErrorRate must be within [0, 1] but was " + maxErrorRate);
        }
        if (maxAvgProcessingTimeMs != null && maxAvgProcessingTimeMs < 0) {
            throw new AgentConfigurationException("thresholds",
                "maxAvgProcessingTimeMs must not be negative but was " + maxAvgProcessingTimeMs);
        }
        if (maxConsecutiveFailures != null && maxConsecutiveFailures < 1) {
            throw new AgentConfigurationException("thresholds",
                "maxConsecutiveFailures must be at least 1 but was " + maxConsecutiveFailures);
        }
    }

    public static PerformanceThresholds maxErrorRate(double maxErrorRate) {
        return new PerformanceThresholds(maxErrorRate, null, null);
    }

    public boolean isEmpty() {
        return maxErrorRate == null && maxAvgProcessingTimeMs == null && maxConsecutiveFailures == null;
    }
}
