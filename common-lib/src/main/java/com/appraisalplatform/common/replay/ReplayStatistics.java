package com.appraisalplatform.common.replay;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ReplayStatistics(
    @JsonProperty("total")                    int total,
    @JsonProperty("byAgent")                  Map<String, Long> byAgent,
    @JsonProperty("byType")                   Map<String, Long> byType,
    @JsonProperty("byOutcome")                Map<ReplayOutcome, Long> byOutcome,
    @JsonProperty("highPriorityCount")        long highPriorityCount,
    @JsonProperty("trainingThresholdReached") boolean trainingThresholdReached
) {
    public ReplayStatistics {
        byAgent = byAgent == null ? Map.of() : Map.copyOf(byAgent);
        byType = byType == null ? Map.of() : Map.copyOf(byType);
        byOutcome = byOutcome == null ? Map.of() : Map.copyOf(byOutcome);
    }
}
