package com.appraisalplatform.common.config;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative configuration of one agent, loaded once at startup.
 */
public record AgentConfig(
    @JsonProperty("id")                    String id,
    @JsonProperty("name")                  String name,
    @JsonProperty("capabilities")          List<String> capabilities,
    @JsonProperty("enabled")               boolean enabled,
    @JsonProperty("performanceThresholds") PerformanceThresholds performanceThresholds,
    @JsonProperty("settings")              Map<String, Object> settings
) {
    public AgentConfig {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        settings = Payloads.copyOf(settings);
    }

    public static AgentConfig of(String id, String name, List<String> capabilities) {
        return new AgentConfig(id, name, capabilities, true, null, Map.of());
    }

    public AgentConfig withThresholds(PerformanceThresholds thresholds) {
        return new AgentConfig(id, name, capabilities, enabled, thresholds, settings);
    }

    public AgentConfig disabled() {
        return new AgentConfig(id, name, capabilities, false, performanceThresholds, settings);
    }

    public Optional<PerformanceThresholds> thresholds() {
        return Optional.ofNullable(performanceThresholds).filter(t -> !t.isEmpty());
    }
}
