package com.appraisalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Stable identity of an agent: fixed at construction, immutable for the agent's lifetime.
 */
public record AgentIdentity(
    @JsonProperty("id")           String id,
    @JsonProperty("name")         String name,
    @JsonProperty("capabilities") Set<String> capabilities
) {
    public AgentIdentity {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        capabilities = capabilities == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }

    public static AgentIdentity of(String id, String name, Collection<String> capabilities) {
        return new AgentIdentity(id, name, capabilities == null ? null : new LinkedHashSet<>(capabilities));
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }
}
