package com.appraisalplatform.common.replay;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One processed interaction appended to the {@link ReplayStore}. {@code input} and
 * {@code output} are opaque to the store.
 *
 * <p>{@code type} classifies the interaction ({@link #TYPE_REQUEST} for requests an agent
 * processed, {@link #TYPE_DELIVERY} for messages the broker failed to deliver).
 * {@code occurrences} counts similar interactions folded into this record.
 */
public record ReplayRecord(
    @JsonProperty("id")          String id,
    @JsonProperty("agentId")     String agentId,
    @JsonProperty("type")        String type,
    @JsonProperty("input")       Object input,
    @JsonProperty("output")      Object output,
    @JsonProperty("outcome")     ReplayOutcome outcome,
    @JsonProperty("reward")      double reward,
    @JsonProperty("priority")    double priority,
    @JsonProperty("occurrences") int occurrences,
    @JsonProperty("timestamp")   Instant timestamp
) {
    public static final String TYPE_INTERACTION = "interaction";
    public static final String TYPE_REQUEST = "request";
    public static final String TYPE_DELIVERY = "delivery";

    public ReplayRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(outcome, "outcome");
        if (priority < 0.0 || priority > 1.0) {
            throw new IllegalArgumentException("priority must be within [0, 1] but was " + priority);
        }
        type = type == null || type.isBlank() ? TYPE_INTERACTION : type;
        occurrences = Math.max(1, occurrences);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ReplayRecord of(String agentId, Object input, Object output,
                                  ReplayOutcome outcome, double priority) {
        return of(agentId, TYPE_INTERACTION, input, output, outcome, priority);
    }

    public static ReplayRecord of(String agentId, String type, Object input, Object output,
                                  ReplayOutcome outcome, double priority) {
        double reward = outcome == ReplayOutcome.SUCCESS ? 1.0 : -1.0;
        return new ReplayRecord("exp_" + UUID.randomUUID(), agentId, type, input, output,
                                outcome, reward, priority, 1, Instant.now());
    }

    public ReplayRecord at(Instant timestamp) {
        return new ReplayRecord(id, agentId, type, input, output, outcome, reward, priority, occurrences, timestamp);
    }

    /**
     * Same agent, same type and an equal input.
     */
    public boolean isSimilarTo(ReplayRecord other) {
        return agentId.equals(other.agentId) && type.equals(other.type) && Objects.equals(input, other.input);
    }

    /**
     * Folds a similar, newer record into this one: the newest output, outcome and
     * timestamp win, the higher priority is kept and the occurrence count grows.
     */
    public ReplayRecord merge(ReplayRecord newer) {
        return new ReplayRecord(id, agentId, type, input, newer.output, newer.outcome, newer.reward,
                                Math.max(priority, newer.priority), occurrences + newer.occurrences,
                                newer.timestamp);
    }
}
