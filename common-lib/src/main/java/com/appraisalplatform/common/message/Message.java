package com.appraisalplatform.common.message;

import com.appraisalplatform.common.model.Payloads;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Transport envelope exchanged over the message bus. Immutable once created.
 *
 * <p>{@code correlationId} links a request to its eventual response; it is the only
 * ordering guarantee the bus makes. {@code inReplyTo} carries the id of the message
 * being answered. A {@code recipientId} of {@value #BROADCAST} addresses every
 * registered agent.
 */
public record Message(
    @JsonProperty("id")                     String id,
    @JsonProperty("type")                   MessageType type,
    @JsonProperty("senderId")               String senderId,
    @JsonProperty("recipientId")            String recipientId,
    @JsonProperty("content")                MessageContent content,
    @JsonProperty("correlationId")          String correlationId,
    @JsonProperty("priority")               MessagePriority priority,
    @JsonProperty("requiresAcknowledgment") boolean requiresAcknowledgment,
    @JsonProperty("inReplyTo")              String inReplyTo,
    @JsonProperty("metadata")               Map<String, Object> metadata,
    @JsonProperty("timestamp")              Instant timestamp
) {
    public static final String BROADCAST = "all";

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(recipientId, "recipientId");
        Objects.requireNonNull(content, "content");
        priority = priority == null ? MessagePriority.NORMAL : priority;
        metadata = Payloads.copyOf(metadata);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /**
     * Builds a new message with a fresh {@code msg_} id. Does not send it.
     */
    public static Message create(MessageType type, String senderId, String recipientId,
                                 MessageContent content, MessageOptions options) {
        MessageOptions opts = options == null ? MessageOptions.defaults() : options;
        String correlationId = opts.correlationId() != null
            ? opts.correlationId()
            : "corr_" + UUID.randomUUID();
        return new Message(
            "msg_" + UUID.randomUUID(),
            type,
            senderId,
            recipientId,
            content,
            correlationId,
            opts.priority(),
            opts.requiresAcknowledgment(),
            opts.inReplyTo(),
            opts.metadata(),
            Instant.now()
        );
    }

    @JsonIgnore
    public boolean isBroadcast() {
        return BROADCAST.equals(recipientId);
    }

    @JsonIgnore
    public String contentAction() {
        return content.action();
    }

    public Message withRecipient(String recipientId) {
        return new Message(id, type, senderId, recipientId, content, correlationId,
                           priority, requiresAcknowledgment, inReplyTo, metadata, timestamp);
    }
}
