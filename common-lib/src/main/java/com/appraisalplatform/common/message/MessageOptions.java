package com.appraisalplatform.common.message;

import com.appraisalplatform.common.model.Payloads;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional envelope fields for {@link Message#create}. Unset fields get defaults:
 * a fresh correlation id, {@link MessagePriority#NORMAL}, no acknowledgment.
 */
public record MessageOptions(
    MessagePriority priority,
    String correlationId,
    boolean requiresAcknowledgment,
    String inReplyTo,
    Map<String, Object> metadata
) {
    public MessageOptions {
        metadata = Payloads.copyOf(metadata);
    }

    public static MessageOptions defaults() {
        return new MessageOptions(null, null, false, null, Map.of());
    }

    /**
     * Options for a reply: same correlation id as {@code original}, linked through
     * {@code inReplyTo}.
     */
    public static MessageOptions replyTo(Message original) {
        return new MessageOptions(null, original.correlationId(), false, original.id(), Map.of());
    }

    public MessageOptions withPriority(MessagePriority priority) {
        return new MessageOptions(priority, correlationId, requiresAcknowledgment, inReplyTo, metadata);
    }

    public MessageOptions withCorrelationId(String correlationId) {
        return new MessageOptions(priority, correlationId, requiresAcknowledgment, inReplyTo, metadata);
    }

    public MessageOptions requiringAcknowledgment() {
        return new MessageOptions(priority, correlationId, true, inReplyTo, metadata);
    }

    public MessageOptions withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new MessageOptions(priority, correlationId, requiresAcknowledgment, inReplyTo, merged);
    }
}
