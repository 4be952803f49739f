package com.appraisalplatform.common.message;

import java.util.EnumSet;
import java.util.Set;

/**
 * Subscription filter. Each non-null field narrows the match; an all-null filter
 * matches every message.
 */
public record MessageFilter(
    String senderId,
    Set<MessageType> types,
    MessagePriority minPriority,
    String correlationId,
    String contentAction
) {
    public MessageFilter {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(types);
    }

    public static MessageFilter any() {
        return new MessageFilter(null, null, null, null, null);
    }

    public static MessageFilter fromSender(String senderId) {
        return new MessageFilter(senderId, null, null, null, null);
    }

    public static MessageFilter ofTypes(MessageType first, MessageType... rest) {
        return new MessageFilter(null, EnumSet.of(first, rest), null, null, null);
    }

    public MessageFilter withTypes(MessageType first, MessageType... rest) {
        return new MessageFilter(senderId, EnumSet.of(first, rest), minPriority, correlationId, contentAction);
    }

    public MessageFilter withMinPriority(MessagePriority minPriority) {
        return new MessageFilter(senderId, types, minPriority, correlationId, contentAction);
    }

    public MessageFilter withCorrelationId(String correlationId) {
        return new MessageFilter(senderId, types, minPriority, correlationId, contentAction);
    }

    public MessageFilter withContentAction(String contentAction) {
        return new MessageFilter(senderId, types, minPriority, correlationId, contentAction);
    }

    public boolean matches(Message message) {
        if (senderId != null && !senderId.equals(message.senderId())) {
            return false;
        }
        if (!types.isEmpty() && !types.contains(message.type())) {
            return false;
        }
        if (minPriority != null && !message.priority().isAtLeast(minPriority)) {
            return false;
        }
        if (correlationId != null && !correlationId.equals(message.correlationId())) {
            return false;
        }
        return contentAction == null || contentAction.equals(message.contentAction());
    }
}
