package com.appraisalplatform.common.message;

import reactor.core.publisher.Mono;

/**
 * Pub/sub and request/response transport between agents.
 *
 * <p>Current implementation: the in-process {@code MasterControlProgram}. Other
 * backends (Redis, Kafka, MQTT) must preserve this contract:
 * <ul>
 *   <li>delivery to a concrete recipient, to every agent for {@link Message#BROADCAST},
 *       and to every matching subscriber</li>
 *   <li>per-recipient failure isolation: {@link #sendMessage} never fails because one
 *       recipient failed</li>
 *   <li>no ordering between independent messages; correlation ids are the only causal link</li>
 * </ul>
 */
public interface MessageBus {

    Message createMessage(MessageType type, String senderId, String recipientId,
                          MessageContent content, MessageOptions options);

    Mono<Void> sendMessage(Message message);

    Subscription subscribeToMessages(String subscriberId, MessageHandler handler, MessageFilter filter);
}
