package com.appraisalplatform.common.agent;

import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageBus;
import com.appraisalplatform.common.message.MessageContent;
import com.appraisalplatform.common.message.MessageFilter;
import com.appraisalplatform.common.message.MessageHandler;
import com.appraisalplatform.common.message.MessageOptions;
import com.appraisalplatform.common.message.MessageType;
import com.appraisalplatform.common.message.Subscription;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures sent messages instead of routing them.
 */
class RecordingMessageBus implements MessageBus {

    final List<Message> sent = new CopyOnWriteArrayList<>();

    @Override
    public Message createMessage(MessageType type, String senderId, String recipientId,
                                 MessageContent content, MessageOptions options) {
        return Message.create(type, senderId, recipientId, content, options);
    }

    @Override
    public Mono<Void> sendMessage(Message message) {
        return Mono.fromRunnable(() -> sent.add(message));
    }

    @Override
    public Subscription subscribeToMessages(String subscriberId, MessageHandler handler, MessageFilter filter) {
        throw new UnsupportedOperationException("not routed");
    }

    Message last() {
        return sent.get(sent.size() - 1);
    }
}
