package com.appraisalplatform.orchestrator.broker;

import com.appraisalplatform.common.message.MessageFilter;
import com.appraisalplatform.common.message.MessageHandler;
import com.appraisalplatform.common.message.Subscription;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

final class BrokerSubscription implements Subscription {

    private final String id = "sub_" + UUID.randomUUID();
    private final String subscriberId;
    private final MessageHandler handler;
    private final MessageFilter filter;
    private final Consumer<BrokerSubscription> onUnsubscribe;
    private final AtomicBoolean active = new AtomicBoolean(true);

    BrokerSubscription(String subscriberId, MessageHandler handler, MessageFilter filter,
                       Consumer<BrokerSubscription> onUnsubscribe) {
        this.subscriberId = subscriberId;
        this.handler = handler;
        this.filter = filter == null ? MessageFilter.any() : filter;
        this.onUnsubscribe = onUnsubscribe;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String subscriberId() {
        return subscriberId;
    }

    @Override
    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            onUnsubscribe.accept(this);
        }
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    MessageHandler handler() {
        return handler;
    }

    MessageFilter filter() {
        return filter;
    }
}
