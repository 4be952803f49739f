package com.appraisalplatform.common.message;

/**
 * Handle returned by {@link MessageBus#subscribeToMessages}. {@link #unsubscribe()}
 * is safe to call more than once.
 */
public interface Subscription {

    String id();

    String subscriberId();

    void unsubscribe();

    boolean isActive();
}
