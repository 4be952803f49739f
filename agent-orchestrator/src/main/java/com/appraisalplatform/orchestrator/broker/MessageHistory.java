package com.appraisalplatform.orchestrator.broker;

import com.appraisalplatform.common.message.Message;
import com.appraisalplatform.common.message.MessageFilter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded record of messages that passed through the broker, oldest evicted first.
 */
final class MessageHistory {

    private final int capacity;
    private final Deque<Message> messages = new ArrayDeque<>();

    MessageHistory(int capacity) {
        this.capacity = capacity;
    }

    synchronized void record(Message message) {
        if (capacity == 0) {
            return;
        }
        messages.addLast(message);
        while (messages.size() > capacity) {
            messages.removeFirst();
        }
    }

    /**
     * Newest first. {@code agentId} selects messages addressed to that agent or broadcast;
     * {@code null} selects everything.
     */
    synchronized List<Message> find(String agentId, MessageFilter filter, int limit) {
        List<Message> result = new ArrayList<>();
        Iterator<Message> newestFirst = messages.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            Message message = newestFirst.next();
            boolean addressed = agentId == null || agentId.equals(message.recipientId()) || message.isBroadcast();
            if (addressed && (filter == null || filter.matches(message))) {
                result.add(message);
            }
        }
        return result;
    }

    synchronized int size() {
        return messages.size();
    }
}
