package com.p14n.pubsub.broker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.Message;

/**
 * A topic: its message log and the set of subscriptions bound to it.
 *
 * <p>
 * The topic lock is the sequence point between publishing and binding:
 * fan-out, binding a new subscription, unbinding and deleting the topic all
 * take it, so a publish either reaches a subscription in full or not at all.
 * </p>
 */
class TopicState {

    private final String name;
    private final MessageLog log;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<SubscriptionState> bound = new LinkedHashSet<>();
    private boolean deleted;

    TopicState(String name) {
        this.name = name;
        this.log = new MessageLog(name);
    }

    String name() {
        return name;
    }

    MessageLog log() {
        return log;
    }

    /**
     * Appends the messages to the log and adds each one to the backlog of
     * every subscription bound right now.
     *
     * @return The assigned message ids in input order
     */
    List<String> publish(List<Message> messages, Instant now) {
        lock.lock();
        try {
            ensureLive();
            var ids = new ArrayList<String>(messages.size());
            for (var message : messages) {
                var logged = log.append(message, bound.size(), now);
                for (var subscription : bound) {
                    subscription.enqueue(logged);
                }
                ids.add(logged.message().id());
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds a subscription, provided the topic is still live. The registration
     * runs under the topic lock so no publish is half-seen by it.
     */
    void bind(SubscriptionState subscription, Runnable register) {
        lock.lock();
        try {
            ensureLive();
            register.run();
            bound.add(subscription);
        } finally {
            lock.unlock();
        }
    }

    void unbind(SubscriptionState subscription) {
        lock.lock();
        try {
            bound.remove(subscription);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the topic deleted. Bound subscriptions survive but point at the
     * deleted-topic sentinel and receive nothing further.
     */
    void delete() {
        lock.lock();
        try {
            deleted = true;
            for (var subscription : bound) {
                subscription.detachFromTopic();
            }
            bound.clear();
        } finally {
            lock.unlock();
        }
    }

    List<String> subscriptionNames() {
        lock.lock();
        try {
            var names = new ArrayList<String>(bound.size());
            for (var subscription : bound) {
                names.add(subscription.name());
            }
            return names;
        } finally {
            lock.unlock();
        }
    }

    private void ensureLive() {
        if (deleted) {
            throw PubsubException.notFound("Topic", name);
        }
    }
}
