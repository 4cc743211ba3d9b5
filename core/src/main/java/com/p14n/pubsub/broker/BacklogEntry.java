package com.p14n.pubsub.broker;

/**
 * A reference to a logged message waiting in a subscription's backlog, with
 * the number of times it has been delivered on that subscription.
 */
public record BacklogEntry(LoggedMessage message, int deliveryAttempt) {

    public static BacklogEntry firstDelivery(LoggedMessage message) {
        return new BacklogEntry(message, 0);
    }

    public BacklogEntry nextAttempt() {
        return new BacklogEntry(message, deliveryAttempt + 1);
    }
}
