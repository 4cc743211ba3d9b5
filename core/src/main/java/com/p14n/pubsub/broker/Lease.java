package com.p14n.pubsub.broker;

import java.time.Instant;

/**
 * An outstanding delivery attempt. The entry carries the delivery count that
 * already includes this attempt, so it can be requeued as-is on expiry.
 */
public record Lease(String ackId, String subscription, BacklogEntry entry, Instant expiry) {

    public Lease withExpiry(Instant newExpiry) {
        return new Lease(ackId, subscription, entry, newExpiry);
    }

    public boolean isExpired(Instant now) {
        return !expiry.isAfter(now);
    }
}
