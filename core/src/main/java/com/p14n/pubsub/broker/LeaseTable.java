package com.p14n.pubsub.broker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outstanding leases of one subscription, keyed by ack id.
 * Not thread-safe: guarded by the owning {@link SubscriptionState}'s lock.
 */
class LeaseTable {

    private final Map<String, Lease> leases = new HashMap<>();
    // lower bound on the earliest expiry, lets sweeps skip tables with nothing due
    private Instant earliestExpiry = Instant.MAX;

    void put(Lease lease) {
        leases.put(lease.ackId(), lease);
        noteExpiry(lease.expiry());
    }

    Lease remove(String ackId) {
        return leases.remove(ackId);
    }

    boolean extend(String ackId, Instant newExpiry) {
        var lease = leases.get(ackId);
        if (lease == null) {
            return false;
        }
        leases.put(ackId, lease.withExpiry(newExpiry));
        noteExpiry(newExpiry);
        return true;
    }

    List<Lease> removeExpired(Instant now) {
        if (now.isBefore(earliestExpiry)) {
            return List.of();
        }
        var expired = new ArrayList<Lease>();
        var next = Instant.MAX;
        var it = leases.values().iterator();
        while (it.hasNext()) {
            var lease = it.next();
            if (lease.isExpired(now)) {
                expired.add(lease);
                it.remove();
            } else if (lease.expiry().isBefore(next)) {
                next = lease.expiry();
            }
        }
        earliestExpiry = next;
        expired.sort((a, b) -> a.expiry().compareTo(b.expiry()));
        return expired;
    }

    Collection<Lease> clear() {
        var all = new ArrayList<>(leases.values());
        leases.clear();
        earliestExpiry = Instant.MAX;
        return all;
    }

    Collection<Lease> snapshot() {
        return new ArrayList<>(leases.values());
    }

    int size() {
        return leases.size();
    }

    private void noteExpiry(Instant expiry) {
        if (expiry.isBefore(earliestExpiry)) {
            earliestExpiry = expiry;
        }
    }
}
