package com.p14n.pubsub.broker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * FIFO queue of entries awaiting delivery on one subscription.
 * Not thread-safe: guarded by the owning {@link SubscriptionState}'s lock.
 */
class Backlog {

    private final ArrayDeque<BacklogEntry> entries = new ArrayDeque<>();

    void add(BacklogEntry entry) {
        entries.addLast(entry);
    }

    List<BacklogEntry> take(int max) {
        int n = Math.min(max, entries.size());
        var taken = new ArrayList<BacklogEntry>(n);
        for (int i = 0; i < n; i++) {
            taken.add(entries.pollFirst());
        }
        return taken;
    }

    List<BacklogEntry> clear() {
        var all = new ArrayList<>(entries);
        entries.clear();
        return all;
    }

    List<BacklogEntry> snapshot() {
        return new ArrayList<>(entries);
    }

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }
}
