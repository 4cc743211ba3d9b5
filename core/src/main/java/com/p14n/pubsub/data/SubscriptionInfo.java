package com.p14n.pubsub.data;

/**
 * Snapshot of a subscription's configuration.
 */
public record SubscriptionInfo(String name,
                               String topic,
                               PushConfig pushConfig,
                               int ackDeadlineSeconds) {
}
