package com.p14n.pubsub.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for the delivery engine.
 *
 * <p>
 * Counters, each tagged with the topic or subscription they concern:
 * </p>
 * <ul>
 * <li>messages_published: messages appended to a topic</li>
 * <li>messages_delivered: leases handed out by pull or push</li>
 * <li>messages_acknowledged: leases removed by an acknowledgment</li>
 * <li>messages_redelivered: expired leases returned to the backlog</li>
 * <li>push_failures: push deliveries that failed or timed out</li>
 * <li>pull_rejected: pulls refused by the admission cap</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> SUBSCRIPTION = AttributeKey.stringKey("subscription");

        private final LongCounter publishedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter acknowledgedMessages;
        private final LongCounter redeliveredMessages;
        private final LongCounter pushFailures;
        private final LongCounter pullRejections;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages leased to pull or push consumers")
                                .build();

                acknowledgedMessages = meter.counterBuilder("messages_acknowledged")
                                .setDescription("Number of leases acknowledged")
                                .build();

                redeliveredMessages = meter.counterBuilder("messages_redelivered")
                                .setDescription("Number of expired leases returned to the backlog")
                                .build();

                pushFailures = meter.counterBuilder("push_failures")
                                .setDescription("Number of failed push deliveries")
                                .build();

                pullRejections = meter.counterBuilder("pull_rejected")
                                .setDescription("Number of pulls rejected by the admission cap")
                                .build();
        }

        public void recordPublished(String topic, int count) {
                publishedMessages.add(count, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String subscription, int count) {
                if (count > 0) {
                        deliveredMessages.add(count, Attributes.of(SUBSCRIPTION, subscription));
                }
        }

        public void recordAcknowledged(String subscription, int count) {
                if (count > 0) {
                        acknowledgedMessages.add(count, Attributes.of(SUBSCRIPTION, subscription));
                }
        }

        public void recordRedelivered(String subscription, int count) {
                if (count > 0) {
                        redeliveredMessages.add(count, Attributes.of(SUBSCRIPTION, subscription));
                }
        }

        public void recordPushFailure(String subscription) {
                pushFailures.add(1, Attributes.of(SUBSCRIPTION, subscription));
        }

        public void recordPullRejected(String subscription) {
                pullRejections.add(1, Attributes.of(SUBSCRIPTION, subscription));
        }
}
