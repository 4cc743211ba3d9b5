package com.p14n.pubsub.broker;

import java.util.List;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves Pull requests against a subscription's backlog.
 *
 * <p>
 * Each subscription admits at most {@link PubsubConfig#maxConcurrentPulls()}
 * pulls at once, waiting ones included; callers over the cap get UNAVAILABLE
 * and are expected to retry with backoff.
 * </p>
 */
public class PullDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(PullDispatcher.class);

    private final ResourceRegistry registry;
    private final PubsubConfig config;
    private final BrokerMetrics metrics;

    public PullDispatcher(ResourceRegistry registry, PubsubConfig config, BrokerMetrics metrics) {
        this.registry = registry;
        this.config = config;
        this.metrics = metrics;
    }

    public List<ReceivedMessage> pull(String subscriptionName, int maxMessages, boolean returnImmediately,
            PullCancellation cancellation) {
        if (maxMessages <= 0) {
            throw PubsubException.invalidArgument("max_messages must be positive: " + maxMessages);
        }
        var subscription = registry.subscription(subscriptionName);
        if (!subscription.tryAdmitPull()) {
            metrics.recordPullRejected(subscriptionName);
            logger.atDebug().log("Pull rejected on {}, too many outstanding pulls", subscriptionName);
            throw new PubsubException(PubsubException.ErrorCode.UNAVAILABLE,
                    "Too many outstanding pull requests for subscription: " + subscriptionName);
        }
        try {
            cancellation.onCancel(subscription::wakeWaiters);
            var received = subscription.awaitLease(maxMessages, returnImmediately, config.maxPullWait(),
                    cancellation);
            metrics.recordDelivered(subscriptionName, received.size());
            logger.atDebug()
                    .addArgument(received.size())
                    .addArgument(subscriptionName)
                    .log("Pulled {} messages from {}");
            return received;
        } finally {
            subscription.releasePull();
        }
    }
}
