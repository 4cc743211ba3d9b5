package com.p14n.pubsub.broker;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.p14n.pubsub.telemetry.BrokerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically returns expired leases to their subscription's backlog.
 *
 * <p>
 * A sweep visits every subscription in turn and holds only that
 * subscription's lock while moving its expired entries. Redelivery therefore
 * happens no earlier than the lease deadline and at most one sweep interval
 * after it.
 * </p>
 */
public class LeaseExpirySweeper implements Runnable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LeaseExpirySweeper.class);

    private final ResourceRegistry registry;
    private final BrokerMetrics metrics;
    private ScheduledFuture<?> scheduled;

    public LeaseExpirySweeper(ResourceRegistry registry, BrokerMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    public synchronized void start(AsyncExecutor executor, long intervalMillis) {
        if (scheduled != null) {
            throw new IllegalStateException("Sweeper already started");
        }
        scheduled = executor.scheduleAtFixedRate(this, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        logger.atInfo().log("Lease expiry sweeper running every {} ms", intervalMillis);
    }

    /**
     * Runs one sweep over all subscriptions.
     *
     * @return The total number of leases requeued
     */
    public int sweep() {
        int total = 0;
        for (var subscription : registry.subscriptions()) {
            try {
                int requeued = subscription.expire();
                metrics.recordRedelivered(subscription.name(), requeued);
                total += requeued;
            } catch (Exception e) {
                logger.atError()
                        .addArgument(subscription.name())
                        .setCause(e)
                        .log("Failed to expire leases on {}");
            }
        }
        return total;
    }

    @Override
    public void run() {
        sweep();
    }

    @Override
    public synchronized void close() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
    }
}
