package com.p14n.pubsub.data;

import java.time.Duration;

/**
 * Configuration interface for the delivery engine.
 * Defines the limits and timings used by the pull and push dispatchers and by
 * the lease expiry sweeper.
 */
public interface PubsubConfig {

    /**
     * Gets the maximum number of Pull calls that may be outstanding at once
     * for a single subscription. Further calls fail with UNAVAILABLE.
     *
     * @return The per-subscription pull admission cap
     */
    int maxConcurrentPulls();

    /**
     * Gets the longest time a Pull without return-immediately waits for a
     * message before returning an empty response.
     *
     * @return The maximum pull wait
     */
    Duration maxPullWait();

    /**
     * Gets the interval between lease expiry sweeps.
     * Redelivery happens at most this long after a lease's deadline.
     *
     * @return The sweep interval
     */
    Duration sweepInterval();

    /**
     * Gets the number of messages a push loop leases per cycle.
     *
     * @return The push batch size
     */
    int pushBatchSize();

    /**
     * Gets the ack deadline applied to subscriptions created without one.
     * Default is 60 seconds.
     *
     * @return The default ack deadline in seconds
     */
    default int defaultAckDeadlineSeconds() {
        return 60;
    }

    /**
     * Gets how long an idle push loop waits for new messages before it
     * re-reads its subscription's push configuration.
     * Default is 1 second.
     *
     * @return The push idle wait
     */
    default Duration pushIdleWait() {
        return Duration.ofSeconds(1);
    }

    /**
     * Gets the size of the scheduled thread pool used for sweeping.
     * Default is 1.
     *
     * @return The scheduled pool size
     */
    default int schedulerThreads() {
        return 1;
    }
}
