package com.p14n.pubsub.data;

import java.time.Duration;

public record BrokerConfig(int maxConcurrentPulls,
        Duration maxPullWait,
        Duration sweepInterval,
        int pushBatchSize) implements PubsubConfig {

    public static final int DEFAULT_MAX_CONCURRENT_PULLS = 10;
    public static final Duration DEFAULT_MAX_PULL_WAIT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMillis(100);
    public static final int DEFAULT_PUSH_BATCH_SIZE = 10;

    public BrokerConfig {
        if (maxConcurrentPulls <= 0) {
            throw new IllegalArgumentException("maxConcurrentPulls must be positive");
        }
        if (pushBatchSize <= 0) {
            throw new IllegalArgumentException("pushBatchSize must be positive");
        }
        if (maxPullWait == null || maxPullWait.isNegative()) {
            throw new IllegalArgumentException("maxPullWait cannot be null or negative");
        }
        if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    public BrokerConfig() {
        this(DEFAULT_MAX_CONCURRENT_PULLS, DEFAULT_MAX_PULL_WAIT, DEFAULT_SWEEP_INTERVAL, DEFAULT_PUSH_BATCH_SIZE);
    }
}
