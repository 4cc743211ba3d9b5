package com.p14n.pubsub.push;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.broker.AsyncExecutor;
import com.p14n.pubsub.broker.PullCancellation;
import com.p14n.pubsub.broker.SubscriptionState;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one delivery loop per push subscription.
 *
 * <p>
 * A loop leases a batch the same way a pull does, hands each message to the
 * {@link PushClient} and acknowledges the ones the endpoint accepted. Failed
 * or timed out deliveries are left alone: their lease expires and the sweeper
 * puts them back in the backlog, so push retries follow the same path as pull
 * redelivery.
 * </p>
 */
public class PushDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PushDispatcher.class);

    private final AsyncExecutor executor;
    private final PushClient client;
    private final PubsubConfig config;
    private final BrokerMetrics metrics;
    private final ConcurrentHashMap<String, PushLoop> loops = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PushDispatcher(AsyncExecutor executor, PushClient client, PubsubConfig config, BrokerMetrics metrics) {
        this.executor = executor;
        this.client = client;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Starts or stops the loop of a subscription to match its current push
     * configuration.
     *
     * <p>
     * The configuration is read under the map's per-key lock, so concurrent
     * calls for one subscription settle on the configuration that was written
     * last.
     * </p>
     *
     * @param subscription The subscription whose configuration may have changed
     */
    public void reconcile(SubscriptionState subscription) {
        if (closed.get()) {
            return;
        }
        loops.compute(subscription.name(), (name, existing) -> {
            if (subscription.pushConfig().isPull()) {
                if (existing != null && existing.subscription == subscription) {
                    existing.stop();
                    return null;
                }
                return existing;
            }
            if (existing != null && existing.subscription == subscription && !existing.isStopped()) {
                return existing;
            }
            if (existing != null) {
                existing.stop();
            }
            var loop = new PushLoop(subscription);
            executor.submit(loop);
            return loop;
        });
    }

    /**
     * Stops the loop serving this subscription, if any. A loop serving a newer
     * subscription of the same name is left running. Deliveries already handed
     * to the client are not cancelled.
     */
    public void stop(SubscriptionState subscription) {
        loops.computeIfPresent(subscription.name(), (name, loop) -> {
            if (loop.subscription != subscription) {
                return loop;
            }
            loop.stop();
            return null;
        });
    }

    public boolean isRunning(String subscriptionName) {
        return loops.containsKey(subscriptionName);
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        for (var loop : List.copyOf(loops.values())) {
            stop(loop.subscription);
        }
    }

    private class PushLoop implements Callable<Void> {

        private final SubscriptionState subscription;
        private final PullCancellation stopSignal = new PullCancellation();

        PushLoop(SubscriptionState subscription) {
            this.subscription = subscription;
        }

        void stop() {
            stopSignal.cancel();
        }

        boolean isStopped() {
            return stopSignal.isCancelled();
        }

        @Override
        public Void call() {
            var name = subscription.name();
            stopSignal.onCancel(subscription::wakeWaiters);
            logger.atInfo().log("Push loop started for {}", name);
            try {
                while (!isStopped()) {
                    var pushConfig = subscription.pushConfig();
                    if (pushConfig.isPull()) {
                        if (retire()) {
                            break;
                        }
                        continue;
                    }
                    List<ReceivedMessage> batch;
                    try {
                        batch = subscription.awaitLease(config.pushBatchSize(), false, config.pushIdleWait(),
                                stopSignal);
                    } catch (PubsubException e) {
                        if (e.code() == PubsubException.ErrorCode.CANCELLED
                                || e.code() == PubsubException.ErrorCode.NOT_FOUND) {
                            break;
                        }
                        throw e;
                    }
                    if (!batch.isEmpty()) {
                        // pick up an endpoint change made while waiting
                        var current = subscription.pushConfig();
                        deliver(batch, current.isPull() ? pushConfig : current);
                    }
                }
            } catch (Exception e) {
                logger.atError()
                        .addArgument(name)
                        .setCause(e)
                        .log("Push loop for {} failed");
            } finally {
                loops.remove(name, this);
                logger.atInfo().log("Push loop stopped for {}", name);
            }
            return null;
        }

        /**
         * Removes this loop when its subscription has switched to pull. Runs
         * under the map's per-key lock so a concurrent switch back to push
         * either keeps this loop or starts a fresh one.
         */
        private boolean retire() {
            var retired = new AtomicBoolean(false);
            loops.computeIfPresent(subscription.name(), (name, current) -> {
                if (current == this && subscription.pushConfig().isPull()) {
                    stop();
                    retired.set(true);
                    return null;
                }
                return current;
            });
            return retired.get() || isStopped();
        }

        private void deliver(List<ReceivedMessage> batch, PushConfig pushConfig) {
            var name = subscription.name();
            var timeout = Duration.ofSeconds(subscription.ackDeadlineSeconds());
            metrics.recordDelivered(name, batch.size());

            var deliveries = new ArrayList<CompletableFuture<Void>>(batch.size());
            for (var received : batch) {
                deliveries.add(deliver(new PushRequest(name, pushConfig, received, timeout)));
            }
            CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();
        }

        private CompletableFuture<Void> deliver(PushRequest request) {
            CompletableFuture<Void> sent;
            try {
                sent = client.push(request);
            } catch (RuntimeException e) {
                sent = CompletableFuture.failedFuture(e);
            }
            var ackId = request.received().ackId();
            return sent.orTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((ok, error) -> {
                        if (error == null) {
                            metrics.recordAcknowledged(request.subscription(),
                                    subscription.acknowledge(List.of(ackId)));
                        } else {
                            metrics.recordPushFailure(request.subscription());
                            logger.atWarn()
                                    .addArgument(request.received().message().id())
                                    .addArgument(request.endpoint())
                                    .addArgument(error.toString())
                                    .log("Push of message {} to {} failed, leaving lease to expire: {}");
                        }
                        return null;
                    });
        }
    }
}
