package com.p14n.pubsub.broker;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.Page;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.data.SubscriptionInfo;
import com.p14n.pubsub.data.TopicInfo;
import com.p14n.pubsub.push.PushClient;
import com.p14n.pubsub.push.PushDispatcher;
import com.p14n.pubsub.push.PushRequest;
import com.p14n.pubsub.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.pubsub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * In-memory {@link PubsubBroker}.
 *
 * <p>
 * Ties the resource registry to the pull and push dispatchers and the lease
 * expiry sweeper. Call {@link #start()} to begin sweeping expired leases;
 * until then leases only end by acknowledgment.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * try (var broker = new DefaultPubsubBroker(new BrokerConfig(), pushClient, OpenTelemetry.noop())) {
 *     broker.start();
 *     broker.createTopic("projects/p/topics/orders");
 *     broker.createSubscription("projects/p/subscriptions/audit", "projects/p/topics/orders", null, 10);
 *     broker.publish("projects/p/topics/orders", List.of(Message.create(payload, Map.of())));
 *     var received = broker.pull("projects/p/subscriptions/audit", 10, true, PullCancellation.none());
 * }
 * }</pre>
 */
public class DefaultPubsubBroker implements PubsubBroker {
    private static final Logger logger = LoggerFactory.getLogger(DefaultPubsubBroker.class);
    private static final String SCOPE_NAME = "pubsub_broker";

    private final PubsubConfig config;
    private final AsyncExecutor executor;
    private final boolean ownsExecutor;
    private final Clock clock;
    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final ResourceRegistry registry;
    private final PullDispatcher pullDispatcher;
    private final PushDispatcher pushDispatcher;
    private final LeaseExpirySweeper sweeper;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultPubsubBroker(PubsubConfig config, PushClient pushClient, OpenTelemetry ot) {
        this(config, new DefaultExecutor(config.schedulerThreads()), true, pushClient, ot, Clock.systemUTC());
    }

    public DefaultPubsubBroker(PubsubConfig config, AsyncExecutor executor, PushClient pushClient,
            OpenTelemetry ot, Clock clock) {
        this(config, executor, false, pushClient, ot, clock);
    }

    private DefaultPubsubBroker(PubsubConfig config, AsyncExecutor executor, boolean ownsExecutor,
            PushClient pushClient, OpenTelemetry ot, Clock clock) {
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.clock = clock;
        this.metrics = new BrokerMetrics(ot.getMeter(SCOPE_NAME));
        this.tracer = ot.getTracer(SCOPE_NAME);
        this.registry = new ResourceRegistry(config, clock);
        this.pullDispatcher = new PullDispatcher(registry, config, metrics);
        this.pushDispatcher = new PushDispatcher(executor, pushClient == null ? DefaultPubsubBroker::noPushClient
                : pushClient, config, metrics);
        this.sweeper = new LeaseExpirySweeper(registry, metrics);
    }

    /**
     * Starts the lease expiry sweeper. Calling it again has no effect.
     */
    public DefaultPubsubBroker start() {
        ensureOpen();
        if (started.compareAndSet(false, true)) {
            sweeper.start(executor, config.sweepInterval().toMillis());
        }
        return this;
    }

    @Override
    public TopicInfo createTopic(String name) {
        ensureOpen();
        return registry.createTopic(name);
    }

    @Override
    public TopicInfo getTopic(String name) {
        ensureOpen();
        return registry.getTopic(name);
    }

    @Override
    public Page<TopicInfo> listTopics(String project, int pageSize, String pageToken) {
        ensureOpen();
        return registry.listTopics(project, pageSize, pageToken);
    }

    @Override
    public Page<String> listTopicSubscriptions(String topic, int pageSize, String pageToken) {
        ensureOpen();
        return registry.listTopicSubscriptions(topic, pageSize, pageToken);
    }

    @Override
    public void deleteTopic(String name) {
        ensureOpen();
        registry.deleteTopic(name);
    }

    /**
     * Publishes messages to every subscription bound to the topic.
     * The whole batch is appended under the topic lock, so a subscription
     * created concurrently sees all of it or none of it. Runs inside a
     * {@code publish_messages} span.
     *
     * @param topic    The topic to publish to
     * @param messages The messages, at least one and none null
     * @return The assigned message ids in input order
     * @throws PubsubException       INVALID_ARGUMENT for an empty batch or a null
     *                               message, NOT_FOUND for an unknown topic
     * @throws IllegalStateException if the broker is closed
     */
    @Override
    public List<String> publish(String topic, List<Message> messages) {
        ensureOpen();
        if (messages == null || messages.isEmpty()) {
            throw PubsubException.invalidArgument("At least one message is required to publish");
        }
        for (var message : messages) {
            if (message == null) {
                throw PubsubException.invalidArgument("Messages cannot contain null");
            }
        }
        var state = registry.topic(topic);
        var ids = processWithTelemetry(tracer, "publish_messages", "topic", topic,
                () -> state.publish(messages, clock.instant()));
        metrics.recordPublished(topic, ids.size());
        logger.atDebug()
                .addArgument(ids.size())
                .addArgument(topic)
                .log("Published {} messages to {}");
        return ids;
    }

    /**
     * Creates a subscription and, when it has a push endpoint, starts its push
     * loop.
     */
    @Override
    public SubscriptionInfo createSubscription(String name, String topic, PushConfig pushConfig,
            int ackDeadlineSeconds) {
        ensureOpen();
        var subscription = registry.createSubscription(name, topic, pushConfig, ackDeadlineSeconds);
        pushDispatcher.reconcile(subscription);
        return subscription.info();
    }

    @Override
    public SubscriptionInfo getSubscription(String name) {
        ensureOpen();
        return registry.getSubscription(name);
    }

    @Override
    public Page<SubscriptionInfo> listSubscriptions(String project, int pageSize, String pageToken) {
        ensureOpen();
        return registry.listSubscriptions(project, pageSize, pageToken);
    }

    /**
     * Deletes a subscription and stops its push loop. Deliveries already handed
     * to the push client are not cancelled.
     *
     * @param name The subscription name
     * @throws PubsubException NOT_FOUND if there is no such subscription
     */
    @Override
    public void deleteSubscription(String name) {
        ensureOpen();
        pushDispatcher.stop(registry.deleteSubscription(name));
    }

    @Override
    public void modifyPushConfig(String name, PushConfig pushConfig) {
        ensureOpen();
        pushDispatcher.reconcile(registry.modifyPushConfig(name, pushConfig));
    }

    /**
     * Leases messages from a subscription, waiting up to the configured
     * maximum when nothing is available and {@code returnImmediately} is
     * false. Runs inside a {@code pull_messages} span.
     *
     * @param subscription      The subscription to pull from
     * @param maxMessages       The upper bound on returned messages
     * @param returnImmediately Whether to return at once when nothing is
     *                          available
     * @param cancellation      Ends the wait with CANCELLED, null for none
     * @return The leased messages, possibly none
     * @throws PubsubException UNAVAILABLE when too many pulls are outstanding
     *                         on the subscription
     */
    @Override
    public List<ReceivedMessage> pull(String subscription, int maxMessages, boolean returnImmediately,
            PullCancellation cancellation) {
        ensureOpen();
        return processWithTelemetry(tracer, "pull_messages", "subscription", subscription,
                () -> pullDispatcher.pull(subscription, maxMessages, returnImmediately,
                        cancellation == null ? PullCancellation.none() : cancellation));
    }

    @Override
    public int acknowledge(String subscription, List<String> ackIds) {
        ensureOpen();
        if (ackIds == null || ackIds.isEmpty()) {
            throw PubsubException.invalidArgument("ack_ids must not be empty");
        }
        int acked = registry.subscription(subscription).acknowledge(ackIds);
        metrics.recordAcknowledged(subscription, acked);
        return acked;
    }

    @Override
    public int modifyAckDeadline(String subscription, List<String> ackIds, int seconds) {
        ensureOpen();
        return registry.subscription(subscription).modifyAckDeadline(ackIds == null ? List.of() : ackIds, seconds);
    }

    /**
     * Runs one expiry sweep now, independent of the scheduled one.
     *
     * @return The number of leases returned to backlogs
     */
    public int sweepExpiredLeases() {
        return sweeper.sweep();
    }

    /**
     * Gives direct access to a subscription's delivery state, for inspection.
     */
    public SubscriptionState subscriptionState(String name) {
        return registry.subscription(name);
    }

    public boolean isPushing(String subscription) {
        return pushDispatcher.isRunning(subscription);
    }

    /**
     * Stops the sweeper and all push loops. The executor is shut down only
     * when the broker created it. Further calls fail with
     * {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        sweeper.close();
        pushDispatcher.close();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        logger.atInfo().log("Broker closed");
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    private static CompletableFuture<Void> noPushClient(PushRequest request) {
        return CompletableFuture.failedFuture(
                new IllegalStateException("No push client configured for " + request.endpoint()));
    }
}
