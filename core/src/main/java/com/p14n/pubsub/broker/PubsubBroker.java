package com.p14n.pubsub.broker;

import java.util.List;

import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.Page;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.data.SubscriptionInfo;
import com.p14n.pubsub.data.TopicInfo;

/**
 * Thread-safe publish/subscribe engine: topics, subscriptions and
 * lease-based delivery.
 *
 * <p>
 * Failures are reported as {@link com.p14n.pubsub.PubsubException} carrying
 * the error code a transport should return.
 * </p>
 */
public interface PubsubBroker extends AutoCloseable {

    /**
     * Creates a topic.
     *
     * @param name The full topic name, e.g. {@code projects/p/topics/orders}
     * @return The created topic
     * @throws com.p14n.pubsub.PubsubException ALREADY_EXISTS if the name is
     *                                         taken, INVALID_ARGUMENT if it is
     *                                         empty
     */
    TopicInfo createTopic(String name);

    TopicInfo getTopic(String name);

    /**
     * Lists topics in name order, one page at a time.
     *
     * @param project   The project prefix, e.g. {@code projects/p}, or empty
     *                  for all topics
     * @param pageSize  The maximum page size, 0 or less for the default
     * @param pageToken The token from the previous page, or empty for the first
     * @return One page of topics
     */
    Page<TopicInfo> listTopics(String project, int pageSize, String pageToken);

    /**
     * Lists the names of the subscriptions currently bound to a topic.
     *
     * @param topic     The topic name
     * @param pageSize  The maximum page size, 0 or less for the default
     * @param pageToken The token from the previous page, or empty for the first
     * @return One page of subscription names
     */
    Page<String> listTopicSubscriptions(String topic, int pageSize, String pageToken);

    /**
     * Deletes a topic. Its subscriptions survive, detached from any topic.
     *
     * @param name The topic name
     */
    void deleteTopic(String name);

    /**
     * Publishes messages to every subscription bound to the topic.
     *
     * @param topic    The topic to publish to
     * @param messages The messages, at least one
     * @return The assigned message ids in input order
     */
    List<String> publish(String topic, List<Message> messages);

    /**
     * Creates a subscription on an existing topic. It receives messages
     * published from now on.
     *
     * @param name               The subscription name, or empty to have one
     *                           generated
     * @param topic              The topic to bind to
     * @param pushConfig         The push endpoint, or null/empty for pull
     * @param ackDeadlineSeconds The lease duration, 0 for the default
     * @return The created subscription, with its name and push version filled
     *         in
     */
    SubscriptionInfo createSubscription(String name, String topic, PushConfig pushConfig, int ackDeadlineSeconds);

    SubscriptionInfo getSubscription(String name);

    Page<SubscriptionInfo> listSubscriptions(String project, int pageSize, String pageToken);

    /**
     * Deletes a subscription with its backlog and outstanding leases. Pulls
     * waiting on it end with NOT_FOUND.
     *
     * @param name The subscription name
     */
    void deleteSubscription(String name);

    /**
     * Switches a subscription between pull and push, or changes its endpoint.
     * Takes effect for the next delivery cycle.
     *
     * @param name       The subscription name
     * @param pushConfig The new configuration, null or empty endpoint for pull
     */
    void modifyPushConfig(String name, PushConfig pushConfig);

    /**
     * Leases up to {@code maxMessages} messages from a subscription.
     *
     * @param subscription      The subscription to pull from
     * @param maxMessages       The upper bound on returned messages
     * @param returnImmediately Whether to return at once when nothing is
     *                          available
     * @param cancellation      Signals that the caller has gone away
     * @return The leased messages, possibly fewer than requested or none
     */
    List<ReceivedMessage> pull(String subscription, int maxMessages, boolean returnImmediately,
            PullCancellation cancellation);

    /**
     * Acknowledges leases. Unknown or expired ack ids are ignored.
     *
     * @param subscription The subscription the leases belong to
     * @param ackIds       The ack ids to acknowledge, at least one
     * @return The number of leases removed
     */
    int acknowledge(String subscription, List<String> ackIds);

    /**
     * Resets the deadline of leases to now plus {@code seconds}. Zero makes
     * them due for redelivery on the next sweep.
     *
     * @param subscription The subscription the leases belong to
     * @param ackIds       The ack ids to change
     * @param seconds      The new deadline from now, not negative
     * @return The number of leases changed
     */
    int modifyAckDeadline(String subscription, List<String> ackIds, int seconds);

    @Override
    void close();
}
