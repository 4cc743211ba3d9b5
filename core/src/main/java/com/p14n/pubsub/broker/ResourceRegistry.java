package com.p14n.pubsub.broker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.Page;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.SubscriptionInfo;
import com.p14n.pubsub.data.TopicInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide namespace of topics and subscriptions.
 *
 * <p>
 * Each topic owns the index of subscriptions bound to it; the delivery engine
 * reads that index when fanning out a publish. Subscriptions refer to their
 * topic by name only.
 * </p>
 */
public class ResourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ResourceRegistry.class);

    private final ConcurrentHashMap<String, TopicState> topics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SubscriptionState> subscriptions = new ConcurrentHashMap<>();
    private final PubsubConfig config;
    private final Clock clock;

    public ResourceRegistry(PubsubConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public TopicInfo createTopic(String name) {
        requireName(name, "topic");
        var created = new TopicState(name);
        if (topics.putIfAbsent(name, created) != null) {
            throw PubsubException.alreadyExists("Topic", name);
        }
        logger.atInfo().log("Created topic {}", name);
        return new TopicInfo(name);
    }

    public TopicInfo getTopic(String name) {
        return new TopicInfo(topic(name).name());
    }

    TopicState topic(String name) {
        var topic = name == null ? null : topics.get(name);
        if (topic == null) {
            throw PubsubException.notFound("Topic", name);
        }
        return topic;
    }

    public Page<TopicInfo> listTopics(String project, int pageSize, String pageToken) {
        var prefix = projectPrefix(project, "/topics/");
        var names = new ArrayList<TopicInfo>();
        for (var name : topics.keySet()) {
            if (name.startsWith(prefix)) {
                names.add(new TopicInfo(name));
            }
        }
        names.sort(Comparator.comparing(TopicInfo::name));
        return Pages.page(names, TopicInfo::name, pageSize, pageToken);
    }

    public Page<String> listTopicSubscriptions(String topicName, int pageSize, String pageToken) {
        var names = new ArrayList<>(topic(topicName).subscriptionNames());
        names.sort(Comparator.naturalOrder());
        return Pages.page(names, n -> n, pageSize, pageToken);
    }

    /**
     * Deletes a topic. Subscriptions bound to it are kept and their topic
     * becomes {@link SubscriptionState#DELETED_TOPIC}.
     */
    public void deleteTopic(String name) {
        var topic = topics.remove(name == null ? "" : name);
        if (topic == null) {
            throw PubsubException.notFound("Topic", name);
        }
        topic.delete();
        logger.atInfo().log("Deleted topic {}", name);
    }

    public SubscriptionState createSubscription(String name, String topicName, PushConfig pushConfig,
            int ackDeadlineSeconds) {
        if (ackDeadlineSeconds < 0) {
            throw PubsubException.invalidArgument("ack_deadline_seconds must not be negative: " + ackDeadlineSeconds);
        }
        var topic = topic(topicName);
        var subscriptionName = name == null || name.isEmpty() ? generatedName(topicName) : name;
        var deadline = ackDeadlineSeconds == 0 ? config.defaultAckDeadlineSeconds() : ackDeadlineSeconds;
        var push = pushConfig == null ? PushConfig.PULL : pushConfig.withVersionFrom(null);
        var state = new SubscriptionState(subscriptionName, topicName, push, deadline,
                config.maxConcurrentPulls(), clock);

        topic.bind(state, () -> {
            if (subscriptions.putIfAbsent(subscriptionName, state) != null) {
                throw PubsubException.alreadyExists("Subscription", subscriptionName);
            }
        });
        logger.atInfo()
                .addArgument(subscriptionName)
                .addArgument(topicName)
                .log("Created subscription {} on topic {}");
        return state;
    }

    public SubscriptionState subscription(String name) {
        var subscription = name == null ? null : subscriptions.get(name);
        if (subscription == null) {
            throw PubsubException.notFound("Subscription", name);
        }
        return subscription;
    }

    public SubscriptionInfo getSubscription(String name) {
        return subscription(name).info();
    }

    public Page<SubscriptionInfo> listSubscriptions(String project, int pageSize, String pageToken) {
        var prefix = projectPrefix(project, "/subscriptions/");
        var infos = new ArrayList<SubscriptionInfo>();
        for (var subscription : subscriptions.values()) {
            if (subscription.name().startsWith(prefix)) {
                infos.add(subscription.info());
            }
        }
        infos.sort(Comparator.comparing(SubscriptionInfo::name));
        return Pages.page(infos, SubscriptionInfo::name, pageSize, pageToken);
    }

    /**
     * Removes a subscription and drops its backlog and leases. A subscription
     * created later under the same name starts empty.
     *
     * @return The removed subscription
     */
    public SubscriptionState deleteSubscription(String name) {
        var subscription = subscriptions.remove(name == null ? "" : name);
        if (subscription == null) {
            throw PubsubException.notFound("Subscription", name);
        }
        var topic = topics.get(subscription.topic());
        if (topic != null) {
            topic.unbind(subscription);
        }
        subscription.discard();
        logger.atInfo().log("Deleted subscription {}", name);
        return subscription;
    }

    public SubscriptionState modifyPushConfig(String name, PushConfig pushConfig) {
        var subscription = subscription(name);
        var next = pushConfig == null ? PushConfig.PULL : pushConfig.withVersionFrom(subscription.pushConfig());
        subscription.pushConfig(next);
        logger.atInfo()
                .addArgument(name)
                .addArgument(next.isPull() ? "pull" : next.endpoint())
                .log("Subscription {} now delivers via {}");
        return subscription;
    }

    public Collection<SubscriptionState> subscriptions() {
        return List.copyOf(subscriptions.values());
    }

    private static String generatedName(String topicName) {
        var marker = topicName.indexOf("/topics/");
        var generated = "sub-" + UUID.randomUUID();
        return marker < 0 ? generated : topicName.substring(0, marker) + "/subscriptions/" + generated;
    }

    private static String projectPrefix(String project, String collection) {
        if (project == null || project.isEmpty()) {
            return "";
        }
        return project + collection;
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw PubsubException.invalidArgument(what + " name cannot be empty");
        }
    }
}
