package com.p14n.pubsub.remote;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.google.common.base.Strings;
import com.p14n.pubsub.broker.PubsubBroker;
import com.p14n.pubsub.broker.PullCancellation;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.Page;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.data.SubscriptionInfo;
import com.p14n.pubsub.data.TopicInfo;
import com.p14n.pubsub.grpc.AcknowledgeRequest;
import com.p14n.pubsub.grpc.DeleteSubscriptionRequest;
import com.p14n.pubsub.grpc.DeleteTopicRequest;
import com.p14n.pubsub.grpc.GetSubscriptionRequest;
import com.p14n.pubsub.grpc.GetTopicRequest;
import com.p14n.pubsub.grpc.ListSubscriptionsRequest;
import com.p14n.pubsub.grpc.ListTopicSubscriptionsRequest;
import com.p14n.pubsub.grpc.ListTopicsRequest;
import com.p14n.pubsub.grpc.ModifyAckDeadlineRequest;
import com.p14n.pubsub.grpc.ModifyPushConfigRequest;
import com.p14n.pubsub.grpc.PublishRequest;
import com.p14n.pubsub.grpc.PublisherGrpc;
import com.p14n.pubsub.grpc.PullRequest;
import com.p14n.pubsub.grpc.SubscriberGrpc;
import com.p14n.pubsub.grpc.Subscription;
import com.p14n.pubsub.grpc.Topic;

import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PubsubBroker} backed by a remote server's Publisher and Subscriber
 * services.
 *
 * <p>
 * Error statuses come back as {@link com.p14n.pubsub.PubsubException} with the
 * matching code. Cancelling a pull's {@link PullCancellation} cancels the
 * call on the server too.
 * </p>
 */
public class PubsubGrpcClient implements PubsubBroker {
    private static final Logger logger = LoggerFactory.getLogger(PubsubGrpcClient.class);

    private final ManagedChannel channel;
    private final PublisherGrpc.PublisherBlockingStub publisher;
    private final SubscriberGrpc.SubscriberBlockingStub subscriber;

    public PubsubGrpcClient(String host, int port) {
        this(ManagedChannelBuilder.forAddress(host, port)
                .keepAliveTime(1, TimeUnit.HOURS)
                .keepAliveTimeout(30, TimeUnit.SECONDS)
                .usePlaintext()
                .build());
    }

    public PubsubGrpcClient(ManagedChannel channel) {
        this.channel = channel;
        this.publisher = PublisherGrpc.newBlockingStub(channel);
        this.subscriber = SubscriberGrpc.newBlockingStub(channel);
    }

    @Override
    public TopicInfo createTopic(String name) {
        return call(() -> GrpcConverter.fromGrpc(publisher.createTopic(Topic.newBuilder().setName(name).build())));
    }

    @Override
    public TopicInfo getTopic(String name) {
        return call(() -> GrpcConverter.fromGrpc(
                publisher.getTopic(GetTopicRequest.newBuilder().setTopic(name).build())));
    }

    @Override
    public Page<TopicInfo> listTopics(String project, int pageSize, String pageToken) {
        return call(() -> {
            var response = publisher.listTopics(ListTopicsRequest.newBuilder()
                    .setProject(Strings.nullToEmpty(project))
                    .setPageSize(pageSize)
                    .setPageToken(Strings.nullToEmpty(pageToken))
                    .build());
            var topics = new ArrayList<TopicInfo>(response.getTopicsCount());
            for (var topic : response.getTopicsList()) {
                topics.add(GrpcConverter.fromGrpc(topic));
            }
            return new Page<>(topics, response.getNextPageToken());
        });
    }

    @Override
    public Page<String> listTopicSubscriptions(String topic, int pageSize, String pageToken) {
        return call(() -> {
            var response = publisher.listTopicSubscriptions(ListTopicSubscriptionsRequest.newBuilder()
                    .setTopic(topic)
                    .setPageSize(pageSize)
                    .setPageToken(Strings.nullToEmpty(pageToken))
                    .build());
            return new Page<>(response.getSubscriptionsList(), response.getNextPageToken());
        });
    }

    @Override
    public void deleteTopic(String name) {
        call(() -> publisher.deleteTopic(DeleteTopicRequest.newBuilder().setTopic(name).build()));
    }

    @Override
    public List<String> publish(String topic, List<Message> messages) {
        var request = PublishRequest.newBuilder().setTopic(topic);
        for (var message : messages) {
            request.addMessages(GrpcConverter.toGrpc(message));
        }
        return call(() -> publisher.publish(request.build()).getMessageIdsList());
    }

    @Override
    public SubscriptionInfo createSubscription(String name, String topic, PushConfig pushConfig,
            int ackDeadlineSeconds) {
        var request = Subscription.newBuilder()
                .setName(Strings.nullToEmpty(name))
                .setTopic(topic)
                .setAckDeadlineSeconds(ackDeadlineSeconds);
        if (pushConfig != null && !pushConfig.isPull()) {
            request.setPushConfig(GrpcConverter.toGrpc(pushConfig));
        }
        return call(() -> GrpcConverter.fromGrpc(subscriber.createSubscription(request.build())));
    }

    @Override
    public SubscriptionInfo getSubscription(String name) {
        return call(() -> GrpcConverter.fromGrpc(subscriber.getSubscription(
                GetSubscriptionRequest.newBuilder().setSubscription(name).build())));
    }

    @Override
    public Page<SubscriptionInfo> listSubscriptions(String project, int pageSize, String pageToken) {
        return call(() -> {
            var response = subscriber.listSubscriptions(ListSubscriptionsRequest.newBuilder()
                    .setProject(Strings.nullToEmpty(project))
                    .setPageSize(pageSize)
                    .setPageToken(Strings.nullToEmpty(pageToken))
                    .build());
            var subscriptions = new ArrayList<SubscriptionInfo>(response.getSubscriptionsCount());
            for (var subscription : response.getSubscriptionsList()) {
                subscriptions.add(GrpcConverter.fromGrpc(subscription));
            }
            return new Page<>(subscriptions, response.getNextPageToken());
        });
    }

    @Override
    public void deleteSubscription(String name) {
        call(() -> subscriber.deleteSubscription(
                DeleteSubscriptionRequest.newBuilder().setSubscription(name).build()));
    }

    @Override
    public void modifyPushConfig(String name, PushConfig pushConfig) {
        var request = ModifyPushConfigRequest.newBuilder().setSubscription(name);
        if (pushConfig != null && !pushConfig.isPull()) {
            request.setPushConfig(GrpcConverter.toGrpc(pushConfig));
        }
        call(() -> subscriber.modifyPushConfig(request.build()));
    }

    @Override
    public List<ReceivedMessage> pull(String subscription, int maxMessages, boolean returnImmediately,
            PullCancellation cancellation) {
        var request = PullRequest.newBuilder()
                .setSubscription(subscription)
                .setMaxMessages(maxMessages)
                .setReturnImmediately(returnImmediately)
                .build();
        var context = Context.current().withCancellation();
        if (cancellation != null) {
            cancellation.onCancel(() -> context.cancel(null));
        }
        try {
            return call(() -> {
                var previous = context.attach();
                try {
                    var received = new ArrayList<ReceivedMessage>();
                    for (var r : subscriber.pull(request).getReceivedMessagesList()) {
                        received.add(GrpcConverter.fromGrpc(r));
                    }
                    return received;
                } finally {
                    context.detach(previous);
                }
            });
        } finally {
            context.cancel(null);
        }
    }

    @Override
    public int acknowledge(String subscription, List<String> ackIds) {
        call(() -> subscriber.acknowledge(AcknowledgeRequest.newBuilder()
                .setSubscription(subscription)
                .addAllAckIds(ackIds)
                .build()));
        // the wire response carries no count
        return ackIds.size();
    }

    @Override
    public int modifyAckDeadline(String subscription, List<String> ackIds, int seconds) {
        call(() -> subscriber.modifyAckDeadline(ModifyAckDeadlineRequest.newBuilder()
                .setSubscription(subscription)
                .addAllAckIds(ackIds)
                .setAckDeadlineSeconds(seconds)
                .build()));
        return ackIds.size();
    }

    @Override
    public void close() {
        channel.shutdownNow();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarn().log("Interrupted while closing channel");
        }
    }

    private static <T> T call(Supplier<T> rpc) {
        try {
            return rpc.get();
        } catch (StatusRuntimeException e) {
            throw GrpcResponses.fromStatus(e);
        }
    }
}
