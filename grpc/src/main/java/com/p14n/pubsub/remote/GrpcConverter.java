package com.p14n.pubsub.remote;

import java.time.Instant;

import com.google.protobuf.Timestamp;
import com.google.protobuf.UnsafeByteOperations;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.data.SubscriptionInfo;
import com.p14n.pubsub.data.TopicInfo;
import com.p14n.pubsub.grpc.PubsubMessage;
import com.p14n.pubsub.grpc.Subscription;
import com.p14n.pubsub.grpc.Topic;

/**
 * Converts between the broker's records and their protobuf messages.
 *
 * <p>
 * Key features:
 * <ul>
 * <li>Publisher input drops client-supplied ids and publish times</li>
 * <li>Payloads are wrapped without a second copy on the way out</li>
 * <li>Publish times travel as {@link Timestamp}</li>
 * <li>An absent push config maps to pull delivery</li>
 * </ul>
 */
public final class GrpcConverter {

    private GrpcConverter() {
    }

    /**
     * Converts a message sent by a publisher. Its id and publish time are
     * ignored; the broker assigns them.
     */
    public static Message toMessage(PubsubMessage message) {
        return Message.create(message.getData().toByteArray(), message.getAttributesMap());
    }

    /**
     * Converts a delivered message back into a broker record, keeping the id
     * and publish time it carries.
     *
     * @param message The protobuf message
     * @return The message, with a null id when none was set
     */
    public static Message fromGrpc(PubsubMessage message) {
        Instant publishTime = message.hasPublishTime() ? toInstant(message.getPublishTime()) : null;
        return new Message(message.getMessageId().isEmpty() ? null : message.getMessageId(), null,
                message.getData().toByteArray(), message.getAttributesMap(), publishTime);
    }

    public static PubsubMessage toGrpc(Message message) {
        var builder = PubsubMessage.newBuilder()
                .setData(UnsafeByteOperations.unsafeWrap(message.data()))
                .putAllAttributes(message.attributes());
        if (message.id() != null) {
            builder.setMessageId(message.id());
        }
        if (message.publishTime() != null) {
            builder.setPublishTime(toTimestamp(message.publishTime()));
        }
        return builder.build();
    }

    /**
     * Converts a leased message for a Pull response.
     *
     * @param received The leased message with its ack id and attempt count
     * @return The protobuf message
     */
    public static com.p14n.pubsub.grpc.ReceivedMessage toGrpc(ReceivedMessage received) {
        return com.p14n.pubsub.grpc.ReceivedMessage.newBuilder()
                .setAckId(received.ackId())
                .setMessage(toGrpc(received.message()))
                .setDeliveryAttempt(received.deliveryAttempt())
                .build();
    }

    public static ReceivedMessage fromGrpc(com.p14n.pubsub.grpc.ReceivedMessage received) {
        return new ReceivedMessage(received.getAckId(), fromGrpc(received.getMessage()),
                received.getDeliveryAttempt());
    }

    /**
     * An absent or empty push config means pull delivery.
     */
    public static PushConfig toPushConfig(boolean present, com.p14n.pubsub.grpc.PushConfig config) {
        if (!present) {
            return PushConfig.PULL;
        }
        return new PushConfig(config.getPushEndpoint(), config.getAttributesMap());
    }

    public static com.p14n.pubsub.grpc.PushConfig toGrpc(PushConfig config) {
        return com.p14n.pubsub.grpc.PushConfig.newBuilder()
                .setPushEndpoint(config.endpoint())
                .putAllAttributes(config.attributes())
                .build();
    }

    public static Subscription toGrpc(SubscriptionInfo info) {
        var builder = Subscription.newBuilder()
                .setName(info.name())
                .setTopic(info.topic())
                .setAckDeadlineSeconds(info.ackDeadlineSeconds());
        if (!info.pushConfig().isPull()) {
            builder.setPushConfig(toGrpc(info.pushConfig()));
        }
        return builder.build();
    }

    public static SubscriptionInfo fromGrpc(Subscription subscription) {
        return new SubscriptionInfo(subscription.getName(), subscription.getTopic(),
                toPushConfig(subscription.hasPushConfig(), subscription.getPushConfig()),
                subscription.getAckDeadlineSeconds());
    }

    public static Topic toGrpc(TopicInfo topic) {
        return Topic.newBuilder().setName(topic.name()).build();
    }

    public static TopicInfo fromGrpc(Topic topic) {
        return new TopicInfo(topic.getName());
    }

    static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
