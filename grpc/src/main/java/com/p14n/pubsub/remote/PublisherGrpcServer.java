package com.p14n.pubsub.remote;

import java.util.ArrayList;

import com.google.protobuf.Empty;
import com.p14n.pubsub.broker.PubsubBroker;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.grpc.DeleteTopicRequest;
import com.p14n.pubsub.grpc.GetTopicRequest;
import com.p14n.pubsub.grpc.ListTopicSubscriptionsRequest;
import com.p14n.pubsub.grpc.ListTopicSubscriptionsResponse;
import com.p14n.pubsub.grpc.ListTopicsRequest;
import com.p14n.pubsub.grpc.ListTopicsResponse;
import com.p14n.pubsub.grpc.PublishRequest;
import com.p14n.pubsub.grpc.PublishResponse;
import com.p14n.pubsub.grpc.PublisherGrpc;
import com.p14n.pubsub.grpc.Topic;

import io.grpc.stub.StreamObserver;

import static com.p14n.pubsub.remote.GrpcResponses.respond;

/**
 * Serves the Publisher service from a {@link PubsubBroker}.
 */
public class PublisherGrpcServer extends PublisherGrpc.PublisherImplBase {

    private final PubsubBroker broker;

    public PublisherGrpcServer(PubsubBroker broker) {
        this.broker = broker;
    }

    @Override
    public void createTopic(Topic request, StreamObserver<Topic> responseObserver) {
        respond(responseObserver, "CreateTopic",
                () -> GrpcConverter.toGrpc(broker.createTopic(request.getName())));
    }

    @Override
    public void publish(PublishRequest request, StreamObserver<PublishResponse> responseObserver) {
        respond(responseObserver, "Publish", () -> {
            var messages = new ArrayList<Message>(request.getMessagesCount());
            for (var m : request.getMessagesList()) {
                messages.add(GrpcConverter.toMessage(m));
            }
            return PublishResponse.newBuilder()
                    .addAllMessageIds(broker.publish(request.getTopic(), messages))
                    .build();
        });
    }

    @Override
    public void getTopic(GetTopicRequest request, StreamObserver<Topic> responseObserver) {
        respond(responseObserver, "GetTopic", () -> GrpcConverter.toGrpc(broker.getTopic(request.getTopic())));
    }

    @Override
    public void listTopics(ListTopicsRequest request, StreamObserver<ListTopicsResponse> responseObserver) {
        respond(responseObserver, "ListTopics", () -> {
            var page = broker.listTopics(request.getProject(), request.getPageSize(), request.getPageToken());
            var builder = ListTopicsResponse.newBuilder().setNextPageToken(page.nextPageToken());
            for (var topic : page.items()) {
                builder.addTopics(GrpcConverter.toGrpc(topic));
            }
            return builder.build();
        });
    }

    @Override
    public void listTopicSubscriptions(ListTopicSubscriptionsRequest request,
            StreamObserver<ListTopicSubscriptionsResponse> responseObserver) {
        respond(responseObserver, "ListTopicSubscriptions", () -> {
            var page = broker.listTopicSubscriptions(request.getTopic(), request.getPageSize(),
                    request.getPageToken());
            return ListTopicSubscriptionsResponse.newBuilder()
                    .addAllSubscriptions(page.items())
                    .setNextPageToken(page.nextPageToken())
                    .build();
        });
    }

    @Override
    public void deleteTopic(DeleteTopicRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, "DeleteTopic", () -> {
            broker.deleteTopic(request.getTopic());
            return Empty.getDefaultInstance();
        });
    }
}
