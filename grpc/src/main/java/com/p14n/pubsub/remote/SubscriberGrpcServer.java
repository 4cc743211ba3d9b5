package com.p14n.pubsub.remote;

import java.util.ArrayList;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.Empty;
import com.p14n.pubsub.broker.PubsubBroker;
import com.p14n.pubsub.broker.PullCancellation;
import com.p14n.pubsub.grpc.AcknowledgeRequest;
import com.p14n.pubsub.grpc.DeleteSubscriptionRequest;
import com.p14n.pubsub.grpc.GetSubscriptionRequest;
import com.p14n.pubsub.grpc.ListSubscriptionsRequest;
import com.p14n.pubsub.grpc.ListSubscriptionsResponse;
import com.p14n.pubsub.grpc.ModifyAckDeadlineRequest;
import com.p14n.pubsub.grpc.ModifyPushConfigRequest;
import com.p14n.pubsub.grpc.PullRequest;
import com.p14n.pubsub.grpc.PullResponse;
import com.p14n.pubsub.grpc.Subscription;
import com.p14n.pubsub.grpc.SubscriberGrpc;

import io.grpc.Context;
import io.grpc.stub.StreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.pubsub.remote.GrpcResponses.respond;

/**
 * Serves the Subscriber service from a {@link PubsubBroker}.
 *
 * <p>
 * Pull runs on the calling gRPC thread and may wait for messages. When the
 * client cancels or its deadline passes, the call's context is cancelled and
 * the waiting pull ends with CANCELLED.
 * </p>
 *
 * <pre>{@code
 * Server grpcServer = ServerBuilder.forPort(8085)
 *     .addService(new SubscriberGrpcServer(broker))
 *     .addService(new PublisherGrpcServer(broker))
 *     .build();
 * grpcServer.start();
 * }</pre>
 */
public class SubscriberGrpcServer extends SubscriberGrpc.SubscriberImplBase {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberGrpcServer.class);

    private final PubsubBroker broker;

    public SubscriberGrpcServer(PubsubBroker broker) {
        this.broker = broker;
    }

    @Override
    public void createSubscription(Subscription request, StreamObserver<Subscription> responseObserver) {
        respond(responseObserver, "CreateSubscription", () -> GrpcConverter.toGrpc(broker.createSubscription(
                request.getName(),
                request.getTopic(),
                GrpcConverter.toPushConfig(request.hasPushConfig(), request.getPushConfig()),
                request.getAckDeadlineSeconds())));
    }

    @Override
    public void getSubscription(GetSubscriptionRequest request, StreamObserver<Subscription> responseObserver) {
        respond(responseObserver, "GetSubscription",
                () -> GrpcConverter.toGrpc(broker.getSubscription(request.getSubscription())));
    }

    @Override
    public void listSubscriptions(ListSubscriptionsRequest request,
            StreamObserver<ListSubscriptionsResponse> responseObserver) {
        respond(responseObserver, "ListSubscriptions", () -> {
            var page = broker.listSubscriptions(request.getProject(), request.getPageSize(),
                    request.getPageToken());
            var builder = ListSubscriptionsResponse.newBuilder()
                    .setNextPageToken(page.nextPageToken());
            for (var info : page.items()) {
                builder.addSubscriptions(GrpcConverter.toGrpc(info));
            }
            return builder.build();
        });
    }

    @Override
    public void deleteSubscription(DeleteSubscriptionRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, "DeleteSubscription", () -> {
            broker.deleteSubscription(request.getSubscription());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void modifyAckDeadline(ModifyAckDeadlineRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, "ModifyAckDeadline", () -> {
            broker.modifyAckDeadline(request.getSubscription(), request.getAckIdsList(),
                    request.getAckDeadlineSeconds());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void acknowledge(AcknowledgeRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, "Acknowledge", () -> {
            broker.acknowledge(request.getSubscription(), request.getAckIdsList());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void pull(PullRequest request, StreamObserver<PullResponse> responseObserver) {
        var cancellation = new PullCancellation();
        var context = Context.current();
        Context.CancellationListener listener = ctx -> {
            logger.atDebug().log("Pull on {} cancelled by caller", request.getSubscription());
            cancellation.cancel();
        };
        // the call's own executor is busy with this handler, so listen on the context directly
        context.addListener(listener, MoreExecutors.directExecutor());
        try {
            respond(responseObserver, "Pull", () -> {
                var received = broker.pull(request.getSubscription(), request.getMaxMessages(),
                        request.getReturnImmediately(), cancellation);
                var messages = new ArrayList<com.p14n.pubsub.grpc.ReceivedMessage>(received.size());
                for (var r : received) {
                    messages.add(GrpcConverter.toGrpc(r));
                }
                return PullResponse.newBuilder().addAllReceivedMessages(messages).build();
            });
        } finally {
            context.removeListener(listener);
        }
    }

    @Override
    public void modifyPushConfig(ModifyPushConfigRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, "ModifyPushConfig", () -> {
            broker.modifyPushConfig(request.getSubscription(),
                    GrpcConverter.toPushConfig(request.hasPushConfig(), request.getPushConfig()));
            return Empty.getDefaultInstance();
        });
    }
}
