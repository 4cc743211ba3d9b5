package com.p14n.pubsub.vertx;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.p14n.pubsub.push.PushClient;
import com.p14n.pubsub.push.PushDeliveryException;
import com.p14n.pubsub.push.PushRequest;
import com.p14n.pubsub.vertx.codec.PushEnvelope;

import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers push messages as HTTP POSTs using the Vert.x web client.
 *
 * <p>
 * The endpoint accepts a message by answering 200, 201, 202, 204 or 102. Any
 * other status, a connection failure or a request outliving the
 * subscription's ack deadline counts as a failed delivery.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * try (var pushClient = new VertxPushClient(Vertx.vertx())) {
 *     var server = new PubsubServer(new BrokerConfig(), pushClient, OpenTelemetry.noop());
 *     server.start(8085);
 * }
 * }</pre>
 */
public class VertxPushClient implements PushClient, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VertxPushClient.class);
    private static final Set<Integer> ACCEPTED = Set.of(102, 200, 201, 202, 204);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final WebClient client;

    /**
     * Creates a client on its own Vert.x instance, closed with the client.
     */
    public VertxPushClient() {
        this(Vertx.vertx(), true);
    }

    /**
     * Creates a client on a shared Vert.x instance, left open on close.
     *
     * @param vertx The Vert.x instance to run requests on
     */
    public VertxPushClient(Vertx vertx) {
        this(vertx, false);
    }

    private VertxPushClient(Vertx vertx, boolean ownsVertx) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.client = WebClient.create(vertx, new WebClientOptions()
                .setUserAgent("pubsub-push")
                .setKeepAlive(true));
    }

    @Override
    public CompletableFuture<Void> push(PushRequest request) {
        var endpoint = request.endpoint();
        var body = PushEnvelope.encode(request.subscription(), request.received().message());
        logger.atDebug()
                .addArgument(request.received().message().id())
                .addArgument(endpoint)
                .log("Pushing message {} to {}");

        return client.postAbs(endpoint)
                .timeout(request.timeout().toMillis())
                .sendJsonObject(body)
                .toCompletionStage()
                .toCompletableFuture()
                .thenAccept(response -> {
                    if (!ACCEPTED.contains(response.statusCode())) {
                        throw new PushDeliveryException(endpoint, response.statusCode());
                    }
                });
    }

    @Override
    public void close() {
        client.close();
        if (ownsVertx) {
            vertx.close();
        }
        logger.atInfo().log("Push client closed");
    }
}
