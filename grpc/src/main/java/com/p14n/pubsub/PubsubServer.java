package com.p14n.pubsub;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.p14n.pubsub.broker.AsyncExecutor;
import com.p14n.pubsub.broker.DefaultExecutor;
import com.p14n.pubsub.broker.DefaultPubsubBroker;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.push.PushClient;
import com.p14n.pubsub.remote.PublisherGrpcServer;
import com.p14n.pubsub.remote.SubscriberGrpcServer;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts the Publisher and Subscriber gRPC services over one in-memory broker.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var server = new PubsubServer(new BrokerConfig(), pushClient, OpenTelemetry.noop());
 * server.start(8085);
 * }</pre>
 */
public class PubsubServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubsubServer.class);

    private final PubsubConfig cfg;
    private final PushClient pushClient;
    private final AsyncExecutor asyncExecutor;
    private final OpenTelemetry ot;
    private List<AutoCloseable> closeables = List.of();
    private DefaultPubsubBroker broker;
    private Server server;

    public PubsubServer(PubsubConfig cfg, PushClient pushClient, OpenTelemetry ot) {
        this(cfg, pushClient, new DefaultExecutor(cfg.schedulerThreads()), ot);
    }

    public PubsubServer(PubsubConfig cfg, PushClient pushClient, AsyncExecutor asyncExecutor, OpenTelemetry ot) {
        this.cfg = cfg;
        this.pushClient = pushClient;
        this.asyncExecutor = asyncExecutor;
        this.ot = ot;
    }

    /**
     * Starts the broker and serves it on the given port.
     *
     * @param port The port number to listen on
     * @throws IOException If the server fails to bind
     */
    public void start(int port) throws IOException {
        start(ServerBuilder.forPort(port)
                .permitKeepAliveTime(1, TimeUnit.HOURS)
                .permitKeepAliveWithoutCalls(true));
    }

    /**
     * Starts the broker and serves it through a caller-configured builder.
     *
     * @param sb The server builder to add the services to
     * @throws IOException If the server fails to start
     */
    public void start(ServerBuilder<?> sb) throws IOException {
        logger.atInfo().log("Starting pubsub server");

        var mb = new DefaultPubsubBroker(cfg, asyncExecutor, pushClient, ot, Clock.systemUTC());
        try {
            mb.start();
            server = sb.addService(new PublisherGrpcServer(mb))
                    .addService(new SubscriberGrpcServer(mb))
                    .build()
                    .start();

            logger.atInfo().log("Pubsub server started successfully");
        } catch (IOException | RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start pubsub server");
            mb.close();
            throw e;
        }

        broker = mb;
        closeables = List.of(mb, asyncExecutor);
    }

    /**
     * @return The broker behind the services, null before {@link #start}
     */
    public DefaultPubsubBroker broker() {
        return broker;
    }

    public int port() {
        return server == null ? -1 : server.getPort();
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * Stops accepting calls, cancels those in progress and releases the broker.
     */
    public void stop() {
        logger.atInfo().log("Stopping pubsub server");

        if (server != null) {
            server.shutdownNow();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (var c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
        closeables = List.of();

        logger.atInfo().log("Pubsub server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
