package com.p14n.pubsub;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import com.p14n.pubsub.data.BrokerConfig;
import com.p14n.pubsub.vertx.VertxPushClient;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a standalone broker serving the Publisher and Subscriber services.
 *
 * <p>
 * Configured from the environment:
 * </p>
 * <ul>
 * <li>APP_PORT - gRPC listen port, default 8085</li>
 * <li>APP_MAX_CONCURRENT_PULLS - outstanding pulls per subscription</li>
 * <li>APP_MAX_PULL_WAIT_MS - longest wait of a blocking pull</li>
 * <li>APP_SWEEP_INTERVAL_MS - lease expiry sweep interval</li>
 * <li>APP_PUSH_BATCH_SIZE - messages leased per push cycle</li>
 * <li>APP_OTLP_ENDPOINT - span collector; telemetry is off when unset</li>
 * </ul>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int DEFAULT_PORT = 8085;

    record Settings(int port, BrokerConfig broker, String otlpEndpoint) {
    }

    static Settings settingsFrom(Map<String, String> env) {
        var broker = new BrokerConfig(
                intVal(env, "APP_MAX_CONCURRENT_PULLS", BrokerConfig.DEFAULT_MAX_CONCURRENT_PULLS),
                millisVal(env, "APP_MAX_PULL_WAIT_MS", BrokerConfig.DEFAULT_MAX_PULL_WAIT),
                millisVal(env, "APP_SWEEP_INTERVAL_MS", BrokerConfig.DEFAULT_SWEEP_INTERVAL),
                intVal(env, "APP_PUSH_BATCH_SIZE", BrokerConfig.DEFAULT_PUSH_BATCH_SIZE));
        var otlp = env.get("APP_OTLP_ENDPOINT");
        return new Settings(intVal(env, "APP_PORT", DEFAULT_PORT), broker,
                otlp == null || otlp.isBlank() ? null : otlp.trim());
    }

    private static int intVal(Map<String, String> env, String name, int defaultValue) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, was " + value, e);
        }
    }

    private static Duration millisVal(Map<String, String> env, String name, Duration defaultValue) {
        var value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : Duration.ofMillis(intVal(env, name, 0));
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        var settings = settingsFrom(System.getenv());
        OpenTelemetry ot = settings.otlpEndpoint() == null ? OpenTelemetry.noop()
                : Opentelemetry.create("pubsub", settings.otlpEndpoint());

        var pushClient = new VertxPushClient();
        var server = new PubsubServer(settings.broker(), pushClient, ot);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            pushClient.close();
        }, "pubsub-shutdown"));

        server.start(settings.port());
        logger.atInfo()
                .addArgument(settings.port())
                .addArgument(settings.broker())
                .log("Pub/Sub broker listening on {} with {}");
        server.blockUntilShutdown();
    }
}
