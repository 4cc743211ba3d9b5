package com.p14n.pubsub.data;

import java.util.HashMap;
import java.util.Map;

/**
 * Push delivery configuration of a subscription. An empty endpoint means the
 * subscription is in pull mode.
 */
public record PushConfig(String endpoint, Map<String, String> attributes) {

    public static final String VERSION_ATTRIBUTE = "x-goog-version";
    public static final String DEFAULT_VERSION = "v1";
    public static final PushConfig PULL = new PushConfig("", Map.of());

    public PushConfig {
        endpoint = endpoint == null ? "" : endpoint;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public boolean isPull() {
        return endpoint.isEmpty();
    }

    public String version() {
        return attributes.getOrDefault(VERSION_ATTRIBUTE, DEFAULT_VERSION);
    }

    /**
     * Fills in the endpoint version when it is absent, taking it from the
     * previous configuration if there was one, else the default.
     *
     * @param previous The configuration being replaced, may be null
     * @return This configuration with a version attribute, or {@link #PULL}
     */
    public PushConfig withVersionFrom(PushConfig previous) {
        if (isPull()) {
            return PULL;
        }
        if (attributes.containsKey(VERSION_ATTRIBUTE)) {
            return this;
        }
        var withVersion = new HashMap<>(attributes);
        withVersion.put(VERSION_ATTRIBUTE,
                previous == null || previous.isPull() ? DEFAULT_VERSION : previous.version());
        return new PushConfig(endpoint, withVersion);
    }
}
