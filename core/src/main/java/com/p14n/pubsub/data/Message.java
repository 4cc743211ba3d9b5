package com.p14n.pubsub.data;

import java.time.Instant;
import java.util.Map;

/**
 * Record representing a message published to a topic.
 * Once published a message is immutable; its id is assigned by the broker and
 * is unique within the topic.
 */
public record Message(String id,
                      String topic,
                      byte[] data,
                      Map<String, String> attributes,
                      Instant publishTime) {

    public Message {
        data = data == null ? new byte[0] : data.clone();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Returns a copy of the payload. Changes to the returned array do not
     * affect the message or any other delivery of it.
     *
     * @return The opaque payload
     */
    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * Creates a message as supplied by a publisher, before the broker has
     * assigned its id, topic and publish time.
     *
     * @param data       The opaque payload
     * @param attributes Optional string attributes
     * @return An unpublished message
     */
    public static Message create(byte[] data, Map<String, String> attributes) {
        return new Message(null, null, data, attributes, null);
    }

    /**
     * Returns a copy of this message stamped with its broker-assigned identity.
     * Any id supplied by the publisher is discarded.
     */
    public Message published(String id, String topic, Instant publishTime) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        return new Message(id, topic, data, attributes, publishTime);
    }
}
