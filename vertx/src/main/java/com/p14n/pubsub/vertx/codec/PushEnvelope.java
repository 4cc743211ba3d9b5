package com.p14n.pubsub.vertx.codec;

import java.util.Base64;

import com.p14n.pubsub.data.Message;

import io.vertx.core.json.JsonObject;

/**
 * JSON body of a push delivery.
 *
 * <p>
 * Format:
 * </p>
 *
 * <pre>{@code
 * {
 *   "message": {
 *     "data": "<standard base64 of the payload>",
 *     "attributes": { "k": "v" },
 *     "message_id": "42", "messageId": "42",
 *     "publish_time": "2024-01-01T00:00:00Z", "publishTime": "2024-01-01T00:00:00Z"
 *   },
 *   "subscription": "projects/p/subscriptions/s"
 * }
 * }</pre>
 *
 * Ids and publish times are written under both spellings since endpoints
 * written against either naming convention exist.
 */
public final class PushEnvelope {

    private PushEnvelope() {
    }

    public static JsonObject encode(String subscription, Message message) {
        var attributes = new JsonObject();
        message.attributes().forEach(attributes::put);

        var body = new JsonObject()
                .put("data", Base64.getEncoder().encodeToString(message.data()))
                .put("attributes", attributes)
                .put("message_id", message.id())
                .put("messageId", message.id());
        if (message.publishTime() != null) {
            var publishTime = message.publishTime().toString();
            body.put("publish_time", publishTime).put("publishTime", publishTime);
        }
        return new JsonObject()
                .put("message", body)
                .put("subscription", subscription);
    }
}
