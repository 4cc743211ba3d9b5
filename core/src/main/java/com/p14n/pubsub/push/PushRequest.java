package com.p14n.pubsub.push;

import java.time.Duration;

import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;

/**
 * One push delivery: the leased message, the subscription it came from and
 * the endpoint configuration in force when it was leased.
 */
public record PushRequest(String subscription,
                          PushConfig config,
                          ReceivedMessage received,
                          Duration timeout) {

    public String endpoint() {
        return config.endpoint();
    }
}
