package com.p14n.pubsub.push;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers a message to a push endpoint.
 *
 * <p>
 * The returned future completes normally when the endpoint accepted the
 * message and exceptionally when it refused it or could not be reached.
 * Implementations should honour {@link PushRequest#timeout()}; the dispatcher
 * also abandons deliveries that outlive it.
 * </p>
 */
public interface PushClient {

    CompletableFuture<Void> push(PushRequest request);
}
