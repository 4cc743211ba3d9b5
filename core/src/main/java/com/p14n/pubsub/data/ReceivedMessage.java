package com.p14n.pubsub.data;

/**
 * A message handed to a consumer together with the ack id that identifies this
 * delivery attempt.
 *
 * @param ackId           Single-use acknowledgment token
 * @param message         The delivered message
 * @param deliveryAttempt Number of earlier delivery attempts of this message on
 *                        the subscription (0 on first delivery)
 */
public record ReceivedMessage(String ackId, Message message, int deliveryAttempt) {
}
