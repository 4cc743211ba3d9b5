package com.p14n.pubsub.push;

/**
 * Raised when a push endpoint refuses a message.
 */
public class PushDeliveryException extends RuntimeException {

    private final int statusCode;

    public PushDeliveryException(String endpoint, int statusCode) {
        super("Push endpoint " + endpoint + " responded with status " + statusCode);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
