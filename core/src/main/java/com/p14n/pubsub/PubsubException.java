package com.p14n.pubsub;

/**
 * Raised by broker operations that fail with one of the error conditions of
 * the publish/subscribe contract. The {@link ErrorCode} tells the transport
 * layer which status to report.
 */
public class PubsubException extends RuntimeException {

    public enum ErrorCode {
        ALREADY_EXISTS,
        NOT_FOUND,
        INVALID_ARGUMENT,
        UNAVAILABLE,
        CANCELLED
    }

    private final ErrorCode code;

    public PubsubException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PubsubException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static PubsubException notFound(String what, String name) {
        return new PubsubException(ErrorCode.NOT_FOUND, what + " not found: " + name);
    }

    public static PubsubException alreadyExists(String what, String name) {
        return new PubsubException(ErrorCode.ALREADY_EXISTS, what + " already exists: " + name);
    }

    public static PubsubException invalidArgument(String message) {
        return new PubsubException(ErrorCode.INVALID_ARGUMENT, message);
    }
}
