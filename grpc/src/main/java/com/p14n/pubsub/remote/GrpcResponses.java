package com.p14n.pubsub.remote;

import java.util.function.Supplier;

import com.p14n.pubsub.PubsubException;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes unary calls and turns broker failures into gRPC statuses.
 */
final class GrpcResponses {
    private static final Logger logger = LoggerFactory.getLogger(GrpcResponses.class);

    private GrpcResponses() {
    }

    /**
     * Runs the action and sends its result, or the matching error status,
     * to the caller.
     *
     * @param observer  The call's response observer
     * @param operation The RPC name, for logging
     * @param action    Produces the response
     */
    static <T> void respond(StreamObserver<T> observer, String operation, Supplier<T> action) {
        T response;
        try {
            response = action.get();
        } catch (PubsubException e) {
            logger.atDebug()
                    .addArgument(operation)
                    .addArgument(e.code())
                    .addArgument(e.getMessage())
                    .log("{} failed with {}: {}");
            observer.onError(toStatus(e).asRuntimeException());
            return;
        } catch (Exception e) {
            logger.atError()
                    .addArgument(operation)
                    .setCause(e)
                    .log("{} failed");
            observer.onError(Status.INTERNAL
                    .withDescription(operation + " failed")
                    .withCause(e)
                    .asRuntimeException());
            return;
        }
        observer.onNext(response);
        observer.onCompleted();
    }

    static Status toStatus(PubsubException e) {
        Status status = switch (e.code()) {
            case ALREADY_EXISTS -> Status.ALREADY_EXISTS;
            case NOT_FOUND -> Status.NOT_FOUND;
            case INVALID_ARGUMENT -> Status.INVALID_ARGUMENT;
            case UNAVAILABLE -> Status.UNAVAILABLE;
            case CANCELLED -> Status.CANCELLED;
        };
        return status.withDescription(e.getMessage());
    }

    /**
     * Turns a status received by a client back into the broker failure it
     * stands for. Statuses with no broker counterpart are returned unchanged.
     */
    static RuntimeException fromStatus(StatusRuntimeException e) {
        var description = e.getStatus().getDescription();
        var message = description == null ? e.getStatus().getCode().name() : description;
        return switch (e.getStatus().getCode()) {
            case ALREADY_EXISTS -> new PubsubException(PubsubException.ErrorCode.ALREADY_EXISTS, message, e);
            case NOT_FOUND -> new PubsubException(PubsubException.ErrorCode.NOT_FOUND, message, e);
            case INVALID_ARGUMENT -> new PubsubException(PubsubException.ErrorCode.INVALID_ARGUMENT, message, e);
            case UNAVAILABLE -> new PubsubException(PubsubException.ErrorCode.UNAVAILABLE, message, e);
            case CANCELLED -> new PubsubException(PubsubException.ErrorCode.CANCELLED, message, e);
            default -> e;
        };
    }
}
