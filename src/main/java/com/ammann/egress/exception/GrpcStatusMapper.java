/* (C)2026 */
package com.ammann.egress.exception;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.jboss.logging.Logger;

/**
 * Translates handler errors into gRPC status exceptions for the local IPC surface.
 *
 * <p>{@link EgressException} kinds map onto the closest gRPC code. Status exceptions are passed
 * through untouched. Anything else is logged and returned as {@code INTERNAL}.
 */
public final class GrpcStatusMapper {

    private static final Logger LOG = Logger.getLogger(GrpcStatusMapper.class);

    private GrpcStatusMapper() {}

    public static StatusRuntimeException toStatusException(Throwable failure) {
        if (failure instanceof StatusRuntimeException statusException) {
            return statusException;
        }
        if (failure instanceof EgressException egressException) {
            return toStatus(egressException.getKind())
                    .withDescription(egressException.getMessage())
                    .withCause(egressException)
                    .asRuntimeException();
        }

        LOG.errorf(failure, "Unhandled IPC failure: %s", failure.getClass().getSimpleName());
        return Status.INTERNAL
                .withDescription(failure.getMessage())
                .withCause(failure)
                .asRuntimeException();
    }

    static Status toStatus(EgressException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> Status.NOT_FOUND;
            case DEADLINE_EXCEEDED -> Status.DEADLINE_EXCEEDED;
            case USER -> Status.INVALID_ARGUMENT;
            case UNAVAILABLE -> Status.UNAVAILABLE;
            case FATAL, INTERNAL -> Status.INTERNAL;
        };
    }
}
