/* (C)2026 */
package com.ammann.egress.exception;

/**
 * Unchecked exception for every error raised by the egress handler.
 *
 * <p>Each instance carries a {@link Kind} fixed at creation time. Handling sites decide what to
 * do (report, map to a transport status, propagate) by switching on the kind, never by
 * inspecting messages or cause types. Use the factory methods rather than the constructor.
 */
public class EgressException extends RuntimeException {

    /**
     * Error classification together with the failure code used on the message bus.
     */
    public enum Kind {
        /** Infrastructure or configuration fault. Never reported to the status service. */
        FATAL(500),
        /** The request itself is invalid. Reported to the status service as a failed egress. */
        USER(400),
        /** No egress is available to serve the call. */
        NOT_FOUND(404),
        /** A bounded operation did not finish in time. */
        DEADLINE_EXCEEDED(504),
        /** A collaborator could not be reached. */
        UNAVAILABLE(503),
        /** Unexpected failure during normal operation. */
        INTERNAL(500);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    private final Kind kind;

    protected EgressException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    public static EgressException fatal(String message, Throwable cause) {
        return new EgressException(Kind.FATAL, message, cause);
    }

    public static EgressException user(String message) {
        return new EgressException(Kind.USER, message, null);
    }

    public static EgressException user(String message, Throwable cause) {
        return new EgressException(Kind.USER, message, cause);
    }

    /**
     * Creates the error returned by every call that arrives while no egress exists.
     */
    public static EgressException egressNotFound() {
        return new EgressException(Kind.NOT_FOUND, "egress not found", null);
    }

    public static EgressException notFound(String message) {
        return new EgressException(Kind.NOT_FOUND, message, null);
    }

    public static EgressException deadlineExceeded(String message) {
        return new EgressException(Kind.DEADLINE_EXCEEDED, message, null);
    }

    public static EgressException unavailable(String message, Throwable cause) {
        return new EgressException(Kind.UNAVAILABLE, message, cause);
    }

    public static EgressException internal(String message, Throwable cause) {
        return new EgressException(Kind.INTERNAL, message, cause);
    }
}
