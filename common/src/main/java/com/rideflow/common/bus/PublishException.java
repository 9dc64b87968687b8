package com.rideflow.common.bus;

import com.rideflow.common.event.EventKind;

/**
 * Exception thrown when an envelope could not be handed to the broker.
 * TIMEOUT and CONNECTION_LOST may be retried by the caller with back-off;
 * SCHEMA_INVALID never succeeds on retry.
 * The bus itself never resends.
 */
public class PublishException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        CONNECTION_LOST,
        SCHEMA_INVALID
    }

    private final Reason reason;
    private final EventKind kind;

    public PublishException(Reason reason, EventKind kind, String message) {
        super(message);
        this.reason = reason;
        this.kind = kind;
    }

    public PublishException(Reason reason, EventKind kind, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.kind = kind;
    }

    public static PublishException timeout(EventKind kind, long timeoutMillis) {
        return new PublishException(Reason.TIMEOUT, kind,
                String.format("No broker confirm for %s within %d ms", kind, timeoutMillis));
    }

    public static PublishException connectionLost(EventKind kind, String detail, Throwable cause) {
        return new PublishException(Reason.CONNECTION_LOST, kind,
                String.format("Connection lost while publishing %s: %s", kind, detail), cause);
    }

    public static PublishException schemaInvalid(EventKind kind, Throwable cause) {
        return new PublishException(Reason.SCHEMA_INVALID, kind,
                String.format("Refusing to publish invalid %s: %s", kind, cause.getMessage()), cause);
    }

    public Reason getReason() {
        return reason;
    }

    public EventKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return reason != Reason.SCHEMA_INVALID;
    }
}
