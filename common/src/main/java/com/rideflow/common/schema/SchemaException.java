package com.rideflow.common.schema;

/**
 * Exception thrown when an envelope or payload does not match the schema registered
 * for its event name. Malformed envelopes are dropped, never handed to business logic.
 */
public class SchemaException extends RuntimeException {

    private final String eventName;

    public SchemaException(String eventName, String message) {
        super(message);
        this.eventName = eventName;
    }

    public SchemaException(String eventName, String message, Throwable cause) {
        super(message, cause);
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
