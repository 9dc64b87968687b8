package com.rideflow.common.schema;

/**
 * Exception thrown when an event name has no registered schema.
 */
public class UnknownEventKindException extends SchemaException {

    public UnknownEventKindException(String eventName) {
        super(eventName, "Unknown event kind: " + eventName);
    }
}
