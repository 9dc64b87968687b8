package com.rideflow.common.bus;

/**
 * Exception thrown by {@link HandlerInvoker} when a handler throws or overruns its deadline.
 */
public class HandlerFailedException extends RuntimeException {

    public HandlerFailedException(String message) {
        super(message);
    }

    public HandlerFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
