package com.rideflow.tripservice.exception;

import com.rideflow.tripservice.model.TripStatus;

/**
 * Exception thrown when an event asks for a trip transition outside the state graph.
 * For example: a pricing quote for a trip that is still REQUESTED.
 * The envelope is acknowledged and dropped as a protocol violation.
 */
public class InvalidTripStateException extends RuntimeException {

    public InvalidTripStateException(String message) {
        super(message);
    }

    public InvalidTripStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidTripStateException of(String tripId, TripStatus from, TripStatus to) {
        return new InvalidTripStateException(
                String.format("Trip %s cannot move from %s to %s", tripId, from, to));
    }
}
