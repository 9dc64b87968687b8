package com.rideflow.common.event;

/**
 * Payload of an event that belongs to a single trip's event chain.
 */
public interface TripEventPayload extends EventPayload {

    String getTripId();
}
