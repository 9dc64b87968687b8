package com.rideflow.common.event;

/**
 * Marker for every event contract that can travel inside an {@link EventEnvelope}.
 */
public interface EventPayload {
}
