package com.rideflow.common.event;

/**
 * Payload of an event that changes what is known about one driver.
 */
public interface DriverEventPayload extends EventPayload {

    String getDriverId();
}
