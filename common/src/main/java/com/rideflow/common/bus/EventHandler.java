package com.rideflow.common.bus;

import com.rideflow.common.event.EventEnvelope;

/**
 * Callback invoked once per delivered, validated envelope.
 * Returning normally acknowledges the envelope; throwing triggers the redelivery policy.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope envelope) throws Exception;
}
