package com.rideflow.common.bus;

import com.rideflow.common.event.EventKind;

public interface Subscription {

    EventKind getKind();

    String getQueueName();

    /**
     * Stops delivery to the handler. Envelopes already in flight finish first.
     */
    void cancel();
}
