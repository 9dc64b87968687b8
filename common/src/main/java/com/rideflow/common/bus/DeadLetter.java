package com.rideflow.common.bus;

import lombok.Value;

import java.time.Instant;

/**
 * An envelope removed from normal delivery by {@link InMemoryEventBus}.
 */
@Value
public class DeadLetter {

    String queueName;
    String body;
    String reason;
    int deliveryAttempts;
    Instant deadLetteredAt;
}
