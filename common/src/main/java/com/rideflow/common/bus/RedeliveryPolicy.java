package com.rideflow.common.bus;

import java.time.Duration;

/**
 * Bounded retry for failed deliveries: a failed envelope is delivered again after an
 * exponentially growing delay until {@code maxDeliveries} is reached, then dead-lettered.
 */
public class RedeliveryPolicy {

    private final int maxDeliveries;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public RedeliveryPolicy(int maxDeliveries, Duration initialDelay, Duration maxDelay) {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be at least 1");
        }
        this.maxDeliveries = maxDeliveries;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static RedeliveryPolicy from(EventBusProperties properties) {
        return new RedeliveryPolicy(properties.getMaxDeliveries(),
                properties.getRedeliveryInitialDelay(), properties.getRedeliveryMaxDelay());
    }

    /**
     * @param deliveryAttempt 1-based number of the delivery that just failed
     */
    public boolean shouldDeadLetter(int deliveryAttempt) {
        return deliveryAttempt >= maxDeliveries;
    }

    /**
     * Delay before delivering again after the given attempt failed.
     */
    public Duration delayAfter(int deliveryAttempt) {
        int exponent = Math.max(0, Math.min(deliveryAttempt - 1, 30));
        long millis = initialDelay.toMillis() * (1L << exponent);
        return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }

    public int getMaxDeliveries() {
        return maxDeliveries;
    }
}
