package com.rideflow.common.contracts;

public enum CancellationInitiator {
    RIDER,
    DRIVER,
    OPS,
    SYSTEM   // Platform-initiated, e.g. fraud or timeout
}
