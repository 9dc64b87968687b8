package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Event contract sent by trip-service once a cancellation is committed.
 * driverId is set when a driver had already been assigned and was released.
 */
@Value
@Builder
@Jacksonized
public class TripCancelledContract implements TripEventPayload {

    @NotBlank
    String tripId;

    @NotNull
    CancellationInitiator initiator;

    String riderId;

    String driverId;
}
