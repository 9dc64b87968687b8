package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sent by the driver app when the ride ends, and re-emitted by trip-service for the
 * payment and notification collaborators once the trip is committed as completed.
 */
@Value
@Builder
@Jacksonized
public class TripCompletedContract implements TripEventPayload {

    @NotBlank
    String tripId;

    // Currency minor units
    @NotNull
    @PositiveOrZero
    Long finalPrice;

    String driverId;

    String riderId;
}
