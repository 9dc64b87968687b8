package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Event contract sent by trip-service when a driver has been committed to a trip.
 */
@Value
@Builder
@Jacksonized
public class TripAssignedContract implements TripEventPayload {

    @NotBlank
    String tripId;

    @NotBlank
    String driverId;

    String riderId; // For rider notification
}
