package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import com.rideflow.common.model.GeoPoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Event contract sent by the request collaborator when a rider asks for a trip.
 * Starts the trip's event chain; its envelope's correlationId is reused for every
 * later event of the trip.
 */
@Value
@Builder
@Jacksonized
public class TripRequestedContract implements TripEventPayload {

    @NotBlank
    String tripId;

    @NotBlank
    String riderId;

    @NotNull
    @Valid
    GeoPoint origin;

    @NotNull
    @Valid
    GeoPoint destination;
}
