package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Event contract sent by trip-service when no driver could be matched.
 * The trip is terminal; the rider-facing collaborator decides whether to ask again.
 */
@Value
@Builder
@Jacksonized
public class TripUnmatchedContract implements TripEventPayload {

    public static final String REASON_NO_CANDIDATES = "no_candidates";
    public static final String REASON_NO_CANDIDATES_IN_RANGE = "no_candidates_in_range";
    public static final String REASON_DRIVER_UNAVAILABLE = "driver_unavailable";

    @NotBlank
    String tripId;

    @NotBlank
    String reason;

    String riderId;
}
