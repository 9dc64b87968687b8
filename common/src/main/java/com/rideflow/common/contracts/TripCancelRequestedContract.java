package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TripCancelRequestedContract implements TripEventPayload {

    @NotBlank
    String tripId;

    @NotNull
    CancellationInitiator initiator;
}
