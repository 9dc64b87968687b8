package com.rideflow.common.contracts;

import com.rideflow.common.event.TripEventPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PaymentChargedContract implements TripEventPayload {

    @NotBlank
    String tripId;

    @NotBlank
    String paymentId;

    @NotNull
    @PositiveOrZero
    Long amount;
}
