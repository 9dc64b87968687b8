package com.rideflow.common.contracts;

import com.rideflow.common.event.DriverEventPayload;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DriverRegisteredContract implements DriverEventPayload {

    @NotBlank
    String driverId;

    @NotBlank
    String name;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("5.0")
    Double rating;
}
