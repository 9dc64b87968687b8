package com.rideflow.common.contracts;

import com.rideflow.common.event.DriverEventPayload;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DriverUnavailableContract implements DriverEventPayload {

    @NotBlank
    String driverId;
}
