package com.rideflow.common.contracts;

import com.rideflow.common.event.DriverEventPayload;
import com.rideflow.common.model.GeoPoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sent by the driver app when a driver goes online or reports a new position while idle.
 */
@Value
@Builder
@Jacksonized
public class DriverAvailableContract implements DriverEventPayload {

    @NotBlank
    String driverId;

    @NotNull
    @Valid
    GeoPoint location;
}
