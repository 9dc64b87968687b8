package com.rideflow.tripservice.model;

import com.rideflow.common.model.GeoPoint;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a driver handed to the matcher.
 */
@Value
@Builder(toBuilder = true)
public class DriverSnapshot {

    String driverId;
    String name;
    GeoPoint location;
    boolean available;
    double rating;
    String activeTripId;
    Instant availableSince;

    public static DriverSnapshot from(Driver driver) {
        return DriverSnapshot.builder()
                .driverId(driver.getId())
                .name(driver.getName())
                .location(driver.getLocation())
                .available(driver.isAvailable())
                .rating(driver.getRating())
                .activeTripId(driver.getActiveTripId())
                .availableSince(driver.getAvailableSince())
                .build();
    }
}
