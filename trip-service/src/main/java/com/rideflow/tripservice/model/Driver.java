package com.rideflow.tripservice.model;

import com.rideflow.common.model.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Driver as seen by trip-service. {@code available} is false whenever
 * {@code activeTripId} is set.
 */
@Getter
@Setter
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Driver {

    private String id;

    private String name;

    private GeoPoint location;

    private boolean available;

    private double rating;

    private String activeTripId;

    // When the driver last became available; earlier means idle longer
    private Instant availableSince;

    private Instant updatedAt;

    public Driver copy() {
        return toBuilder().build();
    }
}
