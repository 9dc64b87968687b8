package com.rideflow.common.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A WGS84 coordinate pair used for trip origins, destinations and driver positions.
 */
@Value
@Builder
@Jacksonized
public class GeoPoint {

    private static final double EARTH_RADIUS_KM = 6371.0;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    Double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Great-circle distance using the Haversine formula.
     *
     * @return distance in kilometers
     */
    public double distanceKmTo(GeoPoint other) {
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLon = Math.toRadians(other.longitude - longitude);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }
}
