package com.rideflow.tripservice.model;

import com.rideflow.common.model.GeoPoint;
import com.rideflow.tripservice.exception.InvalidTripStateException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Trip {

    private String id;

    private String riderId;

    private GeoPoint origin;

    private GeoPoint destination;

    @Setter(AccessLevel.NONE)
    private TripStatus status;

    private String driverId;

    // Prices in currency minor units
    private Long quotedPrice;

    private String currency;

    private Long finalPrice;

    // Adopted from the trip.requested envelope
    private String correlationId;

    private Instant createdAt;

    @Setter(AccessLevel.NONE)
    private Instant updatedAt;

    /**
     * Moves the trip along one edge of the state graph.
     *
     * @throws InvalidTripStateException if the edge does not exist; status is left unchanged
     */
    public void transitionTo(TripStatus target, Instant now) {
        if (status == null || !status.canTransitionTo(target)) {
            throw InvalidTripStateException.of(id, status, target);
        }
        status = target;
        touch(now);
    }

    public void touch(Instant now) {
        if (updatedAt == null || now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }

    public Trip copy() {
        return toBuilder().build();
    }
}
