package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.Trip;

import java.util.Optional;

/**
 * Trip storage. Implementations must be durable and strongly consistent per trip id.
 */
public interface TripRepository {

    Trip saveTrip(Trip trip);

    Optional<Trip> loadTrip(String tripId);
}
