package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.Trip;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores copies so callers never share a mutable trip with the store.
 */
@Repository
public class InMemoryTripRepository implements TripRepository {

    private final Map<String, Trip> trips = new ConcurrentHashMap<>();

    @Override
    public Trip saveTrip(Trip trip) {
        trips.put(trip.getId(), trip.copy());
        return trip;
    }

    @Override
    public Optional<Trip> loadTrip(String tripId) {
        return Optional.ofNullable(trips.get(tripId)).map(Trip::copy);
    }
}
