package com.rideflow.tripservice.service;

import com.rideflow.common.model.GeoPoint;
import com.rideflow.tripservice.config.MatchingProperties;
import com.rideflow.tripservice.exception.DriverNoLongerAvailableException;
import com.rideflow.tripservice.model.Driver;
import com.rideflow.tripservice.model.DriverSnapshot;
import com.rideflow.tripservice.repository.DriverRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single writer of driver availability.
 *
 * Every change goes through {@link ConcurrentHashMap#compute} on the driver id, which
 * makes the read-check-write of a reservation atomic per driver: of two trips racing
 * for the same driver exactly one wins. Stored drivers are replaced, never mutated, so
 * {@link #snapshot()} can read them without locking. Each change is written through to
 * the {@link DriverRepository}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriverAvailabilityTracker {

    private final DriverRepository driverRepository;
    private final MatchingProperties matchingProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, Driver> drivers = new ConcurrentHashMap<>();

    @PostConstruct
    void loadDrivers() {
        driverRepository.findAll().forEach(driver -> drivers.put(driver.getId(), driver));
        log.info("Loaded {} drivers from storage", drivers.size());
    }

    public void register(String driverId, String name, double rating) {
        drivers.compute(driverId, (id, current) -> {
            Instant now = clock.instant();
            Driver updated = current != null
                    ? current.copy()
                    : Driver.builder().id(id).available(false).build();
            updated.setName(name);
            updated.setRating(rating);
            updated.setUpdatedAt(now);
            return driverRepository.saveDriver(updated);
        });
        log.info("Driver registered: driverId={}, rating={}", driverId, rating);
    }

    /**
     * @return false if the driver is on a trip; availability is then left unchanged
     */
    public boolean markAvailable(String driverId, GeoPoint location) {
        AtomicBoolean accepted = new AtomicBoolean(true);
        drivers.compute(driverId, (id, current) -> {
            Instant now = clock.instant();
            if (current != null && current.getActiveTripId() != null) {
                accepted.set(false);
                return current;
            }
            Driver updated;
            if (current == null) {
                log.info("Unknown driver announced availability, registering with default rating: driverId={}", id);
                updated = Driver.builder()
                        .id(id)
                        .name(id)
                        .rating(matchingProperties.getDefaultRating())
                        .build();
            } else {
                updated = current.copy();
            }
            if (!updated.isAvailable()) {
                updated.setAvailable(true);
                updated.setAvailableSince(now);
            }
            updated.setLocation(location);
            updated.setUpdatedAt(now);
            return driverRepository.saveDriver(updated);
        });

        if (!accepted.get()) {
            log.warn("Refusing availability for driver on an active trip: driverId={}", driverId);
        }
        return accepted.get();
    }

    /**
     * @return false if the driver is unknown
     */
    public boolean markUnavailable(String driverId) {
        AtomicBoolean known = new AtomicBoolean(false);
        drivers.computeIfPresent(driverId, (id, current) -> {
            known.set(true);
            if (!current.isAvailable()) {
                return current;
            }
            Driver updated = current.copy();
            updated.setAvailable(false);
            updated.setAvailableSince(null);
            updated.setUpdatedAt(clock.instant());
            return driverRepository.saveDriver(updated);
        });

        if (!known.get()) {
            log.warn("Ignoring unavailability of unknown driver: driverId={}", driverId);
        }
        return known.get();
    }

    /**
     * Immutable view of the drivers currently available.
     */
    public List<DriverSnapshot> snapshot() {
        return drivers.values().stream()
                .filter(Driver::isAvailable)
                .map(DriverSnapshot::from)
                .toList();
    }

    public Optional<DriverSnapshot> findDriver(String driverId) {
        return Optional.ofNullable(drivers.get(driverId)).map(DriverSnapshot::from);
    }

    /**
     * Claims the driver for a trip: sets the active trip and clears availability.
     *
     * @throws DriverNoLongerAvailableException if the driver is unknown, unavailable or
     *         already on a trip
     */
    public void reserve(String driverId, String tripId) {
        drivers.compute(driverId, (id, current) -> {
            if (current == null || !current.isAvailable() || current.getActiveTripId() != null) {
                throw new DriverNoLongerAvailableException(id,
                        String.format("Driver %s can no longer take trip %s", id, tripId));
            }
            Driver updated = current.copy();
            updated.setAvailable(false);
            updated.setActiveTripId(tripId);
            updated.setAvailableSince(null);
            updated.setUpdatedAt(clock.instant());
            return driverRepository.saveDriver(updated);
        });
        log.info("Driver reserved: driverId={}, tripId={}", driverId, tripId);
    }

    /**
     * Ends the driver's trip and makes the driver available again.
     *
     * @return false if the driver is not on that trip; nothing changes then
     */
    public boolean release(String driverId, String tripId) {
        AtomicBoolean released = new AtomicBoolean(false);
        drivers.computeIfPresent(driverId, (id, current) -> {
            if (!tripId.equals(current.getActiveTripId())) {
                return current;
            }
            Instant now = clock.instant();
            Driver updated = current.copy();
            updated.setActiveTripId(null);
            updated.setAvailable(true);
            updated.setAvailableSince(now);
            updated.setUpdatedAt(now);
            released.set(true);
            return driverRepository.saveDriver(updated);
        });

        if (released.get()) {
            log.info("Driver released: driverId={}, tripId={}", driverId, tripId);
        } else {
            log.warn("Driver not on trip, nothing to release: driverId={}, tripId={}", driverId, tripId);
        }
        return released.get();
    }
}
