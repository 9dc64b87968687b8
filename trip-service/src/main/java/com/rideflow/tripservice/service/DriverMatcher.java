package com.rideflow.tripservice.service;

import com.rideflow.common.contracts.TripUnmatchedContract;
import com.rideflow.tripservice.config.MatchingProperties;
import com.rideflow.tripservice.model.DriverSnapshot;
import com.rideflow.tripservice.model.Trip;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the best available driver for a trip. Reads only; reservation is the
 * tracker's job.
 *
 * Ranking: pickup distance ascending, rating descending, idle time descending
 * (earliest {@code availableSince} first), driver id ascending. The last key makes
 * the choice deterministic for a given pool. With {@code rideflow.matching.max-pickup-distance-km}
 * set, drivers beyond that radius are left out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DriverMatcher {

    private static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::getDistanceKm)
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.getDriver().getRating()).reversed())
            .thenComparing(c -> c.getDriver().getAvailableSince(), Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(c -> c.getDriver().getDriverId());

    private final MatchingProperties matchingProperties;

    public MatchResult match(Trip trip, List<DriverSnapshot> candidatePool) {
        List<DriverSnapshot> available = candidatePool.stream()
                .filter(DriverSnapshot::isAvailable)
                .filter(driver -> driver.getActiveTripId() == null)
                .filter(driver -> driver.getLocation() != null)
                .toList();

        if (available.isEmpty()) {
            log.info("No available drivers for trip: tripId={}", trip.getId());
            return MatchResult.noMatch(TripUnmatchedContract.REASON_NO_CANDIDATES);
        }

        Double maxDistanceKm = matchingProperties.getMaxPickupDistanceKm();
        List<Candidate> inRange = available.stream()
                .map(driver -> new Candidate(driver, driver.getLocation().distanceKmTo(trip.getOrigin())))
                .filter(candidate -> maxDistanceKm == null || candidate.getDistanceKm() <= maxDistanceKm)
                .sorted(RANKING)
                .toList();

        if (inRange.isEmpty()) {
            log.info("All {} available drivers are beyond {} km of the pickup: tripId={}",
                    available.size(), maxDistanceKm, trip.getId());
            return MatchResult.noMatch(TripUnmatchedContract.REASON_NO_CANDIDATES_IN_RANGE);
        }

        Candidate best = inRange.get(0);
        log.info("Matched driver for trip: tripId={}, driverId={}, distance={} km, candidates={}",
                trip.getId(), best.getDriver().getDriverId(), String.format("%.2f", best.getDistanceKm()), inRange.size());
        return MatchResult.matched(best.getDriver().getDriverId(), best.getDistanceKm());
    }

    @Value
    private static class Candidate {
        DriverSnapshot driver;
        double distanceKm;
    }
}
