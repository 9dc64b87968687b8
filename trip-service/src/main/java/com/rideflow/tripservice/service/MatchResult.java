package com.rideflow.tripservice.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one matching run: either a driver with its pickup distance or the reason
 * nobody qualified.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchResult {

    boolean matched;
    String driverId;
    double distanceKm;
    String reason;

    public static MatchResult matched(String driverId, double distanceKm) {
        return new MatchResult(true, driverId, distanceKm, null);
    }

    public static MatchResult noMatch(String reason) {
        return new MatchResult(false, null, 0.0, reason);
    }
}
