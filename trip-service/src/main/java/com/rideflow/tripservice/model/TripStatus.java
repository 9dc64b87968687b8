package com.rideflow.tripservice.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trip lifecycle. Status only moves forward along these edges:
 * <pre>
 * REQUESTED -> MATCHING -> ASSIGNED -> PRICED -> IN_PROGRESS -> COMPLETED
 * MATCHING -> UNMATCHED
 * REQUESTED | MATCHING | ASSIGNED | PRICED -> CANCELLED
 * </pre>
 */
public enum TripStatus {
    REQUESTED,
    MATCHING,
    ASSIGNED,
    PRICED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    UNMATCHED;

    public Set<TripStatus> allowedTargets() {
        return switch (this) {
            case REQUESTED -> EnumSet.of(MATCHING, CANCELLED);
            case MATCHING -> EnumSet.of(ASSIGNED, UNMATCHED, CANCELLED);
            case ASSIGNED -> EnumSet.of(PRICED, CANCELLED);
            case PRICED -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED, UNMATCHED -> EnumSet.noneOf(TripStatus.class);
        };
    }

    public boolean canTransitionTo(TripStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
