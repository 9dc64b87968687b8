package com.rideflow.tripservice.service;

/**
 * What the orchestrator did with one envelope. Every outcome acknowledges the envelope.
 */
public enum TransitionOutcome {
    // Trip state changed
    APPLIED,
    // Unknown trip or wrong source status; counted and dropped
    VIOLATION,
    // Repeated trip.requested for a trip that already exists
    DUPLICATE,
    // Accepted without a state change (own echoes, audit-only events, superseded matches)
    IGNORED
}
