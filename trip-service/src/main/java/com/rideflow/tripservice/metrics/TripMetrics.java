package com.rideflow.tripservice.metrics;

import com.rideflow.common.bus.PublishException;
import com.rideflow.common.event.EventKind;
import com.rideflow.tripservice.model.TripStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer counters for trip orchestration.
 *
 *   rideflow.trips.transitions{to="MATCHING|ASSIGNED|..."}
 *   rideflow.trips.protocol_violations{event="pricing.quoted|..."}
 *   rideflow.trips.duplicates
 *   rideflow.matching.attempts{outcome="matched|no_match|driver_unavailable"}
 *   rideflow.outbox.failures{reason="timeout|connection_lost|schema_invalid"}
 */
@Component
public class TripMetrics {

    private final Map<TripStatus, Counter> transitionCounters = new EnumMap<>(TripStatus.class);
    private final Map<EventKind, Counter> violationCounters = new EnumMap<>(EventKind.class);
    private final Map<PublishException.Reason, Counter> outboxFailureCounters =
            new EnumMap<>(PublishException.Reason.class);
    private final Counter duplicateCounter;
    private final Counter matchedCounter;
    private final Counter noMatchCounter;
    private final Counter driverUnavailableCounter;

    public TripMetrics(MeterRegistry registry) {
        for (TripStatus status : TripStatus.values()) {
            transitionCounters.put(status, Counter.builder("rideflow.trips.transitions")
                    .tag("to", status.name())
                    .description("Trip status transitions by target status")
                    .register(registry));
        }
        for (EventKind kind : EventKind.values()) {
            violationCounters.put(kind, Counter.builder("rideflow.trips.protocol_violations")
                    .tag("event", kind.getWireName())
                    .description("Events dropped because the trip was unknown or in the wrong status")
                    .register(registry));
        }
        for (PublishException.Reason reason : PublishException.Reason.values()) {
            outboxFailureCounters.put(reason, Counter.builder("rideflow.outbox.failures")
                    .tag("reason", reason.name().toLowerCase())
                    .description("Outbox relay publish failures")
                    .register(registry));
        }

        this.duplicateCounter = Counter.builder("rideflow.trips.duplicates")
                .description("Duplicate trip.requested deliveries dropped")
                .register(registry);

        this.matchedCounter = matching(registry, "matched");
        this.noMatchCounter = matching(registry, "no_match");
        this.driverUnavailableCounter = matching(registry, "driver_unavailable");
    }

    private static Counter matching(MeterRegistry registry, String outcome) {
        return Counter.builder("rideflow.matching.attempts")
                .tag("outcome", outcome)
                .description("Matching attempts by outcome")
                .register(registry);
    }

    public void recordTransition(TripStatus target) {
        transitionCounters.get(target).increment();
    }

    public void recordProtocolViolation(EventKind kind) {
        violationCounters.get(kind).increment();
    }

    public void recordOutboxFailure(PublishException.Reason reason) {
        outboxFailureCounters.get(reason).increment();
    }

    public void recordDuplicate()         { duplicateCounter.increment(); }
    public void recordMatched()           { matchedCounter.increment(); }
    public void recordNoMatch()           { noMatchCounter.increment(); }
    public void recordDriverUnavailable() { driverUnavailableCounter.increment(); }

    public double getTransitionCount(TripStatus target) {
        return transitionCounters.get(target).count();
    }

    public double getProtocolViolationCount(EventKind kind) {
        return violationCounters.get(kind).count();
    }

    public double getOutboxFailureCount(PublishException.Reason reason) {
        return outboxFailureCounters.get(reason).count();
    }

    public double getDuplicateCount()         { return duplicateCounter.count(); }
    public double getMatchedCount()           { return matchedCounter.count(); }
    public double getNoMatchCount()           { return noMatchCounter.count(); }
    public double getDriverUnavailableCount() { return driverUnavailableCounter.count(); }
}
