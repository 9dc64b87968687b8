package com.rideflow.tripservice.service;

import com.rideflow.common.bus.EventBusProperties;
import com.rideflow.common.contracts.PaymentChargedContract;
import com.rideflow.common.contracts.PricingQuotedContract;
import com.rideflow.common.contracts.TripAssignedContract;
import com.rideflow.common.contracts.TripCancelRequestedContract;
import com.rideflow.common.contracts.TripCancelledContract;
import com.rideflow.common.contracts.TripCompletedContract;
import com.rideflow.common.contracts.TripRequestedContract;
import com.rideflow.common.contracts.TripStartedContract;
import com.rideflow.common.contracts.TripUnmatchedContract;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import com.rideflow.tripservice.exception.DriverNoLongerAvailableException;
import com.rideflow.tripservice.exception.InvalidTripStateException;
import com.rideflow.tripservice.metrics.TripMetrics;
import com.rideflow.tripservice.model.OutboxEvent;
import com.rideflow.tripservice.model.Trip;
import com.rideflow.tripservice.model.TripStatus;
import com.rideflow.tripservice.repository.OutboxRepository;
import com.rideflow.tripservice.repository.TripRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives every trip through its lifecycle in response to bus events.
 *
 * Sole writer of trip state. All changes to one trip run under {@link TripLocks};
 * matching runs outside the lock so a cancellation can overtake it, and the assignment
 * only commits if the trip is still MATCHING at that point. Outbound events are written
 * to the outbox under the same lock as the change that caused them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripOrchestrator {

    private static final int MAX_MATCH_ATTEMPTS = 2;

    private final TripRepository tripRepository;
    private final OutboxRepository outboxRepository;
    private final DriverAvailabilityTracker availabilityTracker;
    private final DriverMatcher driverMatcher;
    private final TripLocks tripLocks;
    private final TripMetrics metrics;
    private final EventBusProperties busProperties;
    private final Clock clock;

    public TransitionOutcome handle(EventEnvelope envelope) {
        return switch (envelope.getKind()) {
            case TRIP_REQUESTED -> onTripRequested(envelope, envelope.payloadAs(TripRequestedContract.class));
            case PRICING_QUOTED -> onPricingQuoted(envelope, envelope.payloadAs(PricingQuotedContract.class));
            case TRIP_STARTED -> onTripStarted(envelope, envelope.payloadAs(TripStartedContract.class));
            case TRIP_COMPLETED -> onTripCompleted(envelope, envelope.payloadAs(TripCompletedContract.class));
            case TRIP_CANCEL_REQUESTED ->
                    onCancelRequested(envelope, envelope.payloadAs(TripCancelRequestedContract.class));
            case PAYMENT_CHARGED -> onPaymentCharged(envelope, envelope.payloadAs(PaymentChargedContract.class));
            case TRIP_ASSIGNED, TRIP_UNMATCHED, TRIP_CANCELLED,
                    DRIVER_REGISTERED, DRIVER_AVAILABLE, DRIVER_UNAVAILABLE -> {
                log.debug("Orchestrator does not consume {}, ignoring envelope {}", envelope.getKind(), envelope.getId());
                yield TransitionOutcome.IGNORED;
            }
        };
    }

    // --- trip.requested ---

    private TransitionOutcome onTripRequested(EventEnvelope envelope, TripRequestedContract contract) {
        String tripId = contract.getTripId();
        log.info("Received trip.requested: tripId={}, riderId={}", tripId, contract.getRiderId());

        TransitionOutcome created = tripLocks.withLock(tripId, () -> {
            Optional<Trip> existing = tripRepository.loadTrip(tripId);
            if (existing.isPresent()) {
                if (existing.get().getStatus() == TripStatus.MATCHING) {
                    // An earlier delivery failed mid-matching; pick up where it stopped
                    log.info("Redelivered trip.requested for trip still matching, resuming: tripId={}", tripId);
                    return TransitionOutcome.APPLIED;
                }
                log.warn("Duplicate trip.requested dropped: tripId={}, status={}, envelopeId={}",
                        tripId, existing.get().getStatus(), envelope.getId());
                metrics.recordDuplicate();
                return TransitionOutcome.DUPLICATE;
            }

            Instant now = clock.instant();
            Trip trip = Trip.builder()
                    .id(tripId)
                    .riderId(contract.getRiderId())
                    .origin(contract.getOrigin())
                    .destination(contract.getDestination())
                    .status(TripStatus.REQUESTED)
                    .correlationId(envelope.getCorrelationId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.REQUESTED);

            trip.transitionTo(TripStatus.MATCHING, now);
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.MATCHING);
            return TransitionOutcome.APPLIED;
        });

        if (created != TransitionOutcome.APPLIED) {
            return created;
        }
        return matchAndAssign(tripId);
    }

    private TransitionOutcome matchAndAssign(String tripId) {
        for (int attempt = 1; attempt <= MAX_MATCH_ATTEMPTS; attempt++) {
            Optional<Trip> current = tripRepository.loadTrip(tripId);
            if (current.isEmpty() || current.get().getStatus() != TripStatus.MATCHING) {
                log.info("Trip left MATCHING before a driver was chosen, stopping: tripId={}", tripId);
                return TransitionOutcome.IGNORED;
            }

            MatchResult result = driverMatcher.match(current.get(), availabilityTracker.snapshot());
            if (!result.isMatched()) {
                metrics.recordNoMatch();
                return finishUnmatched(tripId, result.getReason());
            }

            try {
                availabilityTracker.reserve(result.getDriverId(), tripId);
            } catch (DriverNoLongerAvailableException e) {
                metrics.recordDriverUnavailable();
                log.warn("Matched driver went away before reservation: tripId={}, driverId={}, attempt={}",
                        tripId, e.getDriverId(), attempt);
                continue;
            }

            metrics.recordMatched();
            return commitAssignment(tripId, result);
        }
        return finishUnmatched(tripId, TripUnmatchedContract.REASON_DRIVER_UNAVAILABLE);
    }

    private TransitionOutcome commitAssignment(String tripId, MatchResult result) {
        String driverId = result.getDriverId();
        return tripLocks.withLock(tripId, () -> {
            Trip trip = tripRepository.loadTrip(tripId).orElse(null);
            if (trip == null || trip.getStatus() != TripStatus.MATCHING) {
                log.info("Trip was {} while matching, releasing reserved driver: tripId={}, driverId={}",
                        trip == null ? "removed" : trip.getStatus(), tripId, driverId);
                availabilityTracker.release(driverId, tripId);
                return TransitionOutcome.IGNORED;
            }

            trip.setDriverId(driverId);
            trip.transitionTo(TripStatus.ASSIGNED, clock.instant());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.ASSIGNED);

            enqueue(EventKind.TRIP_ASSIGNED, trip, TripAssignedContract.builder()
                    .tripId(tripId)
                    .driverId(driverId)
                    .riderId(trip.getRiderId())
                    .build());
            log.info("Trip assigned: tripId={}, driverId={}, distance={} km",
                    tripId, driverId, String.format("%.2f", result.getDistanceKm()));
            return TransitionOutcome.APPLIED;
        });
    }

    private TransitionOutcome finishUnmatched(String tripId, String reason) {
        return tripLocks.withLock(tripId, () -> {
            Trip trip = tripRepository.loadTrip(tripId).orElse(null);
            if (trip == null || trip.getStatus() != TripStatus.MATCHING) {
                return TransitionOutcome.IGNORED;
            }

            trip.transitionTo(TripStatus.UNMATCHED, clock.instant());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.UNMATCHED);

            enqueue(EventKind.TRIP_UNMATCHED, trip, TripUnmatchedContract.builder()
                    .tripId(tripId)
                    .reason(reason)
                    .riderId(trip.getRiderId())
                    .build());
            log.info("Trip unmatched: tripId={}, reason={}", tripId, reason);
            return TransitionOutcome.APPLIED;
        });
    }

    // --- pricing / start / completion ---

    private TransitionOutcome onPricingQuoted(EventEnvelope envelope, PricingQuotedContract contract) {
        return withTrip(envelope, contract.getTripId(), trip -> {
            trip.transitionTo(TripStatus.PRICED, clock.instant());
            trip.setQuotedPrice(contract.getPrice());
            trip.setCurrency(contract.getCurrency());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.PRICED);
            log.info("Trip priced: tripId={}, price={}, currency={}",
                    trip.getId(), contract.getPrice(), contract.getCurrency());
            return TransitionOutcome.APPLIED;
        });
    }

    private TransitionOutcome onTripStarted(EventEnvelope envelope, TripStartedContract contract) {
        return withTrip(envelope, contract.getTripId(), trip -> {
            trip.transitionTo(TripStatus.IN_PROGRESS, clock.instant());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.IN_PROGRESS);
            log.info("Trip started: tripId={}, driverId={}", trip.getId(), trip.getDriverId());
            return TransitionOutcome.APPLIED;
        });
    }

    private TransitionOutcome onTripCompleted(EventEnvelope envelope, TripCompletedContract contract) {
        // The topic exchange hands our own trip.completed back to us
        if (busProperties.getServiceName().equals(envelope.getSource())) {
            log.debug("Ignoring own trip.completed echo: tripId={}, envelopeId={}",
                    contract.getTripId(), envelope.getId());
            return TransitionOutcome.IGNORED;
        }

        return withTrip(envelope, contract.getTripId(), trip -> {
            trip.transitionTo(TripStatus.COMPLETED, clock.instant());
            trip.setFinalPrice(contract.getFinalPrice());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.COMPLETED);

            if (trip.getDriverId() != null) {
                availabilityTracker.release(trip.getDriverId(), trip.getId());
            }

            enqueue(EventKind.TRIP_COMPLETED, trip, TripCompletedContract.builder()
                    .tripId(trip.getId())
                    .finalPrice(trip.getFinalPrice())
                    .driverId(trip.getDriverId())
                    .riderId(trip.getRiderId())
                    .build());
            log.info("Trip completed: tripId={}, finalPrice={}", trip.getId(), trip.getFinalPrice());
            return TransitionOutcome.APPLIED;
        });
    }

    // --- cancellation ---

    private TransitionOutcome onCancelRequested(EventEnvelope envelope, TripCancelRequestedContract contract) {
        return withTrip(envelope, contract.getTripId(), trip -> {
            TripStatus previous = trip.getStatus();
            trip.transitionTo(TripStatus.CANCELLED, clock.instant());
            tripRepository.saveTrip(trip);
            metrics.recordTransition(TripStatus.CANCELLED);

            if (trip.getDriverId() != null) {
                availabilityTracker.release(trip.getDriverId(), trip.getId());
            }

            enqueue(EventKind.TRIP_CANCELLED, trip, TripCancelledContract.builder()
                    .tripId(trip.getId())
                    .initiator(contract.getInitiator())
                    .riderId(trip.getRiderId())
                    .driverId(trip.getDriverId())
                    .build());
            log.info("Trip cancelled: tripId={}, from={}, initiator={}",
                    trip.getId(), previous, contract.getInitiator());
            return TransitionOutcome.APPLIED;
        });
    }

    // --- payment ---

    private TransitionOutcome onPaymentCharged(EventEnvelope envelope, PaymentChargedContract contract) {
        return withTrip(envelope, contract.getTripId(), trip -> {
            if (trip.getStatus() != TripStatus.COMPLETED) {
                throw new InvalidTripStateException(String.format(
                        "Payment for trip %s arrived in status %s", trip.getId(), trip.getStatus()));
            }
            log.info("Payment recorded: tripId={}, paymentId={}, amount={}, finalPrice={}",
                    trip.getId(), contract.getPaymentId(), contract.getAmount(), trip.getFinalPrice());
            return TransitionOutcome.IGNORED;
        });
    }

    // --- helpers ---

    /**
     * Runs the action on the current trip under its lock. An unknown trip or an
     * {@link InvalidTripStateException} from the action is a protocol violation.
     */
    private TransitionOutcome withTrip(EventEnvelope envelope, String tripId, Function<Trip, TransitionOutcome> action) {
        return tripLocks.withLock(tripId, () -> {
            Optional<Trip> trip = tripRepository.loadTrip(tripId);
            if (trip.isEmpty()) {
                return violation(envelope, tripId, "unknown trip");
            }
            try {
                return action.apply(trip.get());
            } catch (InvalidTripStateException e) {
                return violation(envelope, tripId, e.getMessage());
            }
        });
    }

    private TransitionOutcome violation(EventEnvelope envelope, String tripId, String detail) {
        log.warn("Protocol violation, dropping {}: tripId={}, envelopeId={}, detail={}",
                envelope.getKind(), tripId, envelope.getId(), detail);
        metrics.recordProtocolViolation(envelope.getKind());
        return TransitionOutcome.VIOLATION;
    }

    private void enqueue(EventKind kind, Trip trip, EventPayload payload) {
        Instant now = clock.instant();
        OutboxEvent event = outboxRepository.save(OutboxEvent.builder()
                .kind(kind)
                .aggregateId(trip.getId())
                .correlationId(trip.getCorrelationId())
                .payload(payload)
                .createdAt(now)
                .nextAttemptAt(now)
                .build());
        log.debug("Outbox event saved: kind={}, tripId={}, sequence={}", kind, trip.getId(), event.getSequence());
    }
}
