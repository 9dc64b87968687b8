package com.rideflow.tripservice.subscriber;

import com.rideflow.common.bus.EventBus;
import com.rideflow.common.bus.Subscription;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.tripservice.service.TransitionOutcome;
import com.rideflow.tripservice.service.TripOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Feeds trip events from the bus into the orchestrator. Exceptions other than protocol
 * violations propagate to the bus and trigger its redelivery policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripEventSubscriber {

    static final List<EventKind> CONSUMED_KINDS = List.of(
            EventKind.TRIP_REQUESTED,
            EventKind.PRICING_QUOTED,
            EventKind.TRIP_STARTED,
            EventKind.TRIP_COMPLETED,
            EventKind.TRIP_CANCEL_REQUESTED,
            EventKind.PAYMENT_CHARGED);

    private final EventBus eventBus;
    private final TripOrchestrator orchestrator;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    @EventListener(ApplicationReadyEvent.class)
    public void subscribe() {
        for (EventKind kind : CONSUMED_KINDS) {
            subscriptions.add(eventBus.subscribe(kind, this::handle));
        }
        log.info("Trip event subscriptions started: {}", CONSUMED_KINDS);
    }

    void handle(EventEnvelope envelope) {
        log.info("Received {} event: envelopeId={}, source={}",
                envelope.getKind(), envelope.getId(), envelope.getSource());
        TransitionOutcome outcome = orchestrator.handle(envelope);
        log.debug("Handled {} event: envelopeId={}, outcome={}", envelope.getKind(), envelope.getId(), outcome);
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
    }
}
