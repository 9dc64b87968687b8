package com.rideflow.tripservice.subscriber;

import com.rideflow.common.bus.EventBus;
import com.rideflow.common.bus.Subscription;
import com.rideflow.common.contracts.DriverAvailableContract;
import com.rideflow.common.contracts.DriverRegisteredContract;
import com.rideflow.common.contracts.DriverUnavailableContract;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.tripservice.service.DriverAvailabilityTracker;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
@RequiredArgsConstructor
@Slf4j
public class DriverEventSubscriber {

    private final EventBus eventBus;
    private final DriverAvailabilityTracker availabilityTracker;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    @EventListener(ApplicationReadyEvent.class)
    public void subscribe() {
        subscriptions.add(eventBus.subscribe(EventKind.DRIVER_REGISTERED, this::handle));
        subscriptions.add(eventBus.subscribe(EventKind.DRIVER_AVAILABLE, this::handle));
        subscriptions.add(eventBus.subscribe(EventKind.DRIVER_UNAVAILABLE, this::handle));
        log.info("Driver event subscriptions started");
    }

    void handle(EventEnvelope envelope) {
        switch (envelope.getKind()) {
            case DRIVER_REGISTERED -> {
                DriverRegisteredContract contract = envelope.payloadAs(DriverRegisteredContract.class);
                availabilityTracker.register(contract.getDriverId(), contract.getName(), contract.getRating());
            }
            case DRIVER_AVAILABLE -> {
                DriverAvailableContract contract = envelope.payloadAs(DriverAvailableContract.class);
                availabilityTracker.markAvailable(contract.getDriverId(), contract.getLocation());
            }
            case DRIVER_UNAVAILABLE -> {
                DriverUnavailableContract contract = envelope.payloadAs(DriverUnavailableContract.class);
                availabilityTracker.markUnavailable(contract.getDriverId());
            }
            default -> log.warn("Unexpected {} envelope on driver subscription: envelopeId={}",
                    envelope.getKind(), envelope.getId());
        }
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(Subscription::cancel);
        subscriptions.clear();
    }
}
