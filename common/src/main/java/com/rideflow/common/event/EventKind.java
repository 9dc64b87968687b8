package com.rideflow.common.event;

import com.rideflow.common.contracts.DriverAvailableContract;
import com.rideflow.common.contracts.DriverRegisteredContract;
import com.rideflow.common.contracts.DriverUnavailableContract;
import com.rideflow.common.contracts.PaymentChargedContract;
import com.rideflow.common.contracts.PricingQuotedContract;
import com.rideflow.common.contracts.TripAssignedContract;
import com.rideflow.common.contracts.TripCancelRequestedContract;
import com.rideflow.common.contracts.TripCancelledContract;
import com.rideflow.common.contracts.TripCompletedContract;
import com.rideflow.common.contracts.TripRequestedContract;
import com.rideflow.common.contracts.TripStartedContract;
import com.rideflow.common.contracts.TripUnmatchedContract;
import com.rideflow.common.schema.UnknownEventKindException;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registration table of every event the platform knows about.
 * The wire name doubles as the RabbitMQ routing key.
 */
public enum EventKind {

    TRIP_REQUESTED("trip.requested", TripRequestedContract.class),
    TRIP_ASSIGNED("trip.assigned", TripAssignedContract.class),
    TRIP_UNMATCHED("trip.unmatched", TripUnmatchedContract.class),
    PRICING_QUOTED("pricing.quoted", PricingQuotedContract.class),
    TRIP_STARTED("trip.started", TripStartedContract.class),
    TRIP_COMPLETED("trip.completed", TripCompletedContract.class),
    TRIP_CANCEL_REQUESTED("trip.cancel_requested", TripCancelRequestedContract.class),
    TRIP_CANCELLED("trip.cancelled", TripCancelledContract.class),
    PAYMENT_CHARGED("payment.charged", PaymentChargedContract.class),
    DRIVER_REGISTERED("driver.registered", DriverRegisteredContract.class),
    DRIVER_AVAILABLE("driver.available", DriverAvailableContract.class),
    DRIVER_UNAVAILABLE("driver.unavailable", DriverUnavailableContract.class);

    private static final Map<String, EventKind> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventKind::getWireName, Function.identity()));

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventKind(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends EventPayload> getPayloadType() {
        return payloadType;
    }

    /**
     * @throws UnknownEventKindException if no event is registered under the name
     */
    public static EventKind fromWireName(String wireName) {
        EventKind kind = wireName == null ? null : BY_WIRE_NAME.get(wireName);
        if (kind == null) {
            throw new UnknownEventKindException(wireName);
        }
        return kind;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
