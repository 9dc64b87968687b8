package com.rideflow.common.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Validated, timestamped wrapper around an event payload.
 * Envelopes are immutable once built; every payload contract is immutable as well.
 */
@Value
@Builder
public class EventEnvelope {

    @NonNull
    String id;

    @NonNull
    EventKind kind;

    @NonNull
    Instant timestamp;

    // Stable for a whole trip's event chain
    @NonNull
    String correlationId;

    // Name of the publishing service
    String source;

    @NonNull
    EventPayload payload;

    public static EventEnvelope create(EventKind kind, EventPayload payload, String correlationId,
            String source, Clock clock) {
        return EventEnvelope.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .timestamp(clock.instant())
                .correlationId(correlationId)
                .source(source)
                .payload(payload)
                .build();
    }

    public <T extends EventPayload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    public String getEventName() {
        return kind.getWireName();
    }
}
