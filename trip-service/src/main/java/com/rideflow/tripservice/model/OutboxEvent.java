package com.rideflow.tripservice.model;

import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound event written together with the trip change that caused it and relayed
 * to the bus by {@code OutboxPublisher}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

    // Assigned by the repository; relay order
    private Long sequence;

    private EventKind kind;

    private String aggregateId; // trip id

    private String correlationId;

    private EventPayload payload;

    private Instant createdAt;

    private int attempts;

    private Instant nextAttemptAt;

    private String lastError;

    private boolean processed;

    // Rejected by the bus for good (schema); never retried
    private boolean failed;

    public OutboxEvent copy() {
        return toBuilder().build();
    }
}
