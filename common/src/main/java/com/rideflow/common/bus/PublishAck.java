package com.rideflow.common.bus;

import com.rideflow.common.event.EventKind;
import lombok.Value;

import java.time.Instant;

/**
 * Broker confirmation of a published envelope.
 */
@Value
public class PublishAck {

    String envelopeId;
    EventKind kind;
    String correlationId;
    Instant confirmedAt;
}
