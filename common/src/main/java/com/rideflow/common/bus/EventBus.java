package com.rideflow.common.bus;

import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;

/**
 * At-least-once, schema-validated publish/subscribe between services.
 *
 * Ordering: envelopes published by one process for one event kind reach every
 * subscriber in publish order. There is no ordering across event kinds.
 */
public interface EventBus {

    /**
     * Validates the payload, sends it durably and blocks until the broker confirms it
     * or the configured publish timeout elapses.
     *
     * @throws PublishException with reason TIMEOUT, CONNECTION_LOST or SCHEMA_INVALID
     */
    PublishAck publish(EventKind kind, EventPayload payload, String correlationId);

    /**
     * Registers a handler for one event kind. Envelopes are delivered one at a time.
     * A failing handler gets the envelope once more after a back-off delay; a second
     * failure moves it to the dead-letter destination.
     */
    Subscription subscribe(EventKind kind, EventHandler handler);
}
