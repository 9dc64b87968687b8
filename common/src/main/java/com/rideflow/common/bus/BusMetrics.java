package com.rideflow.common.bus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for the event bus. Every dropped, requeued or dead-lettered
 * envelope is counted here.
 *
 *   rideflow.bus.deliveries{outcome="acked|requeued|dead_lettered|schema_rejected"}
 *   rideflow.bus.publishes{outcome="confirmed|timeout|connection_lost|schema_invalid"}
 *   rideflow.bus.connection{event="lost|established"}
 */
@Component
public class BusMetrics {

    private final Counter ackedCounter;
    private final Counter requeuedCounter;
    private final Counter deadLetteredCounter;
    private final Counter schemaRejectedCounter;
    private final Counter publishConfirmedCounter;
    private final Counter publishTimeoutCounter;
    private final Counter publishConnectionLostCounter;
    private final Counter publishSchemaInvalidCounter;
    private final Counter connectionLostCounter;
    private final Counter connectionEstablishedCounter;

    public BusMetrics(MeterRegistry registry) {
        this.ackedCounter = delivery(registry, "acked", "Envelopes handled and acknowledged");
        this.requeuedCounter = delivery(registry, "requeued", "Envelopes scheduled for redelivery after a handler failure");
        this.deadLetteredCounter = delivery(registry, "dead_lettered", "Envelopes dead-lettered after the last allowed failure");
        this.schemaRejectedCounter = delivery(registry, "schema_rejected", "Incoming envelopes dropped for failing schema validation");

        this.publishConfirmedCounter = publish(registry, "confirmed");
        this.publishTimeoutCounter = publish(registry, "timeout");
        this.publishConnectionLostCounter = publish(registry, "connection_lost");
        this.publishSchemaInvalidCounter = publish(registry, "schema_invalid");

        this.connectionLostCounter = Counter.builder("rideflow.bus.connection")
                .tag("event", "lost")
                .description("Broker connections lost")
                .register(registry);
        this.connectionEstablishedCounter = Counter.builder("rideflow.bus.connection")
                .tag("event", "established")
                .description("Broker connections (re-)established")
                .register(registry);
    }

    private static Counter delivery(MeterRegistry registry, String outcome, String description) {
        return Counter.builder("rideflow.bus.deliveries")
                .tag("outcome", outcome)
                .description(description)
                .register(registry);
    }

    private static Counter publish(MeterRegistry registry, String outcome) {
        return Counter.builder("rideflow.bus.publishes")
                .tag("outcome", outcome)
                .description("Publish attempts by outcome")
                .register(registry);
    }

    public void recordAcked()          { ackedCounter.increment(); }
    public void recordRequeued()       { requeuedCounter.increment(); }
    public void recordDeadLettered()   { deadLetteredCounter.increment(); }
    public void recordSchemaRejected() { schemaRejectedCounter.increment(); }

    public void recordPublishConfirmed() { publishConfirmedCounter.increment(); }

    public void recordPublishFailure(PublishException.Reason reason) {
        switch (reason) {
            case TIMEOUT -> publishTimeoutCounter.increment();
            case CONNECTION_LOST -> publishConnectionLostCounter.increment();
            case SCHEMA_INVALID -> publishSchemaInvalidCounter.increment();
        }
    }

    public void recordConnectionLost()        { connectionLostCounter.increment(); }
    public void recordConnectionEstablished() { connectionEstablishedCounter.increment(); }

    public double getAckedCount()          { return ackedCounter.count(); }
    public double getRequeuedCount()       { return requeuedCounter.count(); }
    public double getDeadLetteredCount()   { return deadLetteredCounter.count(); }
    public double getSchemaRejectedCount() { return schemaRejectedCounter.count(); }
}
