package com.rideflow.common.bus;

import com.rideflow.common.schema.SchemaValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Broker-less bus for local runs and tests ({@code rideflow.bus.mode=in-memory}).
 * The RabbitMQ bus is configured in {@link com.rideflow.common.bus.rabbit.AmqpConfig}.
 */
@Configuration
@ConditionalOnProperty(prefix = "rideflow.bus", name = "mode", havingValue = "in-memory")
public class EventBusConfig {

    @Bean
    public InMemoryEventBus inMemoryEventBus(EnvelopeCodec codec, SchemaValidator schemaValidator,
            EventBusProperties properties, BusMetrics metrics, Clock clock) {
        return new InMemoryEventBus(codec, schemaValidator, properties, metrics, clock);
    }
}
