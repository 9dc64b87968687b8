package com.rideflow.common.bus;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Event bus settings (adjustable per environment in application.yml).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "rideflow.bus")
public class EventBusProperties {

    public enum Mode {
        RABBIT,
        IN_MEMORY
    }

    private Mode mode = Mode.RABBIT;

    // Written into every envelope's "source" and used in queue names
    private String serviceName = "trip-service";

    private String exchange = "rideflow.events";

    // --- Publish ---
    private Duration publishTimeout = Duration.ofSeconds(5);

    // --- Consume ---
    private Duration handlerDeadline = Duration.ofSeconds(30);
    private int maxDeliveries = 2;                               // first delivery + one redelivery
    private Duration redeliveryInitialDelay = Duration.ofSeconds(1);
    private Duration redeliveryMaxDelay = Duration.ofSeconds(30);

    // --- Connection recovery (1s -> 2s -> 4s ... capped) ---
    private Duration reconnectInitialInterval = Duration.ofSeconds(1);
    private double reconnectMultiplier = 2.0;
    private Duration reconnectMaxInterval = Duration.ofSeconds(30);

    public String queueNameFor(String eventName) {
        return "q." + serviceName + "." + eventName;
    }

    public String retryQueueNameFor(String eventName) {
        return queueNameFor(eventName) + ".retry";
    }
}
