package com.rideflow.tripservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Outbox relay settings. The poll interval is read by {@code OutboxPublisher}'s
 * schedule through the bean name {@code outboxProperties}.
 */
@Getter
@Setter
@Configuration("outboxProperties")
@ConfigurationProperties(prefix = "rideflow.outbox")
public class OutboxProperties {

    private Duration pollInterval = Duration.ofMillis(500);
    private int batchSize = 50;

    // Back-off after a retryable publish failure: 1s -> 2s -> 4s ... capped
    private Duration retryInitialDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(30);

    // Processed events older than this are removed by the cleanup job
    private Duration retention = Duration.ofHours(24);
    private String cleanupCron = "0 0 3 * * *";
}
