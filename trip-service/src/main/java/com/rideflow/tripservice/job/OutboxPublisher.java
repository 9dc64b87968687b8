package com.rideflow.tripservice.job;

import com.rideflow.common.bus.EventBus;
import com.rideflow.common.bus.PublishAck;
import com.rideflow.common.bus.PublishException;
import com.rideflow.tripservice.config.OutboxProperties;
import com.rideflow.tripservice.metrics.TripMetrics;
import com.rideflow.tripservice.model.OutboxEvent;
import com.rideflow.tripservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Relays outbox events to the bus in sequence order.
 *
 * A retryable failure stops the batch so a later event never overtakes an earlier one;
 * the failed event is retried after an exponential back-off. An event the bus refuses
 * for its schema is marked failed and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxRepository outboxRepository;
    private final EventBus eventBus;
    private final OutboxProperties properties;
    private final TripMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{@outboxProperties.pollInterval.toMillis()}")
    public void publishOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findPending(properties.getBatchSize());
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} outbox events to publish", events.size());
        Instant now = clock.instant();

        for (OutboxEvent event : events) {
            if (event.getNextAttemptAt() != null && event.getNextAttemptAt().isAfter(now)) {
                log.debug("Outbox event {} backing off until {}", event.getSequence(), event.getNextAttemptAt());
                return;
            }

            try {
                PublishAck ack = eventBus.publish(event.getKind(), event.getPayload(), event.getCorrelationId());

                event.setProcessed(true);
                event.setAttempts(event.getAttempts() + 1);
                event.setLastError(null);
                outboxRepository.save(event);

                log.info("Published outbox event: sequence={}, kind={}, tripId={}, envelopeId={}",
                        event.getSequence(), event.getKind(), event.getAggregateId(), ack.getEnvelopeId());

            } catch (PublishException e) {
                metrics.recordOutboxFailure(e.getReason());
                event.setAttempts(event.getAttempts() + 1);
                event.setLastError(e.getMessage());

                if (!e.isRetryable()) {
                    event.setFailed(true);
                    outboxRepository.save(event);
                    log.error("Outbox event rejected by the bus, marking failed: sequence={}, kind={}, tripId={}",
                            event.getSequence(), event.getKind(), event.getAggregateId(), e);
                    continue;
                }

                Duration delay = backOff(event.getAttempts());
                event.setNextAttemptAt(now.plus(delay));
                outboxRepository.save(event);
                log.warn("Failed to publish outbox event, retrying in {} ms: sequence={}, kind={}, reason={}",
                        delay.toMillis(), event.getSequence(), event.getKind(), e.getReason());
                return;
            }
        }
    }

    // Runs every day at 3 AM by default
    @Scheduled(cron = "#{@outboxProperties.cleanupCron}")
    public void cleanupProcessedEvents() {
        Instant cutoff = clock.instant().minus(properties.getRetention());
        log.info("Starting cleanup of processed and failed outbox events older than {}", cutoff);

        int deleted = outboxRepository.deleteFinishedBefore(cutoff);

        log.info("Cleanup completed. Total deleted: {}", deleted);
    }

    Duration backOff(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        long millis = properties.getRetryInitialDelay().toMillis() * (1L << exponent);
        long maxMillis = properties.getRetryMaxDelay().toMillis();
        return Duration.ofMillis(Math.min(millis, maxMillis));
    }
}
