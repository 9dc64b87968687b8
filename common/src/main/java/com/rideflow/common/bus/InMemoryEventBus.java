package com.rideflow.common.bus;

import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import com.rideflow.common.schema.SchemaException;
import com.rideflow.common.schema.SchemaValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.DisposableBean;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process event bus with the same delivery contract as the RabbitMQ bus:
 * envelopes are encoded and decoded (so the subscribe path validates exactly like the
 * wire path), each subscription has its own FIFO worker, handlers run under a deadline,
 * a failure is redelivered once after a back-off delay and a second failure is
 * dead-lettered.
 *
 * Like a topic exchange, envelopes published while nobody subscribes are discarded.
 * An envelope that reaches a cancelled subscription, including a redelivery that was
 * still waiting when the subscription or the bus shut down, is dead-lettered and counted.
 *
 * {@link #publish(EventKind, EventPayload, String)} stamps this service's name as the
 * envelope source, and consumers that skip their own echoes (trip-service does for
 * {@code trip.completed}) ignore such envelopes. Use
 * {@link #publishAs(String, EventKind, EventPayload, String)} to stand in for another
 * service when running in-process.
 */
@Slf4j
public class InMemoryEventBus implements EventBus, DisposableBean {

    private final EnvelopeCodec codec;
    private final SchemaValidator schemaValidator;
    private final EventBusProperties properties;
    private final BusMetrics metrics;
    private final Clock clock;
    private final RedeliveryPolicy redeliveryPolicy;

    private final Map<EventKind, List<InMemorySubscription>> subscriptions = new EnumMap<>(EventKind.class);
    private final Map<EventKind, Object> publishLocks = new EnumMap<>(EventKind.class);
    private final List<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();
    private final Set<PendingRedelivery> pendingRedeliveries = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService redeliveryScheduler;

    private volatile boolean closed;

    public InMemoryEventBus(EnvelopeCodec codec, SchemaValidator schemaValidator, EventBusProperties properties,
            BusMetrics metrics, Clock clock) {
        this.codec = codec;
        this.schemaValidator = schemaValidator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.redeliveryPolicy = RedeliveryPolicy.from(properties);
        this.redeliveryScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "in-memory-bus-redelivery");
            thread.setDaemon(true);
            return thread;
        });

        for (EventKind kind : EventKind.values()) {
            subscriptions.put(kind, new CopyOnWriteArrayList<>());
            publishLocks.put(kind, new Object());
        }
    }

    @Override
    public PublishAck publish(EventKind kind, EventPayload payload, String correlationId) {
        return publishAs(properties.getServiceName(), kind, payload, correlationId);
    }

    /**
     * Publishes with {@code source} as the envelope's publishing service instead of this one.
     */
    public PublishAck publishAs(String source, EventKind kind, EventPayload payload, String correlationId) {
        if (closed) {
            metrics.recordPublishFailure(PublishException.Reason.CONNECTION_LOST);
            throw PublishException.connectionLost(kind, "bus is closed", null);
        }

        EventEnvelope envelope;
        byte[] body;
        try {
            schemaValidator.validateOutgoing(kind, payload);
            if (correlationId == null || correlationId.isBlank()) {
                throw new SchemaException(kind.getWireName(), "correlationId is required");
            }
            envelope = EventEnvelope.create(kind, payload, correlationId, source, clock);
            body = codec.encode(envelope);
        } catch (SchemaException e) {
            metrics.recordPublishFailure(PublishException.Reason.SCHEMA_INVALID);
            throw PublishException.schemaInvalid(kind, e);
        }

        // Fan-out happens under the kind's lock so every subscriber sees the same order
        synchronized (publishLocks.get(kind)) {
            for (InMemorySubscription subscription : subscriptions.get(kind)) {
                subscription.enqueue(body, 1);
            }
        }

        metrics.recordPublishConfirmed();
        log.debug("Published {} envelope: id={}, correlationId={}", kind, envelope.getId(), correlationId);
        return new PublishAck(envelope.getId(), kind, correlationId, clock.instant());
    }

    @Override
    public Subscription subscribe(EventKind kind, EventHandler handler) {
        if (closed) {
            throw new IllegalStateException("Event bus is closed");
        }
        InMemorySubscription subscription = new InMemorySubscription(kind, handler);
        subscriptions.get(kind).add(subscription);
        log.info("Subscribed to {} on queue {}", kind, subscription.getQueueName());
        return subscription;
    }

    public List<DeadLetter> getDeadLetters() {
        return List.copyOf(deadLetters);
    }

    @Override
    public void destroy() {
        closed = true;
        redeliveryScheduler.shutdownNow();
        for (PendingRedelivery pending : pendingRedeliveries) {
            if (pendingRedeliveries.remove(pending)) {
                pending.subscription.drop(pending.body, "bus closed before redelivery", pending.attempt - 1);
            }
        }
        subscriptions.values().forEach(list -> list.forEach(InMemorySubscription::cancel));
    }

    private class InMemorySubscription implements Subscription {

        private final EventKind kind;
        private final String queueName;
        private final ExecutorService worker;
        private final HandlerInvoker invoker;
        private volatile boolean cancelled;

        InMemorySubscription(EventKind kind, EventHandler handler) {
            this.kind = kind;
            this.queueName = properties.queueNameFor(kind.getWireName());
            this.worker = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "consumer-" + queueName);
                thread.setDaemon(true);
                return thread;
            });
            this.invoker = new HandlerInvoker(queueName, handler, properties.getHandlerDeadline());
        }

        void enqueue(byte[] body, int attempt) {
            if (cancelled) {
                drop(body, "subscription cancelled", attempt - 1);
                return;
            }
            try {
                worker.execute(() -> deliver(body, attempt));
            } catch (RejectedExecutionException e) {
                drop(body, "subscription cancelled", attempt - 1);
            }
        }

        void drop(byte[] body, String reason, int deliveredAttempts) {
            log.warn("Envelope on {} not delivered, dead-lettering: reason={}, attempts={}",
                    queueName, reason, deliveredAttempts);
            metrics.recordDeadLettered();
            deadLetter(body, reason, deliveredAttempts);
        }

        private void deliver(byte[] body, int attempt) {
            EventEnvelope envelope;
            try {
                envelope = codec.decode(body);
            } catch (SchemaException e) {
                log.warn("Dropping malformed envelope on {}: event={}, error={}",
                        queueName, e.getEventName(), e.getMessage());
                metrics.recordSchemaRejected();
                deadLetter(body, e.getMessage(), attempt);
                return;
            }

            MDC.put(HandlerInvoker.CORRELATION_ID_MDC_KEY, envelope.getCorrelationId());
            try {
                invoker.invoke(envelope);
                metrics.recordAcked();
            } catch (HandlerFailedException e) {
                if (redeliveryPolicy.shouldDeadLetter(attempt)) {
                    log.error("Handler failed on final delivery, dead-lettering. queue={}, envelopeId={}, attempt={}",
                            queueName, envelope.getId(), attempt, e);
                    metrics.recordDeadLettered();
                    deadLetter(body, e.getMessage(), attempt);
                } else {
                    Duration delay = redeliveryPolicy.delayAfter(attempt);
                    log.warn("Handler failed, redelivering in {} ms. queue={}, envelopeId={}, attempt={}, error={}",
                            delay.toMillis(), queueName, envelope.getId(), attempt, e.getMessage());
                    metrics.recordRequeued();
                    scheduleRedelivery(body, attempt + 1, delay);
                }
            } finally {
                MDC.remove(HandlerInvoker.CORRELATION_ID_MDC_KEY);
            }
        }

        private void scheduleRedelivery(byte[] body, int attempt, Duration delay) {
            PendingRedelivery pending = new PendingRedelivery(this, body, attempt);
            pendingRedeliveries.add(pending);
            try {
                redeliveryScheduler.schedule(() -> {
                    if (pendingRedeliveries.remove(pending)) {
                        enqueue(body, attempt);
                    }
                }, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                if (pendingRedeliveries.remove(pending)) {
                    drop(body, "bus closed before redelivery", attempt - 1);
                }
            }
        }

        private void deadLetter(byte[] body, String reason, int attempts) {
            deadLetters.add(new DeadLetter(queueName, new String(body, StandardCharsets.UTF_8), reason, attempts,
                    clock.instant()));
        }

        @Override
        public EventKind getKind() {
            return kind;
        }

        @Override
        public String getQueueName() {
            return queueName;
        }

        @Override
        public void cancel() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            subscriptions.get(kind).remove(this);
            // Queued envelopes drain before the handler thread goes away
            worker.execute(invoker::close);
            worker.shutdown();
        }
    }

    private static class PendingRedelivery {

        private final InMemorySubscription subscription;
        private final byte[] body;
        private final int attempt;

        PendingRedelivery(InMemorySubscription subscription, byte[] body, int attempt) {
            this.subscription = subscription;
            this.body = body;
            this.attempt = attempt;
        }
    }
}
