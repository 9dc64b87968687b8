package com.rideflow.common.bus.rabbit;

import com.rabbitmq.client.ShutdownSignalException;
import com.rideflow.common.bus.BusMetrics;
import com.rideflow.common.bus.EnvelopeCodec;
import com.rideflow.common.bus.EventBus;
import com.rideflow.common.bus.EventBusProperties;
import com.rideflow.common.bus.EventHandler;
import com.rideflow.common.bus.HandlerInvoker;
import com.rideflow.common.bus.PublishAck;
import com.rideflow.common.bus.PublishException;
import com.rideflow.common.bus.RedeliveryPolicy;
import com.rideflow.common.bus.Subscription;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import com.rideflow.common.schema.SchemaException;
import com.rideflow.common.schema.SchemaValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventBus} on a RabbitMQ topic exchange. Routing key = event name.
 *
 * Publishing waits for the broker's publisher confirm. Each subscription gets a durable
 * queue {@code q.<service>.<event>} consumed by a single consumer with prefetch 1, so
 * envelopes of one kind are handled one at a time in broker order. A failed envelope is
 * parked in {@code <queue>.retry} until its TTL expires and then flows back; a second
 * failure rejects it into the DLX.
 */
@Slf4j
public class RabbitEventBus implements EventBus, DisposableBean {

    public static final String ATTEMPT_HEADER = "x-rideflow-attempt";

    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final ConnectionFactory connectionFactory;
    private final EnvelopeCodec codec;
    private final SchemaValidator schemaValidator;
    private final EventBusProperties properties;
    private final BusMetrics metrics;
    private final Clock clock;
    private final RedeliveryPolicy redeliveryPolicy;

    private final Map<EventKind, Object> publishLocks = new EnumMap<>(EventKind.class);
    private final List<RabbitSubscription> subscriptions = new CopyOnWriteArrayList<>();

    public RabbitEventBus(RabbitTemplate rabbitTemplate, AmqpAdmin amqpAdmin, ConnectionFactory connectionFactory,
            EnvelopeCodec codec, SchemaValidator schemaValidator, EventBusProperties properties,
            BusMetrics metrics, Clock clock) {
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.schemaValidator = schemaValidator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.redeliveryPolicy = RedeliveryPolicy.from(properties);

        for (EventKind kind : EventKind.values()) {
            publishLocks.put(kind, new Object());
        }

        connectionFactory.addConnectionListener(new ConnectionListener() {
            @Override
            public void onCreate(Connection connection) {
                log.info("Connected to RabbitMQ");
                metrics.recordConnectionEstablished();
            }

            @Override
            public void onShutDown(ShutdownSignalException signal) {
                if (!signal.isInitiatedByApplication()) {
                    log.warn("RabbitMQ connection lost: {}", signal.getMessage());
                    metrics.recordConnectionLost();
                }
            }
        });
    }

    @Override
    public PublishAck publish(EventKind kind, EventPayload payload, String correlationId) {
        EventEnvelope envelope;
        byte[] body;
        try {
            schemaValidator.validateOutgoing(kind, payload);
            if (correlationId == null || correlationId.isBlank()) {
                throw new SchemaException(kind.getWireName(), "correlationId is required");
            }
            envelope = EventEnvelope.create(kind, payload, correlationId, properties.getServiceName(), clock);
            body = codec.encode(envelope);
        } catch (SchemaException e) {
            metrics.recordPublishFailure(PublishException.Reason.SCHEMA_INVALID);
            throw PublishException.schemaInvalid(kind, e);
        }

        Message message = MessageBuilder.withBody(body)
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(envelope.getId())
                .setCorrelationId(correlationId)
                .setHeader(ATTEMPT_HEADER, 1)
                .build();

        long timeoutMillis = properties.getPublishTimeout().toMillis();
        CorrelationData correlation = new CorrelationData(envelope.getId());

        // One publish per kind in flight keeps same-kind envelopes in publish order
        synchronized (publishLocks.get(kind)) {
            try {
                rabbitTemplate.send(properties.getExchange(), kind.getWireName(), message, correlation);
                CorrelationData.Confirm confirm = correlation.getFuture().get(timeoutMillis, TimeUnit.MILLISECONDS);
                if (!confirm.isAck()) {
                    throw PublishException.connectionLost(kind, "broker nacked: " + confirm.getReason(), null);
                }
            } catch (TimeoutException e) {
                metrics.recordPublishFailure(PublishException.Reason.TIMEOUT);
                throw PublishException.timeout(kind, timeoutMillis);
            } catch (AmqpException | ExecutionException e) {
                metrics.recordPublishFailure(PublishException.Reason.CONNECTION_LOST);
                throw PublishException.connectionLost(kind, e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.recordPublishFailure(PublishException.Reason.CONNECTION_LOST);
                throw PublishException.connectionLost(kind, "interrupted while awaiting confirm", e);
            } catch (PublishException e) {
                metrics.recordPublishFailure(e.getReason());
                throw e;
            }
        }

        metrics.recordPublishConfirmed();
        log.debug("Published {} envelope: id={}, correlationId={}", kind, envelope.getId(), correlationId);
        return new PublishAck(envelope.getId(), kind, correlationId, clock.instant());
    }

    @Override
    public Subscription subscribe(EventKind kind, EventHandler handler) {
        String queueName = properties.queueNameFor(kind.getWireName());
        String retryQueueName = properties.retryQueueNameFor(kind.getWireName());

        TopicExchange exchange = new TopicExchange(properties.getExchange());
        Queue queue = AmqpConfig.createDurableQueue(queueName);
        amqpAdmin.declareExchange(exchange);
        amqpAdmin.declareQueue(queue);
        amqpAdmin.declareQueue(AmqpConfig.createRetryQueue(retryQueueName, queueName));
        amqpAdmin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(kind.getWireName()));

        HandlerInvoker invoker = new HandlerInvoker(queueName, handler, properties.getHandlerDeadline());
        EnvelopeMessageListener listener = new EnvelopeMessageListener(queueName, retryQueueName, codec, invoker,
                redeliveryPolicy, metrics);

        SimpleMessageListenerContainer container = createContainer(queueName);
        container.setMessageListener(listener);
        container.start();

        RabbitSubscription subscription = new RabbitSubscription(kind, queueName, container, invoker);
        subscriptions.add(subscription);
        log.info("Subscribed to {} on queue {}", kind, queueName);
        return subscription;
    }

    protected SimpleMessageListenerContainer createContainer(String queueName) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(queueName);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setConcurrentConsumers(1);
        container.setPrefetchCount(1);

        ExponentialBackOff backOff = new ExponentialBackOff(
                properties.getReconnectInitialInterval().toMillis(), properties.getReconnectMultiplier());
        backOff.setMaxInterval(properties.getReconnectMaxInterval().toMillis());
        container.setRecoveryBackOff(backOff);
        return container;
    }

    @Override
    public void destroy() {
        subscriptions.forEach(RabbitSubscription::cancel);
    }

    private class RabbitSubscription implements Subscription {

        private final EventKind kind;
        private final String queueName;
        private final SimpleMessageListenerContainer container;
        private final HandlerInvoker invoker;
        private volatile boolean cancelled;

        RabbitSubscription(EventKind kind, String queueName, SimpleMessageListenerContainer container,
                HandlerInvoker invoker) {
            this.kind = kind;
            this.queueName = queueName;
            this.container = container;
            this.invoker = invoker;
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
            subscriptions.remove(this);
            // stop() waits for the in-flight delivery to be acked
            container.stop();
            invoker.close();
            log.info("Unsubscribed from {} on queue {}", kind, queueName);
        }
    }
}
