package com.rideflow.common.bus.rabbit;

import com.rideflow.common.bus.BusMetrics;
import com.rideflow.common.bus.EnvelopeCodec;
import com.rideflow.common.bus.EventBus;
import com.rideflow.common.bus.EventBusProperties;
import com.rideflow.common.schema.SchemaValidator;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * RabbitMQ topology and the broker-backed {@link EventBus}.
 * Per-subscription queues are declared by {@link RabbitEventBus#subscribe} because
 * their names depend on the subscribing service.
 */
@Configuration
@ConditionalOnProperty(prefix = "rideflow.bus", name = "mode", havingValue = "rabbit", matchIfMissing = true)
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange eventsExchange(EventBusProperties properties) {
        return new TopicExchange(properties.getExchange());
    }

    @Bean
    public RabbitEventBus rabbitEventBus(RabbitTemplate rabbitTemplate, AmqpAdmin amqpAdmin,
            ConnectionFactory connectionFactory, EnvelopeCodec codec, SchemaValidator schemaValidator,
            EventBusProperties properties, BusMetrics metrics, Clock clock) {
        return new RabbitEventBus(rabbitTemplate, amqpAdmin, connectionFactory, codec, schemaValidator,
                properties, metrics, clock);
    }

    // Rejected envelopes go to the DLX
    static Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }

    // Holds an envelope until its per-message TTL expires, then routes it back to the main queue
    static Queue createRetryQueue(String retryQueueName, String mainQueueName) {
        return QueueBuilder.durable(retryQueueName)
                .withArgument("x-dead-letter-exchange", "")
                .withArgument("x-dead-letter-routing-key", mainQueueName)
                .build();
    }
}
