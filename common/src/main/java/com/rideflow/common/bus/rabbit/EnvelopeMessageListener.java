package com.rideflow.common.bus.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rideflow.common.bus.BusMetrics;
import com.rideflow.common.bus.EnvelopeCodec;
import com.rideflow.common.bus.HandlerFailedException;
import com.rideflow.common.bus.HandlerInvoker;
import com.rideflow.common.bus.RedeliveryPolicy;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.schema.SchemaException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Decodes, dispatches and acknowledges one delivery of a subscription queue.
 */
@Slf4j
class EnvelopeMessageListener implements ChannelAwareMessageListener {

    private final String queueName;
    private final String retryQueueName;
    private final EnvelopeCodec codec;
    private final HandlerInvoker invoker;
    private final RedeliveryPolicy redeliveryPolicy;
    private final BusMetrics metrics;

    EnvelopeMessageListener(String queueName, String retryQueueName, EnvelopeCodec codec, HandlerInvoker invoker,
            RedeliveryPolicy redeliveryPolicy, BusMetrics metrics) {
        this.queueName = queueName;
        this.retryQueueName = retryQueueName;
        this.codec = codec;
        this.invoker = invoker;
        this.redeliveryPolicy = redeliveryPolicy;
        this.metrics = metrics;
    }

    @Override
    public void onMessage(Message message, Channel channel) throws Exception {
        MessageProperties messageProperties = message.getMessageProperties();
        long deliveryTag = messageProperties.getDeliveryTag();
        int attempt = attemptOf(messageProperties);

        EventEnvelope envelope;
        try {
            envelope = codec.decode(message.getBody());
        } catch (SchemaException e) {
            log.warn("Rejecting malformed envelope on {}: event={}, error={}",
                    queueName, e.getEventName(), e.getMessage());
            metrics.recordSchemaRejected();
            channel.basicReject(deliveryTag, false);
            return;
        }

        MDC.put(HandlerInvoker.CORRELATION_ID_MDC_KEY, envelope.getCorrelationId());
        try {
            invoker.invoke(envelope);
            channel.basicAck(deliveryTag, false);
            metrics.recordAcked();
        } catch (HandlerFailedException e) {
            if (redeliveryPolicy.shouldDeadLetter(attempt)) {
                log.error("Handler failed on final delivery, dead-lettering. queue={}, envelopeId={}, attempt={}",
                        queueName, envelope.getId(), attempt, e);
                channel.basicReject(deliveryTag, false);
                metrics.recordDeadLettered();
            } else {
                scheduleRetry(message, envelope, attempt, channel, e);
            }
        } finally {
            MDC.remove(HandlerInvoker.CORRELATION_ID_MDC_KEY);
        }
    }

    private void scheduleRetry(Message message, EventEnvelope envelope, int attempt, Channel channel,
            HandlerFailedException failure) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        Duration delay = redeliveryPolicy.delayAfter(attempt);

        Map<String, Object> headers = new HashMap<>();
        headers.put(RabbitEventBus.ATTEMPT_HEADER, attempt + 1);
        AMQP.BasicProperties retryProperties = new AMQP.BasicProperties.Builder()
                .contentType(MessageProperties.CONTENT_TYPE_JSON)
                .deliveryMode(2)
                .messageId(envelope.getId())
                .correlationId(envelope.getCorrelationId())
                .headers(headers)
                .expiration(String.valueOf(delay.toMillis()))
                .build();

        try {
            channel.basicPublish("", retryQueueName, retryProperties, message.getBody());
        } catch (IOException e) {
            // Could not park it: let the broker hand the same delivery back
            log.error("Could not park envelope {} in {}, requeueing", envelope.getId(), retryQueueName, e);
            channel.basicNack(deliveryTag, false, true);
            return;
        }
        channel.basicAck(deliveryTag, false);
        metrics.recordRequeued();
        log.warn("Handler failed, redelivering in {} ms. queue={}, envelopeId={}, attempt={}, error={}",
                delay.toMillis(), queueName, envelope.getId(), attempt, failure.getMessage());
    }

    static int attemptOf(MessageProperties messageProperties) {
        Object header = messageProperties.getHeader(RabbitEventBus.ATTEMPT_HEADER);
        if (header instanceof Number number) {
            return Math.max(1, number.intValue());
        }
        if (header != null) {
            try {
                return Math.max(1, Integer.parseInt(header.toString()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable {} header: {}", RabbitEventBus.ATTEMPT_HEADER, header);
            }
        }
        return 1;
    }
}
