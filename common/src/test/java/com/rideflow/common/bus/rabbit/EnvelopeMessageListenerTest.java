package com.rideflow.common.bus.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rideflow.common.bus.BusMetrics;
import com.rideflow.common.bus.EnvelopeCodec;
import com.rideflow.common.bus.HandlerInvoker;
import com.rideflow.common.bus.RedeliveryPolicy;
import com.rideflow.common.config.JacksonConfig;
import com.rideflow.common.contracts.TripStartedContract;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.event.EventKind;
import com.rideflow.common.schema.SchemaValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnvelopeMessageListener Unit Tests")
class EnvelopeMessageListenerTest {

    private static final String QUEUE = "q.trip-service.trip.started";
    private static final String RETRY_QUEUE = QUEUE + ".retry";
    private static final long TAG = 7L;

    @Mock
    private Channel channel;

    private EnvelopeCodec codec;
    private BusMetrics metrics;
    private HandlerInvoker invoker;
    private final List<EventEnvelope> handled = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
        SchemaValidator validator = new SchemaValidator(objectMapper,
                Validation.buildDefaultValidatorFactory().getValidator());
        codec = new EnvelopeCodec(objectMapper, validator);
        metrics = new BusMetrics(new SimpleMeterRegistry());
        invoker = new HandlerInvoker(QUEUE, envelope -> {
            handled.add(envelope);
            if (failing) {
                throw new IllegalStateException("handler broke");
            }
        }, Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private EnvelopeMessageListener listener() {
        return new EnvelopeMessageListener(QUEUE, RETRY_QUEUE, codec, invoker,
                new RedeliveryPolicy(2, Duration.ofMillis(100), Duration.ofSeconds(1)), metrics);
    }

    private Message message(byte[] body, Integer attempt) {
        MessageProperties properties = new MessageProperties();
        properties.setDeliveryTag(TAG);
        if (attempt != null) {
            properties.setHeader(RabbitEventBus.ATTEMPT_HEADER, attempt);
        }
        return new Message(body, properties);
    }

    private byte[] validBody() {
        return codec.encode(EventEnvelope.create(EventKind.TRIP_STARTED,
                TripStartedContract.builder().tripId("T1").build(), "corr-1", "driver-app", Clock.systemUTC()));
    }

    @Test
    @DisplayName("should ack after the handler completes")
    void shouldAckAfterHandlerCompletes() throws Exception {
        listener().onMessage(message(validBody(), 1), channel);

        verify(channel).basicAck(TAG, false);
        assertThat(handled).hasSize(1);
        assertThat(metrics.getAckedCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject malformed envelope to the DLQ without calling the handler")
    void shouldRejectMalformedEnvelope() throws Exception {
        listener().onMessage(message("{\"name\":\"trip.started\"}".getBytes(StandardCharsets.UTF_8), 1), channel);

        verify(channel).basicReject(TAG, false);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        assertThat(handled).isEmpty();
        assertThat(metrics.getSchemaRejectedCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should park a failed first delivery in the retry queue")
    void shouldParkFailedFirstDelivery() throws Exception {
        // Arrange
        failing = true;

        // Act
        listener().onMessage(message(validBody(), null), channel);

        // Assert
        ArgumentCaptor<AMQP.BasicProperties> captor = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq(RETRY_QUEUE), captor.capture(), any(byte[].class));
        verify(channel).basicAck(TAG, false);

        AMQP.BasicProperties retryProperties = captor.getValue();
        assertThat(retryProperties.getHeaders()).containsEntry(RabbitEventBus.ATTEMPT_HEADER, 2);
        assertThat(retryProperties.getExpiration()).isEqualTo("100");
        assertThat(retryProperties.getDeliveryMode()).isEqualTo(2);
        assertThat(metrics.getRequeuedCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject a failed second delivery into the DLX")
    void shouldDeadLetterFailedSecondDelivery() throws Exception {
        failing = true;

        listener().onMessage(message(validBody(), 2), channel);

        verify(channel).basicReject(TAG, false);
        verify(channel, never()).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class),
                any(byte[].class));
        assertThat(metrics.getDeadLetteredCount()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should requeue when the retry queue cannot be reached")
    void shouldRequeueWhenRetryPublishFails() throws Exception {
        // Arrange
        failing = true;
        doThrow(new IOException("channel closed")).when(channel)
                .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

        // Act
        listener().onMessage(message(validBody(), 1), channel);

        // Assert
        verify(channel).basicNack(TAG, false, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        assertThat(metrics.getRequeuedCount()).isZero();
    }

    @Test
    @DisplayName("should read the attempt header in any numeric form")
    void shouldReadAttemptHeader() {
        MessageProperties properties = new MessageProperties();
        assertThat(EnvelopeMessageListener.attemptOf(properties)).isEqualTo(1);

        properties.setHeader(RabbitEventBus.ATTEMPT_HEADER, 2L);
        assertThat(EnvelopeMessageListener.attemptOf(properties)).isEqualTo(2);

        properties.setHeader(RabbitEventBus.ATTEMPT_HEADER, "garbage");
        assertThat(EnvelopeMessageListener.attemptOf(properties)).isEqualTo(1);
    }
}
