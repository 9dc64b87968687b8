package com.rideflow.common.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rideflow.common.event.EventEnvelope;
import com.rideflow.common.schema.SchemaException;
import com.rideflow.common.schema.SchemaValidator;
import com.rideflow.common.schema.ValidatedPayload;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Wire format of an envelope:
 * <pre>
 * {"id":"…","name":"trip.requested","timestamp":"2026-01-01T00:00:00Z",
 *  "correlationId":"…","source":"trip-service","payload":{…}}
 * </pre>
 * Decoding validates the envelope fields and the payload schema; nothing that fails
 * here reaches a handler.
 */
@Component
public class EnvelopeCodec {

    private static final String UNKNOWN_EVENT = "<unknown>";

    private final ObjectMapper objectMapper;
    private final SchemaValidator schemaValidator;

    public EnvelopeCodec(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        this.objectMapper = objectMapper;
        this.schemaValidator = schemaValidator;
    }

    public byte[] encode(EventEnvelope envelope) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", envelope.getId());
        root.put("name", envelope.getEventName());
        root.put("timestamp", envelope.getTimestamp().toString());
        root.put("correlationId", envelope.getCorrelationId());
        root.put("source", envelope.getSource());
        root.set("payload", objectMapper.valueToTree(envelope.getPayload()));

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new SchemaException(envelope.getEventName(), "Envelope could not be serialized", e);
        }
    }

    /**
     * @throws SchemaException if the bytes are not a well-formed, schema-valid envelope
     */
    public EventEnvelope decode(byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SchemaException(UNKNOWN_EVENT, "Envelope is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaException(UNKNOWN_EVENT, "Envelope must be a JSON object");
        }

        String name = requiredText(root, "name", UNKNOWN_EVENT);
        String id = requiredText(root, "id", name);
        String correlationId = requiredText(root, "correlationId", name);
        String timestampText = requiredText(root, "timestamp", name);
        JsonNode sourceNode = root.get("source");

        Instant timestamp;
        try {
            timestamp = Instant.parse(timestampText);
        } catch (DateTimeParseException e) {
            throw new SchemaException(name, "Envelope timestamp is not ISO-8601 UTC: " + timestampText, e);
        }

        ValidatedPayload validated = schemaValidator.validate(name, root.get("payload"));

        return EventEnvelope.builder()
                .id(id)
                .kind(validated.getKind())
                .timestamp(timestamp)
                .correlationId(correlationId)
                .source(sourceNode != null && sourceNode.isTextual() ? sourceNode.asText() : null)
                .payload(validated.getPayload())
                .build();
    }

    private String requiredText(JsonNode root, String field, String eventName) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new SchemaException(eventName, "Envelope field '" + field + "' is required");
        }
        return node.asText();
    }
}
