package com.rideflow.common.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural validation of event payloads against the contract registered for each
 * {@link EventKind}: JSON shape, scalar types (no string-to-number coercion), enum
 * membership, required fields and value ranges.
 *
 * Used on both sides of the bus: outgoing payloads are checked before they reach the
 * wire and incoming payloads before any subscriber sees them. Stateless.
 */
@Component
public class SchemaValidator {

    private final ObjectMapper strictMapper;
    private final Validator validator;

    public SchemaValidator(ObjectMapper objectMapper, Validator validator) {
        this.strictMapper = objectMapper.copy();
        this.validator = validator;

        // "12.5" is not a number on our wire
        for (LogicalType numeric : new LogicalType[] { LogicalType.Integer, LogicalType.Float,
                LogicalType.Boolean }) {
            strictMapper.coercionConfigFor(numeric)
                    .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        }
        strictMapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        strictMapper.enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS);
        strictMapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    }

    /**
     * Validates a raw payload received for {@code eventName}.
     *
     * @throws UnknownEventKindException if the event name is not registered
     * @throws SchemaException           if the payload does not match the schema
     */
    public ValidatedPayload validate(String eventName, JsonNode rawPayload) {
        EventKind kind = EventKind.fromWireName(eventName);

        if (rawPayload == null || !rawPayload.isObject()) {
            throw new SchemaException(eventName, "Payload must be a JSON object");
        }

        EventPayload payload;
        try {
            payload = strictMapper.treeToValue(rawPayload, kind.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new SchemaException(eventName, describe(e), e);
        }

        checkConstraints(kind, payload);
        return new ValidatedPayload(kind, payload);
    }

    /**
     * Validates a typed payload on the publish path.
     *
     * @throws SchemaException if the payload type does not belong to {@code kind} or
     *                         violates its constraints
     */
    public void validateOutgoing(EventKind kind, EventPayload payload) {
        if (payload == null) {
            throw new SchemaException(kind.getWireName(), "Payload is required");
        }
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new SchemaException(kind.getWireName(), String.format(
                    "Payload type %s does not match event %s (expected %s)",
                    payload.getClass().getSimpleName(), kind.getWireName(),
                    kind.getPayloadType().getSimpleName()));
        }
        checkConstraints(kind, payload);
    }

    private void checkConstraints(EventKind kind, EventPayload payload) {
        Set<ConstraintViolation<EventPayload>> violations = validator.validate(payload);
        if (violations.isEmpty()) {
            return;
        }

        String details = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> "'" + v.getPropertyPath() + "' " + v.getMessage())
                .collect(Collectors.joining(", "));
        throw new SchemaException(kind.getWireName(), "Invalid payload: " + details);
    }

    private String describe(JsonProcessingException e) {
        if (e instanceof JsonMappingException mappingException && !mappingException.getPath().isEmpty()) {
            String field = mappingException.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                    .collect(Collectors.joining("."));
            return "Invalid payload: '" + field + "' " + e.getOriginalMessage();
        }
        return "Invalid payload: " + e.getOriginalMessage();
    }
}
