package com.rideflow.common.schema;

import com.rideflow.common.event.EventKind;
import com.rideflow.common.event.EventPayload;
import lombok.Value;

/**
 * Result of a successful {@link SchemaValidator#validate} call: the resolved event kind
 * and its typed payload.
 */
@Value
public class ValidatedPayload {

    EventKind kind;
    EventPayload payload;
}
