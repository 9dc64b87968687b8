package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.OutboxEvent;

import java.time.Instant;
import java.util.List;

public interface OutboxRepository {

    /**
     * Inserts the event (assigning the next sequence number) or updates it.
     */
    OutboxEvent save(OutboxEvent event);

    /**
     * Events neither processed nor failed, oldest sequence first.
     */
    List<OutboxEvent> findPending(int limit);

    /**
     * Removes processed and failed events created before the cutoff.
     *
     * @return number of events removed
     */
    int deleteFinishedBefore(Instant cutoff);
}
