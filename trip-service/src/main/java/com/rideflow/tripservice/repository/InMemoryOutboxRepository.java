package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.OutboxEvent;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryOutboxRepository implements OutboxRepository {

    private final Map<Long, OutboxEvent> events = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public OutboxEvent save(OutboxEvent event) {
        if (event.getSequence() == null) {
            event.setSequence(sequence.incrementAndGet());
        }
        events.put(event.getSequence(), event.copy());
        return event;
    }

    @Override
    public List<OutboxEvent> findPending(int limit) {
        List<OutboxEvent> pending = new ArrayList<>();
        for (OutboxEvent event : events.values()) {
            if (pending.size() >= limit) {
                break;
            }
            if (!event.isProcessed() && !event.isFailed()) {
                pending.add(event.copy());
            }
        }
        return pending;
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        int removed = 0;
        Iterator<OutboxEvent> iterator = events.values().iterator();
        while (iterator.hasNext()) {
            OutboxEvent event = iterator.next();
            if ((event.isProcessed() || event.isFailed()) && event.getCreatedAt().isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }
}
