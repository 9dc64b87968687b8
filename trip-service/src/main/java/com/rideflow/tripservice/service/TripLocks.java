package com.rideflow.tripservice.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-trip mutual exclusion. Every state change of one trip runs under that trip's
 * lock; different trips proceed in parallel. A lock lives only while some thread holds
 * or waits for it.
 */
@Component
public class TripLocks {

    private final ConcurrentHashMap<String, RefCountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String tripId, Supplier<T> action) {
        RefCountedLock lock = locks.compute(tripId, (id, existing) -> {
            RefCountedLock held = existing != null ? existing : new RefCountedLock();
            held.references++;
            return held;
        });

        lock.lock.lock();
        try {
            return action.get();
        } finally {
            lock.lock.unlock();
            locks.computeIfPresent(tripId, (id, held) -> --held.references == 0 ? null : held);
        }
    }

    int activeLockCount() {
        return locks.size();
    }

    private static final class RefCountedLock {
        // Guarded by the map's per-key compute
        private int references;
        private final ReentrantLock lock = new ReentrantLock();
    }
}
