package com.rideflow.tripservice.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TripLocks Unit Tests")
class TripLocksTest {

    private final TripLocks tripLocks = new TripLocks();

    @Test
    @DisplayName("should serialize actions on the same trip")
    void shouldSerializeSameTrip() throws Exception {
        // Arrange
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // Act
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return tripLocks.withLock("T1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    inside.decrementAndGet();
                    return null;
                });
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Assert
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(tripLocks.activeLockCount()).isZero();
    }

    @Test
    @DisplayName("should let different trips run in parallel")
    void shouldRunDifferentTripsInParallel() throws Exception {
        // Arrange
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        // Act
        Future<Boolean> first = executor.submit(() -> tripLocks.withLock("T1", () -> awaitQuietly(bothInside)));
        Future<Boolean> second = executor.submit(() -> tripLocks.withLock("T2", () -> awaitQuietly(bothInside)));

        // Assert
        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
    }

    @Test
    @DisplayName("should be reentrant and release the lock after an exception")
    void shouldReleaseAfterException() {
        assertThatThrownBy(() -> tripLocks.withLock("T1", () -> tripLocks.withLock("T1", () -> {
            throw new IllegalStateException("boom");
        }))).isInstanceOf(IllegalStateException.class);

        assertThat(tripLocks.activeLockCount()).isZero();
        assertThat(tripLocks.withLock("T1", () -> "ok")).isEqualTo("ok");
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
