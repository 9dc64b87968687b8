package com.rideflow.tripservice.service;

import com.rideflow.common.model.GeoPoint;
import com.rideflow.tripservice.config.MatchingProperties;
import com.rideflow.tripservice.exception.DriverNoLongerAvailableException;
import com.rideflow.tripservice.model.Driver;
import com.rideflow.tripservice.model.DriverSnapshot;
import com.rideflow.tripservice.repository.InMemoryDriverRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
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

@DisplayName("DriverAvailabilityTracker Unit Tests")
class DriverAvailabilityTrackerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryDriverRepository driverRepository;
    private DriverAvailabilityTracker tracker;

    @BeforeEach
    void setUp() {
        driverRepository = new InMemoryDriverRepository();
        MatchingProperties properties = new MatchingProperties();
        properties.setDefaultRating(4.5);
        tracker = new DriverAvailabilityTracker(driverRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void availableDriver(String driverId) {
        tracker.register(driverId, "Driver " + driverId, 4.8);
        tracker.markAvailable(driverId, GeoPoint.of(0.0, 0.1));
    }

    @Nested
    @DisplayName("availability Tests")
    class AvailabilityTests {

        @Test
        @DisplayName("should keep a registered driver unavailable until announced")
        void shouldKeepRegisteredDriverUnavailable() {
            tracker.register("D1", "Ada", 4.8);

            assertThat(tracker.snapshot()).isEmpty();
            assertThat(tracker.findDriver("D1")).get().extracting(DriverSnapshot::getRating).isEqualTo(4.8);
        }

        @Test
        @DisplayName("should list available drivers in the snapshot")
        void shouldListAvailableDrivers() {
            availableDriver("D1");

            List<DriverSnapshot> snapshot = tracker.snapshot();

            assertThat(snapshot).hasSize(1);
            assertThat(snapshot.get(0).getDriverId()).isEqualTo("D1");
            assertThat(snapshot.get(0).getLocation()).isEqualTo(GeoPoint.of(0.0, 0.1));
            assertThat(snapshot.get(0).getAvailableSince()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should register unknown drivers with the default rating")
        void shouldRegisterUnknownDriverWithDefaultRating() {
            assertThat(tracker.markAvailable("D7", GeoPoint.of(1.0, 1.0))).isTrue();

            assertThat(tracker.findDriver("D7")).get().extracting(DriverSnapshot::getRating).isEqualTo(4.5);
        }

        @Test
        @DisplayName("should remove a driver from the snapshot when unavailable")
        void shouldRemoveUnavailableDriver() {
            availableDriver("D1");

            assertThat(tracker.markUnavailable("D1")).isTrue();

            assertThat(tracker.snapshot()).isEmpty();
        }

        @Test
        @DisplayName("should report unknown drivers marked unavailable")
        void shouldReportUnknownDriverMarkedUnavailable() {
            assertThat(tracker.markUnavailable("nobody")).isFalse();
        }

        @Test
        @DisplayName("should write every change through to the repository")
        void shouldWriteThrough() {
            availableDriver("D1");

            Driver stored = driverRepository.loadDriver("D1").orElseThrow();

            assertThat(stored.isAvailable()).isTrue();
            assertThat(stored.getName()).isEqualTo("Driver D1");
        }

        @Test
        @DisplayName("should reload stored drivers on start")
        void shouldReloadStoredDrivers() {
            availableDriver("D1");
            DriverAvailabilityTracker restarted = new DriverAvailabilityTracker(driverRepository,
                    new MatchingProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

            restarted.loadDrivers();

            assertThat(restarted.snapshot()).extracting(DriverSnapshot::getDriverId).containsExactly("D1");
        }
    }

    @Nested
    @DisplayName("reservation Tests")
    class ReservationTests {

        @Test
        @DisplayName("should set the active trip and clear availability")
        void shouldReserveDriver() {
            availableDriver("D1");

            tracker.reserve("D1", "T1");

            DriverSnapshot driver = tracker.findDriver("D1").orElseThrow();
            assertThat(driver.isAvailable()).isFalse();
            assertThat(driver.getActiveTripId()).isEqualTo("T1");
            assertThat(tracker.snapshot()).isEmpty();
        }

        @Test
        @DisplayName("should refuse a driver already on a trip")
        void shouldRefuseDriverOnTrip() {
            availableDriver("D1");
            tracker.reserve("D1", "T1");

            assertThatThrownBy(() -> tracker.reserve("D1", "T2"))
                    .isInstanceOf(DriverNoLongerAvailableException.class)
                    .satisfies(e -> assertThat(((DriverNoLongerAvailableException) e).getDriverId()).isEqualTo("D1"));
            assertThat(tracker.findDriver("D1").orElseThrow().getActiveTripId()).isEqualTo("T1");
        }

        @Test
        @DisplayName("should refuse unknown and offline drivers")
        void shouldRefuseUnknownAndOfflineDrivers() {
            tracker.register("D2", "Offline", 4.0);

            assertThatThrownBy(() -> tracker.reserve("nobody", "T1"))
                    .isInstanceOf(DriverNoLongerAvailableException.class);
            assertThatThrownBy(() -> tracker.reserve("D2", "T1"))
                    .isInstanceOf(DriverNoLongerAvailableException.class);
        }

        @Test
        @DisplayName("should refuse availability while the driver is on a trip")
        void shouldRefuseAvailabilityDuringTrip() {
            availableDriver("D1");
            tracker.reserve("D1", "T1");

            assertThat(tracker.markAvailable("D1", GeoPoint.of(2.0, 2.0))).isFalse();

            DriverSnapshot driver = tracker.findDriver("D1").orElseThrow();
            assertThat(driver.isAvailable()).isFalse();
            assertThat(driver.getActiveTripId()).isEqualTo("T1");
        }

        @Test
        @DisplayName("should release a driver back to available")
        void shouldReleaseDriver() {
            availableDriver("D1");
            tracker.reserve("D1", "T1");

            assertThat(tracker.release("D1", "T1")).isTrue();

            DriverSnapshot driver = tracker.findDriver("D1").orElseThrow();
            assertThat(driver.isAvailable()).isTrue();
            assertThat(driver.getActiveTripId()).isNull();
        }

        @Test
        @DisplayName("should not release a driver from another trip")
        void shouldNotReleaseFromOtherTrip() {
            availableDriver("D1");
            tracker.reserve("D1", "T1");

            assertThat(tracker.release("D1", "T2")).isFalse();

            assertThat(tracker.findDriver("D1").orElseThrow().getActiveTripId()).isEqualTo("T1");
        }

        @Test
        @DisplayName("should let exactly one of many concurrent reservations win")
        void shouldLetOneConcurrentReservationWin() throws Exception {
            // Arrange
            availableDriver("D1");
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger wins = new AtomicInteger();
            AtomicInteger losses = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            // Act
            for (int i = 0; i < threads; i++) {
                String tripId = "T" + i;
                futures.add(executor.submit(() -> {
                    start.await(); // All threads start at the same time
                    try {
                        tracker.reserve("D1", tripId);
                        wins.incrementAndGet();
                    } catch (DriverNoLongerAvailableException e) {
                        losses.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Assert
            assertThat(wins.get()).isEqualTo(1);
            assertThat(losses.get()).isEqualTo(threads - 1);
            DriverSnapshot driver = tracker.findDriver("D1").orElseThrow();
            assertThat(driver.isAvailable()).isFalse();
            assertThat(driver.getActiveTripId()).isNotNull();
        }
    }
}
