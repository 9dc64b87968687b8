package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.Driver;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDriverRepository implements DriverRepository {

    private final Map<String, Driver> drivers = new ConcurrentHashMap<>();

    @Override
    public Driver saveDriver(Driver driver) {
        drivers.put(driver.getId(), driver.copy());
        return driver;
    }

    @Override
    public Optional<Driver> loadDriver(String driverId) {
        return Optional.ofNullable(drivers.get(driverId)).map(Driver::copy);
    }

    @Override
    public List<Driver> findAll() {
        return drivers.values().stream().map(Driver::copy).toList();
    }
}
