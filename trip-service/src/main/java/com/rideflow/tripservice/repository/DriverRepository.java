package com.rideflow.tripservice.repository;

import com.rideflow.tripservice.model.Driver;

import java.util.List;
import java.util.Optional;

public interface DriverRepository {

    Driver saveDriver(Driver driver);

    Optional<Driver> loadDriver(String driverId);

    List<Driver> findAll();
}
