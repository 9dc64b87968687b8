package com.rideflow.tripservice.exception;

/**
 * Exception thrown when a matched driver was claimed or went offline between the
 * availability snapshot and the reservation.
 */
public class DriverNoLongerAvailableException extends RuntimeException {

    private final String driverId;

    public DriverNoLongerAvailableException(String driverId, String message) {
        super(message);
        this.driverId = driverId;
    }

    public String getDriverId() {
        return driverId;
    }
}
