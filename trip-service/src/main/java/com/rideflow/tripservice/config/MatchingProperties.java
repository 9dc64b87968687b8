package com.rideflow.tripservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "rideflow.matching")
public class MatchingProperties {

    // Optional pickup radius; unset means every available driver is a candidate
    private Double maxPickupDistanceKm;

    // Rating given to drivers that announce availability before registering
    private double defaultRating = 4.5;
}
