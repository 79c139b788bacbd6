package com.tazifor.routeplanner.config;

import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.model.ClusterParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Route Planner Configuration
 *
 * Default tuning parameters, depot location and the clock that defines
 * "today". Callers may override parameters and depot per request.
 */
@Slf4j
@Configuration
public class RoutePlannerConfig {

    @Value("${routeplanner.defaults.days-ahead:60}")
    private int daysAhead;

    @Value("${routeplanner.defaults.max-customers-per-cluster:15}")
    private int maxCustomersPerCluster;

    @Value("${routeplanner.defaults.max-travel-minutes:480}")
    private int maxTravelMinutes;

    @Value("${routeplanner.defaults.min-cluster-size:3}")
    private int minClusterSize;

    @Value("${routeplanner.defaults.cluster-radius-km:5.0}")
    private double clusterRadiusKm;

    @Value("${routeplanner.defaults.service-minutes-per-stop:30}")
    private int serviceMinutesPerStop;

    @Value("${routeplanner.depot.lat}")
    private double depotLat;

    @Value("${routeplanner.depot.lon}")
    private double depotLon;

    @Value("${routeplanner.time-zone:UTC}")
    private String timeZone;

    @Bean
    public ClusterParameters defaultClusterParameters() {
        ClusterParameters params = new ClusterParameters(
            daysAhead,
            maxCustomersPerCluster,
            maxTravelMinutes,
            minClusterSize,
            clusterRadiusKm,
            serviceMinutesPerStop
        );
        log.info("Default cluster parameters: {}", params);
        return params;
    }

    @Bean
    public LatLon depotLocation() {
        LatLon depot = LatLon.of(depotLat, depotLon);
        if (!depot.isValid())
            throw new IllegalArgumentException("routeplanner.depot is not a valid coordinate: " + depot);
        log.info("Depot at {}, {}", depot.lat(), depot.lon());
        return depot;
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timeZone));
    }
}
