package com.tazifor.routeplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Route Planner - visit-group recommendations for field technicians
 *
 * Clusters customers that are due for a periodic visit by location, estimates
 * the trip for each group and ranks the groups by efficiency:
 * - Grid-accelerated DBSCAN clustering
 * - Radius-doubling retry and area-name fallback
 * - Straight-line travel model with a 0-100 efficiency score
 * - Convex-hull boundaries for map display
 */
@SpringBootApplication
public class RoutePlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutePlannerApplication.class, args);
    }
}
