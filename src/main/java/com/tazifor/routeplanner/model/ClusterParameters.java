package com.tazifor.routeplanner.model;

import lombok.With;

/**
 * Tuning knobs for one recommendation run.
 * <p>
 * Passed explicitly into every call; the engine keeps no tuning state of its
 * own. Invalid combinations are rejected here so the engine never has to
 * guard against them.
 * </p>
 *
 * @param daysAheadHorizon          customers due within this many days are eligible
 * @param maxCustomersPerCluster    larger clusters are trimmed to this size
 * @param maxTravelMinutes          travel budget used by the discard rule
 * @param minClusterSize            DBSCAN minPts, and the minimum eligible count for clustering
 * @param clusterRadiusKm           DBSCAN epsilon in km
 * @param serviceTimeMinutesPerStop time spent at each customer
 */
@With
public record ClusterParameters(
    int daysAheadHorizon,
    int maxCustomersPerCluster,
    int maxTravelMinutes,
    int minClusterSize,
    double clusterRadiusKm,
    int serviceTimeMinutesPerStop
) {

    public static final int DEFAULT_DAYS_AHEAD = 60;
    public static final int DEFAULT_MAX_CUSTOMERS = 15;
    public static final int DEFAULT_MAX_TRAVEL_MINUTES = 480;
    public static final int DEFAULT_MIN_CLUSTER_SIZE = 3;
    public static final double DEFAULT_CLUSTER_RADIUS_KM = 5.0;
    public static final int DEFAULT_SERVICE_MINUTES = 30;

    public ClusterParameters {
        if (!(clusterRadiusKm > 0) || !Double.isFinite(clusterRadiusKm))
            throw new IllegalArgumentException("clusterRadiusKm must be > 0, got: " + clusterRadiusKm);
        if (minClusterSize < 1)
            throw new IllegalArgumentException("minClusterSize must be >= 1, got: " + minClusterSize);
        if (maxCustomersPerCluster < 2)
            throw new IllegalArgumentException("maxCustomersPerCluster must be >= 2, got: " + maxCustomersPerCluster);
        if (daysAheadHorizon < 0)
            throw new IllegalArgumentException("daysAheadHorizon must be >= 0, got: " + daysAheadHorizon);
        if (maxTravelMinutes <= 0)
            throw new IllegalArgumentException("maxTravelMinutes must be > 0, got: " + maxTravelMinutes);
        if (serviceTimeMinutesPerStop < 0)
            throw new IllegalArgumentException("serviceTimeMinutesPerStop must be >= 0, got: " + serviceTimeMinutesPerStop);
    }

    public static ClusterParameters defaults() {
        return new ClusterParameters(
            DEFAULT_DAYS_AHEAD,
            DEFAULT_MAX_CUSTOMERS,
            DEFAULT_MAX_TRAVEL_MINUTES,
            DEFAULT_MIN_CLUSTER_SIZE,
            DEFAULT_CLUSTER_RADIUS_KM,
            DEFAULT_SERVICE_MINUTES
        );
    }
}
