package com.tazifor.routeplanner.service;

import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Replaces straight-line travel estimates with road-network figures when a
 * {@link TravelMatrixProvider} is available.
 *
 * REFINED ESTIMATES:
 *   minutes = round(avg depot→member seconds / 60) × 2 + members × service minutes
 *   km      = round(avg depot→member metres / 1000 × 2)
 *
 * Only clusters of 2..24 members are sent (matrix APIs cap a request at 25
 * coordinates, depot included). The efficiency score is left alone so the
 * ranking does not change. A failing provider leaves the cluster untouched.
 */
@Slf4j
@Service
public class TravelMatrixRefiner {

    public static final int MAX_DESTINATIONS = 24;

    private final Optional<TravelMatrixProvider> provider;

    public TravelMatrixRefiner(Optional<TravelMatrixProvider> provider) {
        this.provider = provider;
    }

    public boolean isAvailable() {
        return provider.isPresent();
    }

    /**
     * Refines every cluster in place.
     *
     * @return number of clusters that received matrix-based estimates
     */
    public int refineAll(List<Cluster> clusters, LatLon depot, ClusterParameters params) {
        int refined = 0;
        for (Cluster cluster : clusters) {
            if (refine(cluster, depot, params)) refined++;
        }
        return refined;
    }

    /**
     * Refines one cluster in place.
     *
     * @return true if the estimates were replaced
     */
    public boolean refine(Cluster cluster, LatLon depot, ClusterParameters params) {
        if (provider.isEmpty()) return false;
        int n = cluster.getMemberCount();
        if (n < 2 || n > MAX_DESTINATIONS) return false;

        TravelMatrix matrix;
        try {
            Optional<TravelMatrix> answer = provider.get().fromDepot(depot, cluster.memberLocations());
            if (answer.isEmpty()) return false;
            matrix = answer.get();
        } catch (RuntimeException e) {
            log.warn("Travel matrix lookup failed for cluster in {}: {}",
                cluster.getPrimaryAreaName(), e.getMessage());
            return false;
        }

        OptionalDouble seconds = average(matrix.durationsSeconds());
        if (seconds.isEmpty()) return false;

        long roundTripMinutes = Math.round(seconds.getAsDouble() / 60) * 2;
        cluster.setEstimatedTravelMinutes((int) (roundTripMinutes + (long) n * params.serviceTimeMinutesPerStop()));

        OptionalDouble meters = average(matrix.distancesMeters());
        if (meters.isPresent()) {
            cluster.setEstimatedKm((int) Math.round(meters.getAsDouble() / 1000 * 2));
        }

        cluster.setMatrixBased(true);
        return true;
    }

    // mean of the positive, non-null entries
    private OptionalDouble average(List<Double> values) {
        if (values == null) return OptionalDouble.empty();
        return values.stream()
            .filter(Objects::nonNull)
            .filter(v -> v > 0)
            .mapToDouble(Double::doubleValue)
            .average();
    }
}
