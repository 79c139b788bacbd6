package com.tazifor.routeplanner.service;

import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.util.GeoMath;
import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import com.tazifor.routeplanner.model.CustomerLocation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * EfficiencyScorer - travel estimate and 0-100 score for a candidate group
 *
 * TRAVEL MODEL (straight-line, no road network):
 *   round trip depot ↔ centroid at 50 km/h
 * + intra-area driving: avgRadius × members × 1.5 detour at 30 km/h
 * + members × service minutes per stop
 *
 * SCORE:
 *   raw   = (density × members × 10) / (1 + depotKm × 0.05 + avgRadiusKm × 0.3)
 *   score = clamp(0, 100, round(raw × 10))
 *
 * The coefficients are fixed ranking constants. Changing any of them changes
 * which clusters are recommended first.
 */
@Component
public class EfficiencyScorer {

    static final double DEPOT_SPEED_KMH = 50.0;
    static final double LOCAL_SPEED_KMH = 30.0;
    static final double DETOUR_FACTOR = 1.5;

    static final double SCORE_SIZE_WEIGHT = 10.0;
    static final double SCORE_DEPOT_PENALTY = 0.05;
    static final double SCORE_SPREAD_PENALTY = 0.3;
    static final double SCORE_SCALE = 10.0;

    public static final String UNKNOWN_AREA = "Unknown";

    private final DueDateResolver dueDates;

    public EfficiencyScorer(DueDateResolver dueDates) {
        this.dueDates = dueDates;
    }

    /**
     * Scores a group of customers.
     *
     * @param members group members, all with valid locations
     * @param depot   trip start and end
     * @param params  supplies the service time per stop
     * @param today   reference date for the overdue split
     * @return the scored cluster, or empty for fewer than two members
     */
    public Optional<Cluster> score(List<CustomerLocation> members, LatLon depot,
                                   ClusterParameters params, LocalDate today) {
        int n = members.size();
        if (n < 2) {
            return Optional.empty();
        }

        List<LatLon> locations = members.stream()
            .map(CustomerLocation::getLocation)
            .collect(Collectors.toList());

        LatLon centroid = GeoMath.centroid(locations);
        double distanceFromDepot = GeoMath.distanceKm(depot, centroid);

        double radiusSum = 0;
        for (LatLon p : locations) {
            radiusSum += GeoMath.distanceKm(p, centroid);
        }
        double avgRadius = radiusSum / n;

        double density = n / GeoMath.boundingBoxAreaKm2(locations);

        double travelToCluster = (distanceFromDepot * 2 / DEPOT_SPEED_KMH) * 60;
        double intraClusterTravel = (avgRadius * n * DETOUR_FACTOR / LOCAL_SPEED_KMH) * 60;
        double serviceTime = (double) n * params.serviceTimeMinutesPerStop();
        int estimatedMinutes = (int) Math.round(travelToCluster + intraClusterTravel + serviceTime);

        int estimatedKm = (int) Math.round(distanceFromDepot * 2 + avgRadius * n * DETOUR_FACTOR);

        int overdue = 0;
        for (CustomerLocation c : members) {
            Optional<LocalDate> due = dueDates.resolve(c);
            if (due.isPresent() && due.get().isBefore(today)) {
                overdue++;
            }
        }

        return Optional.of(Cluster.builder()
            .members(List.copyOf(members))
            .centroid(centroid)
            .primaryAreaName(primaryArea(members))
            .categories(categories(members))
            .overdueCount(overdue)
            .upcomingCount(n - overdue)
            .efficiencyScore(efficiencyScore(density, n, distanceFromDepot, avgRadius))
            .estimatedTravelMinutes(estimatedMinutes)
            .estimatedKm(estimatedKm)
            .density(density)
            .avgRadiusFromCentroidKm(avgRadius)
            .distanceFromDepotKm(distanceFromDepot)
            .build());
    }

    /**
     * The ranking formula on its own, clamped to [0, 100].
     */
    public static int efficiencyScore(double density, int memberCount, double distanceFromDepotKm,
                                      double avgRadiusFromCentroidKm) {
        double raw = (density * memberCount * SCORE_SIZE_WEIGHT)
            / (1 + distanceFromDepotKm * SCORE_DEPOT_PENALTY + avgRadiusFromCentroidKm * SCORE_SPREAD_PENALTY);
        long scaled = Math.round(raw * SCORE_SCALE);
        return (int) Math.max(0, Math.min(100, scaled));
    }

    // most frequent area; first seen wins a tie
    private String primaryArea(List<CustomerLocation> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CustomerLocation c : members) {
            counts.merge(areaKey(c), 1, Integer::sum);
        }
        String best = UNKNOWN_AREA;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private Set<String> categories(List<CustomerLocation> members) {
        Set<String> out = new LinkedHashSet<>();
        for (CustomerLocation c : members) {
            if (c.getCategory() != null && !c.getCategory().isBlank()) {
                out.add(c.getCategory());
            }
        }
        return out;
    }

    static String areaKey(CustomerLocation c) {
        String area = c.getAreaName();
        return area == null || area.isBlank() ? UNKNOWN_AREA : area;
    }
}
