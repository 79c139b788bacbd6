package com.tazifor.routeplanner.service;

import com.tazifor.routeplanner.cluster.DbscanClusterer;
import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.util.GeoMath;
import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import com.tazifor.routeplanner.model.CustomerLocation;
import com.tazifor.routeplanner.model.RecommendationDiagnostics;
import com.tazifor.routeplanner.model.RecommendationDiagnostics.EmptyReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RecommendationEngine - turns a customer snapshot into ranked visit groups
 *
 * PIPELINE:
 *   Eligible → Clustered → Scored → Trimmed → Ranked
 *
 * 1. ELIGIBILITY: valid coordinates and a next due date no later than
 *    today + daysAheadHorizon.
 * 2. DBSCAN with (clusterRadiusKm, minClusterSize), when there are at least
 *    minClusterSize eligible customers.
 * 3. RETRY: nothing found and at least 3 eligible → DBSCAN again at twice
 *    the radius.
 * 4. AREA FALLBACK: still nothing (or too few to cluster) → group by area
 *    name, groups of 2+ only, flagged {@code areaFallback}.
 * 5. SCORE every group; drop groups that are BOTH over the travel budget and
 *    over the size cap.
 * 6. TRIM groups over the size cap to the members nearest the centroid, then
 *    rescore. Trimmed-off members are not redistributed.
 * 7. RANK by score, best first; ties keep discovery order. Ids 0..n-1.
 *
 * FAILURE SEMANTICS:
 * Bad data never raises. Invalid coordinates and unresolvable dates are
 * filtered in step 1, empty input gives an empty list.
 *
 * Every call is independent: no state survives between invocations.
 */
@Slf4j
@Service
public class RecommendationEngine {

    static final int RETRY_MIN_ELIGIBLE = 3;
    static final double RETRY_RADIUS_FACTOR = 2.0;
    static final int AREA_GROUP_MIN_SIZE = 2;

    private final DbscanClusterer clusterer;
    private final EfficiencyScorer scorer;
    private final DueDateResolver dueDates;
    private final Clock clock;

    public RecommendationEngine(DbscanClusterer clusterer, EfficiencyScorer scorer,
                                DueDateResolver dueDates, Clock clock) {
        this.clusterer = clusterer;
        this.scorer = scorer;
        this.dueDates = dueDates;
        this.clock = clock;
    }

    /**
     * Ranked recommendations for today, per the engine clock.
     */
    public List<Cluster> generateRecommendations(List<CustomerLocation> snapshot,
                                                 ClusterParameters params, LatLon depot) {
        return generateRecommendations(snapshot, params, depot, LocalDate.now(clock));
    }

    /**
     * Ranked recommendations relative to {@code today}.
     *
     * @param snapshot customer records; read only, nulls skipped
     * @param params   tuning parameters
     * @param depot    trip start/end used for travel estimates
     * @param today    reference date for eligibility and the overdue split
     * @return clusters ranked best first, possibly empty
     * @throws IllegalArgumentException if the depot is not a valid coordinate
     */
    public List<Cluster> generateRecommendations(List<CustomerLocation> snapshot, ClusterParameters params,
                                                 LatLon depot, LocalDate today) {
        if (depot == null || !depot.isValid())
            throw new IllegalArgumentException("depot must be a valid coordinate, got: " + depot);

        List<CustomerLocation> eligible = eligibleCustomers(snapshot, params, today);
        log.debug("{} of {} customers eligible within {} days",
            eligible.size(), snapshot == null ? 0 : snapshot.size(), params.daysAheadHorizon());

        if (eligible.isEmpty()) {
            return List.of();
        }

        List<List<CustomerLocation>> groups = List.of();
        boolean areaFallback = false;

        if (eligible.size() >= params.minClusterSize()) {
            groups = clusterer.cluster(eligible, params.clusterRadiusKm(), params.minClusterSize()).clusters();
            log.debug("DBSCAN found {} clusters at {} km", groups.size(), params.clusterRadiusKm());

            if (groups.isEmpty() && eligible.size() >= RETRY_MIN_ELIGIBLE) {
                double widened = params.clusterRadiusKm() * RETRY_RADIUS_FACTOR;
                log.debug("No clusters, retrying at {} km", widened);
                groups = clusterer.cluster(eligible, widened, params.minClusterSize()).clusters();
            }
        }

        if (groups.isEmpty()) {
            groups = groupByArea(eligible);
            areaFallback = true;
            log.info("Falling back to area grouping: {} area groups from {} customers",
                groups.size(), eligible.size());
        }

        List<Cluster> kept = new ArrayList<>();
        for (List<CustomerLocation> group : groups) {
            Optional<Cluster> scored = scorer.score(group, depot, params, today);
            if (scored.isEmpty()) continue;
            Cluster cluster = scored.get();
            cluster.setAreaFallback(areaFallback);

            if (cluster.getEstimatedTravelMinutes() > params.maxTravelMinutes()
                && cluster.getMemberCount() > params.maxCustomersPerCluster()) {
                log.debug("Discarding cluster of {} customers, {} min over budget",
                    cluster.getMemberCount(), cluster.getEstimatedTravelMinutes());
                continue;
            }

            if (cluster.getMemberCount() > params.maxCustomersPerCluster()) {
                Optional<Cluster> trimmed = trim(cluster, depot, params, today);
                if (trimmed.isEmpty()) continue;
                cluster = trimmed.get();
            }
            kept.add(cluster);
        }

        return rank(kept);
    }

    /**
     * Customers with a valid location whose next due date falls on or before
     * {@code today + daysAheadHorizon}. Input order is preserved.
     */
    public List<CustomerLocation> eligibleCustomers(List<CustomerLocation> snapshot,
                                                    ClusterParameters params, LocalDate today) {
        if (snapshot == null) {
            return List.of();
        }
        LocalDate horizon = today.plusDays(params.daysAheadHorizon());
        List<CustomerLocation> out = new ArrayList<>();
        for (CustomerLocation c : snapshot) {
            if (c == null || !c.hasValidLocation()) continue;
            Optional<LocalDate> due = dueDates.resolve(c);
            if (due.isPresent() && !due.get().isAfter(horizon)) {
                out.add(c);
            }
        }
        return out;
    }

    /**
     * Funnel counts for {@code snapshot} and why {@code result} is empty, if it is.
     */
    public RecommendationDiagnostics diagnose(List<CustomerLocation> snapshot, ClusterParameters params,
                                              LocalDate today, List<Cluster> result) {
        int total = 0, withLocation = 0, withDate = 0;
        if (snapshot != null) {
            for (CustomerLocation c : snapshot) {
                if (c == null) continue;
                total++;
                if (c.hasValidLocation()) withLocation++;
                if (dueDates.resolve(c).isPresent()) withDate++;
            }
        }
        int eligible = eligibleCustomers(snapshot, params, today).size();

        EmptyReason reason;
        if (!result.isEmpty()) reason = EmptyReason.NONE;
        else if (total == 0) reason = EmptyReason.NO_CUSTOMERS;
        else if (withLocation == 0) reason = EmptyReason.NO_COORDINATES;
        else if (withDate == 0) reason = EmptyReason.NO_DUE_DATES;
        else if (eligible == 0) reason = EmptyReason.NONE_DUE_WITHIN_HORIZON;
        else if (eligible < params.minClusterSize()) reason = EmptyReason.TOO_FEW_ELIGIBLE;
        else reason = EmptyReason.NO_GROUPING_FOUND;

        return new RecommendationDiagnostics(total, withLocation, withDate, eligible, result.size(), reason);
    }

    // area name → members, groups of at least two, first-seen area order
    List<List<CustomerLocation>> groupByArea(List<CustomerLocation> eligible) {
        Map<String, List<CustomerLocation>> byArea = new LinkedHashMap<>();
        for (CustomerLocation c : eligible) {
            byArea.computeIfAbsent(EfficiencyScorer.areaKey(c), k -> new ArrayList<>()).add(c);
        }
        List<List<CustomerLocation>> out = new ArrayList<>();
        for (List<CustomerLocation> members : byArea.values()) {
            if (members.size() >= AREA_GROUP_MIN_SIZE) {
                out.add(members);
            }
        }
        return out;
    }

    private Optional<Cluster> trim(Cluster cluster, LatLon depot, ClusterParameters params, LocalDate today) {
        LatLon centroid = cluster.getCentroid();
        List<CustomerLocation> nearest = new ArrayList<>(cluster.getMembers());
        nearest.sort(Comparator.comparingDouble(c -> GeoMath.distanceKm(c.getLocation(), centroid)));
        List<CustomerLocation> keep = nearest.subList(0, params.maxCustomersPerCluster());

        log.debug("Trimming cluster in {} from {} to {} customers",
            cluster.getPrimaryAreaName(), cluster.getMemberCount(), keep.size());

        Optional<Cluster> rescored = scorer.score(keep, depot, params, today);
        rescored.ifPresent(c -> {
            c.setAreaFallback(cluster.isAreaFallback());
            c.setTrimmed(true);
        });
        return rescored;
    }

    private List<Cluster> rank(List<Cluster> clusters) {
        List<Cluster> ranked = new ArrayList<>(clusters);
        // List.sort is stable: equal scores keep discovery order
        ranked.sort(Comparator.comparingInt(Cluster::getEfficiencyScore).reversed());
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setId(i);
        }
        return ranked;
    }
}
