package com.tazifor.routeplanner.model;

import com.tazifor.routeplanner.geo.model.LatLon;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cluster Model
 *
 * A recommended group of customers to visit in one trip, with its travel
 * estimate and efficiency score. Built fresh on every recommendation run and
 * never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {

    // ===== Identity =====
    private Integer id;                     // rank position, assigned last

    // ===== Members =====
    private List<CustomerLocation> members;
    private LatLon centroid;
    private String primaryAreaName;
    private Set<String> categories;
    private int overdueCount;               // due before today
    private int upcomingCount;              // due today or later

    // ===== Estimates =====
    private int efficiencyScore;            // 0..100
    private int estimatedTravelMinutes;
    private int estimatedKm;
    private double density;                 // members per km²
    private double avgRadiusFromCentroidKm;
    private double distanceFromDepotKm;

    // ===== Provenance =====
    private boolean areaFallback;           // grouped by area name, not DBSCAN
    private boolean trimmed;                // cut down to maxCustomersPerCluster
    private boolean matrixBased;            // estimates refined from a travel matrix

    public int getMemberCount() {
        return members == null ? 0 : members.size();
    }

    public EfficiencyTier getEfficiencyTier() {
        return EfficiencyTier.of(efficiencyScore);
    }

    /**
     * Member ids in member order, for handing the group to a route optimizer.
     */
    public List<String> memberIds() {
        return members.stream().map(CustomerLocation::getId).collect(Collectors.toList());
    }

    public List<LatLon> memberLocations() {
        return members.stream().map(CustomerLocation::getLocation).collect(Collectors.toList());
    }
}
