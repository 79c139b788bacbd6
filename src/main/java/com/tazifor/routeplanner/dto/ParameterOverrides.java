package com.tazifor.routeplanner.dto;

import com.tazifor.routeplanner.model.ClusterParameters;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial {@link ClusterParameters}: any field left null keeps the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterOverrides {

    private Integer daysAheadHorizon;
    private Integer maxCustomersPerCluster;
    private Integer maxTravelMinutes;
    private Integer minClusterSize;
    private Double clusterRadiusKm;
    private Integer serviceTimeMinutesPerStop;

    /**
     * Merges these overrides onto {@code base}.
     *
     * @throws IllegalArgumentException if the merged parameters are invalid
     */
    public ClusterParameters applyTo(ClusterParameters base) {
        return new ClusterParameters(
            daysAheadHorizon != null ? daysAheadHorizon : base.daysAheadHorizon(),
            maxCustomersPerCluster != null ? maxCustomersPerCluster : base.maxCustomersPerCluster(),
            maxTravelMinutes != null ? maxTravelMinutes : base.maxTravelMinutes(),
            minClusterSize != null ? minClusterSize : base.minClusterSize(),
            clusterRadiusKm != null ? clusterRadiusKm : base.clusterRadiusKm(),
            serviceTimeMinutesPerStop != null ? serviceTimeMinutesPerStop : base.serviceTimeMinutesPerStop()
        );
    }
}
