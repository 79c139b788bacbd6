package com.tazifor.routeplanner.dto;

import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import com.tazifor.routeplanner.model.RecommendationDiagnostics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ranked clusters plus the parameters and funnel that produced them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    private List<Cluster> clusters;
    private RecommendationDiagnostics diagnostics;
    private ClusterParameters parameters;
    private int matrixRefinedCount;
}
