package com.tazifor.routeplanner.dto;

import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.model.CustomerLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of {@code POST /api/recommendations}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    private List<CustomerLocation> customers;

    // optional; configured defaults apply when absent
    private ParameterOverrides parameters;
    private LatLon depot;
    private LocalDate today;

    private boolean refineWithTravelMatrix;
}
