package com.tazifor.routeplanner.controller;

import com.tazifor.routeplanner.dto.RecommendationRequest;
import com.tazifor.routeplanner.dto.RecommendationResponse;
import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.model.Polygon;
import com.tazifor.routeplanner.geo.util.ConvexHull;
import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import com.tazifor.routeplanner.model.CustomerLocation;
import com.tazifor.routeplanner.service.RecommendationEngine;
import com.tazifor.routeplanner.service.TravelMatrixRefiner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recommendation Controller
 *
 * JSON surface over {@link RecommendationEngine}. The UI posts its current
 * customer snapshot and slider values and gets back ranked clusters; hull
 * outlines are fetched separately when a cluster is shown on the map.
 */
@Slf4j
@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {

    private final RecommendationEngine engine;
    private final TravelMatrixRefiner refiner;
    private final ClusterParameters defaultClusterParameters;
    private final LatLon depotLocation;
    private final Clock clock;

    public RecommendationController(RecommendationEngine engine, TravelMatrixRefiner refiner,
                                    ClusterParameters defaultClusterParameters, LatLon depotLocation,
                                    Clock clock) {
        this.engine = engine;
        this.refiner = refiner;
        this.defaultClusterParameters = defaultClusterParameters;
        this.depotLocation = depotLocation;
        this.clock = clock;
    }

    /**
     * Generate ranked recommendations
     *
     * POST /api/recommendations
     * Content-Type: application/json
     *
     * Parameters, depot and reference date are optional; configured values
     * fill in whatever is missing.
     */
    @PostMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestBody RecommendationRequest request) {
        long startTime = System.nanoTime();

        ClusterParameters params = request.getParameters() != null
            ? request.getParameters().applyTo(defaultClusterParameters)
            : defaultClusterParameters;
        LatLon depot = request.getDepot() != null ? request.getDepot() : depotLocation;
        LocalDate today = request.getToday() != null ? request.getToday() : LocalDate.now(clock);
        List<CustomerLocation> customers = request.getCustomers() != null ? request.getCustomers() : List.of();

        List<Cluster> clusters = engine.generateRecommendations(customers, params, depot, today);

        int refined = 0;
        if (request.isRefineWithTravelMatrix()) {
            refined = refiner.refineAll(clusters, depot, params);
        }

        RecommendationResponse response = RecommendationResponse.builder()
            .clusters(clusters)
            .diagnostics(engine.diagnose(customers, params, today, clusters))
            .parameters(params)
            .matrixRefinedCount(refined)
            .build();

        long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
        log.info("{} customers -> {} clusters in {} ms", customers.size(), clusters.size(), latencyMs);

        return ResponseEntity.ok()
            .header("X-Processing-Time-Ms", String.valueOf(latencyMs))
            .body(response);
    }

    /**
     * Convex hull outline for a set of points
     *
     * POST /api/recommendations/hull
     * Body: [{"lat": 69.0, "lon": 18.0}, ...]
     */
    @PostMapping("/hull")
    public Polygon hull(@RequestBody List<LatLon> points) {
        return ConvexHull.of(points);
    }

    /**
     * Configured defaults, for initialising the settings panel
     */
    @GetMapping("/defaults")
    public Map<String, Object> defaults() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("parameters", defaultClusterParameters);
        out.put("depot", depotLocation);
        out.put("travelMatrixAvailable", refiner.isAvailable());
        return out;
    }
}
