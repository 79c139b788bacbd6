package com.tazifor.routeplanner.cluster;

import com.tazifor.routeplanner.geo.index.SpatialGrid;
import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.model.CustomerLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * DbscanClusterer - density-based grouping of customer locations
 *
 * HOW IT WORKS:
 * A point with at least {@code minPts} points (itself included) within
 * {@code epsilonKm} is a CORE point. Core points that reach each other form
 * one cluster; non-core points within reach of a core point join it as
 * BORDER points; everything else is NOISE.
 *
 * PER-POINT STATE:
 *   unvisited → visited, then one of core | border | noise
 * A point first marked noise may still be claimed later as a border point of
 * a cluster discovered afterwards.
 *
 * NEIGHBOUR LOOKUP:
 * Goes through a {@link SpatialGrid} built once per call, so each query
 * scans a 3×3 cell block instead of every point.
 *
 * DETERMINISM:
 * Points are visited in input order, so identical input yields identical
 * cluster ids and membership.
 */
@Slf4j
@Component
public class DbscanClusterer {

    private static final int UNASSIGNED = -1;

    /**
     * Clusters {@code customers} by location.
     *
     * @param customers points to cluster; every location must be valid
     * @param epsilonKm neighbour radius in km
     * @param minPts    minimum neighbourhood size (self included) for a core point
     * @return clusters of at least {@code minPts} members, plus the noise set
     * @throws IllegalArgumentException for a non-positive radius or minPts below 1
     */
    public DbscanResult cluster(List<CustomerLocation> customers, double epsilonKm, int minPts) {
        if (!(epsilonKm > 0) || !Double.isFinite(epsilonKm))
            throw new IllegalArgumentException("epsilonKm must be > 0, got: " + epsilonKm);
        if (minPts < 1)
            throw new IllegalArgumentException("minPts must be >= 1, got: " + minPts);

        int n = customers.size();
        if (n == 0) {
            return DbscanResult.empty();
        }

        List<LatLon> locations = new ArrayList<>(n);
        for (CustomerLocation c : customers) {
            locations.add(c.getLocation());
        }
        SpatialGrid grid = new SpatialGrid(locations, epsilonKm);

        boolean[] visited = new boolean[n];
        int[] clusterIds = new int[n];
        Arrays.fill(clusterIds, UNASSIGNED);
        int clusterCount = 0;

        for (int i = 0; i < n; i++) {
            if (visited[i]) continue;
            visited[i] = true;

            List<Integer> neighbors = grid.neighborsWithin(i);
            if (neighbors.size() < minPts) {
                continue; // noise for now
            }
            expand(grid, i, neighbors, clusterCount, minPts, visited, clusterIds);
            clusterCount++;
        }

        DbscanResult result = group(customers, clusterIds, clusterCount, minPts);
        log.debug("DBSCAN eps={}km minPts={}: {} clusters, {} noise of {} points",
            epsilonKm, minPts, result.clusters().size(), result.noise().size(), n);
        return result;
    }

    private void expand(SpatialGrid grid, int seed, List<Integer> seedNeighbors, int clusterId,
                        int minPts, boolean[] visited, int[] clusterIds) {
        clusterIds[seed] = clusterId;

        Deque<Integer> queue = new ArrayDeque<>(seedNeighbors);
        Set<Integer> queued = new HashSet<>(seedNeighbors);

        while (!queue.isEmpty()) {
            int current = queue.poll();

            if (!visited[current]) {
                visited[current] = true;
                List<Integer> neighbors = grid.neighborsWithin(current);

                if (neighbors.size() >= minPts) {
                    for (int neighbor : neighbors) {
                        if (!queued.contains(neighbor) && clusterIds[neighbor] == UNASSIGNED) {
                            queue.add(neighbor);
                            queued.add(neighbor);
                        }
                    }
                }
            }

            if (clusterIds[current] == UNASSIGNED) {
                clusterIds[current] = clusterId;
            }
        }
    }

    private DbscanResult group(List<CustomerLocation> customers, int[] clusterIds, int clusterCount, int minPts) {
        List<List<CustomerLocation>> byId = new ArrayList<>(clusterCount);
        for (int id = 0; id < clusterCount; id++) {
            byId.add(new ArrayList<>());
        }
        for (int i = 0; i < customers.size(); i++) {
            if (clusterIds[i] != UNASSIGNED) {
                byId.get(clusterIds[i]).add(customers.get(i));
            }
        }

        List<List<CustomerLocation>> clusters = new ArrayList<>();
        Set<Integer> dropped = new HashSet<>();
        for (int id = 0; id < clusterCount; id++) {
            if (byId.get(id).size() >= minPts) {
                clusters.add(List.copyOf(byId.get(id)));
            } else {
                // border points only, no core left to hold them
                dropped.add(id);
            }
        }

        List<CustomerLocation> noise = new ArrayList<>();
        for (int i = 0; i < customers.size(); i++) {
            if (clusterIds[i] == UNASSIGNED || dropped.contains(clusterIds[i])) {
                noise.add(customers.get(i));
            }
        }
        return new DbscanResult(clusters, noise);
    }
}
