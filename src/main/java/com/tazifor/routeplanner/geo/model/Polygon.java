package com.tazifor.routeplanner.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Represents a polygon as an <b>ordered list of latitude/longitude vertices</b>.
 * <p>
 * Each vertex {@code i} is connected to {@code i+1}, and the last vertex
 * connects back to the first. The ring is implicitly closed, so the first
 * vertex is <b>not</b> repeated at the end.
 * </p>
 *
 * <h3>Cluster boundaries</h3>
 * A boundary produced by {@link com.tazifor.routeplanner.geo.util.ConvexHull}
 * starts at the southernmost member and walks the outline in one consistent
 * rotation. Consumers that need a closed GeoJSON ring append the first vertex
 * themselves:
 *
 * <pre>{@code
 * Polygon hull = ConvexHull.of(cluster.memberLocations());
 * List<List<Double>> ring = new ArrayList<>();
 * for (LatLon p : hull.points()) ring.add(List.of(p.lon(), p.lat()));
 * ring.add(ring.get(0));
 * }</pre>
 *
 * With fewer than three vertices the "polygon" is degenerate: a point or a
 * segment, carried as-is.
 */
public record Polygon(List<LatLon> points) {

    public Polygon {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isDegenerate() {
        return points.size() < 3;
    }
}
