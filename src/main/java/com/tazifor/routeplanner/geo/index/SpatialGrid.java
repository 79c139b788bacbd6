package com.tazifor.routeplanner.geo.index;

import com.tazifor.routeplanner.geo.model.CellKey;
import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.util.GeoMath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code SpatialGrid} buckets a fixed list of points into a uniform
 * latitude/longitude grid so that radius queries only look at nearby points.
 * <p>
 * A plain all-pairs neighbour search is O(n²). With the grid, a query only
 * visits the 3×3 block of cells around the query point, which for customer
 * data (a few dozen points per cell at most) is effectively constant time.
 * </p>
 *
 * <h3>🧮 Cell size</h3>
 * <pre>
 *   cellLatDeg = epsilonKm / 111
 *   cellLonDeg = epsilonKm / (111 * cos(maxAbsLat))
 *
 *   cell of p  = ( floor(p.lon / cellLonDeg), floor(p.lat / cellLatDeg) )
 * </pre>
 *
 * Both edges are at least {@code epsilonKm} long on the ground everywhere in
 * the point set, so any point within epsilon of the query sits in the query's
 * cell or one of its eight neighbours. A degree of longitude shrinks with
 * latitude, hence the longitude step is widened using the most poleward point.
 *
 * <h3>🧩 Example</h3>
 * With {@code epsilonKm = 5} around latitude 69° (Tromsø):
 * <ul>
 *   <li>cellLatDeg = 0.045° (≈ 5.0 km)</li>
 *   <li>cellLonDeg ≈ 0.126° (≈ 5.0 km at 69°N)</li>
 * </ul>
 *
 * The grid is built once per clustering call and thrown away afterwards.
 * Longitudes are not wrapped at ±180°.
 *
 * <h3>Unsupported seams</h3>
 * Neighbours are only guaranteed for points away from two seams: within
 * epsilon of the ±180° meridian, points on opposite sides land in cells far
 * apart and are not found; above about 89.4° the longitude step is capped and
 * may be narrower than epsilon. Customer data for this service never comes
 * near either seam.
 */
public class SpatialGrid {

    // below this cos(lat) (about 89.4°) the longitude step stops growing
    private static final double MIN_COS_LAT = 0.01;

    private final List<LatLon> points;
    private final double epsilonKm;
    private final double cellLatDeg;
    private final double cellLonDeg;
    private final Map<CellKey, List<Integer>> cells = new HashMap<>();

    /**
     * Builds the grid over {@code points}.
     *
     * @param points     coordinates, addressed by list index in queries
     * @param epsilonKm  the largest query radius this grid must answer
     * @throws IllegalArgumentException if epsilon is not a positive finite number
     */
    public SpatialGrid(List<LatLon> points, double epsilonKm) {
        if (!(epsilonKm > 0) || !Double.isFinite(epsilonKm))
            throw new IllegalArgumentException("epsilonKm must be > 0, got: " + epsilonKm);
        this.points = List.copyOf(points);
        this.epsilonKm = epsilonKm;

        double maxAbsLat = 0;
        for (LatLon p : this.points) {
            maxAbsLat = Math.max(maxAbsLat, Math.abs(p.lat()));
        }
        double cosLat = Math.max(Math.cos(Math.toRadians(Math.min(maxAbsLat, 90.0))), MIN_COS_LAT);

        this.cellLatDeg = epsilonKm / GeoMath.KM_PER_DEGREE_LAT;
        this.cellLonDeg = epsilonKm / (GeoMath.KM_PER_DEGREE_LAT * cosLat);

        for (int i = 0; i < this.points.size(); i++) {
            cells.computeIfAbsent(cellOf(this.points.get(i)), k -> new ArrayList<>()).add(i);
        }
    }

    /**
     * Returns the cell containing {@code p}.
     */
    public CellKey cellOf(LatLon p) {
        long x = (long) Math.floor(p.lon() / cellLonDeg);
        long y = (long) Math.floor(p.lat() / cellLatDeg);
        return new CellKey(x, y);
    }

    /**
     * Indices of all points within the build radius of point {@code pointIndex},
     * the point itself included.
     */
    public List<Integer> neighborsWithin(int pointIndex) {
        return neighborsWithin(pointIndex, epsilonKm);
    }

    /**
     * Indices of all points whose haversine distance to point
     * {@code pointIndex} is at most {@code radiusKm}. The point itself is part
     * of the result (distance 0).
     * <p>
     * Only the 3×3 cell block around the point is scanned, so the radius may
     * not exceed the epsilon the grid was built with.
     * </p>
     *
     * @param pointIndex index into the list given at construction
     * @param radiusKm   query radius, {@code <=} the build epsilon
     * @return matching indices in cell scan order
     * @throws IllegalArgumentException if {@code radiusKm} exceeds the build epsilon
     */
    public List<Integer> neighborsWithin(int pointIndex, double radiusKm) {
        if (radiusKm > epsilonKm)
            throw new IllegalArgumentException(
                "radius " + radiusKm + " km exceeds grid epsilon " + epsilonKm + " km");

        LatLon p = points.get(pointIndex);
        CellKey home = cellOf(p);
        List<Integer> out = new ArrayList<>();

        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                List<Integer> bucket = cells.get(home.offset(dx, dy));
                if (bucket == null) continue;
                for (int i : bucket) {
                    if (GeoMath.distanceKm(p, points.get(i)) <= radiusKm) {
                        out.add(i);
                    }
                }
            }
        }
        return out;
    }

    public int size() {
        return points.size();
    }

    public int cellCount() {
        return cells.size();
    }

    public double getEpsilonKm() {
        return epsilonKm;
    }

    /** Latitude step in degrees (cell height). */
    public double getCellLatDeg() {
        return cellLatDeg;
    }

    /** Longitude step in degrees (cell width). */
    public double getCellLonDeg() {
        return cellLonDeg;
    }
}
