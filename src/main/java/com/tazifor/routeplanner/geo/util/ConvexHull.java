package com.tazifor.routeplanner.geo.util;

import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.model.Polygon;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Boundary outline of a cluster, computed with the <b>gift-wrapping</b>
 * (Jarvis march) algorithm.
 *
 * <h3>Walk</h3>
 * <pre>
 *   1. anchor = lowest latitude (ties: lowest longitude)
 *   2. from the current vertex, pick the candidate that has no other point
 *      strictly on its clockwise side; among collinear candidates the
 *      farthest one wins
 *   3. repeat until the walk is back at the anchor, or n vertices were emitted
 * </pre>
 *
 * Coordinates are treated as planar (lat, lon) pairs. That is accurate enough
 * for a few kilometres of customers and the result is only ever drawn on a map.
 * Duplicate locations are collapsed before wrapping.
 */
public final class ConvexHull {
    private ConvexHull() {}

    /**
     * Computes the hull of {@code points}.
     *
     * @param points cluster member locations
     * @return hull vertices in walk order; fewer than three input points are
     *         returned unchanged
     */
    public static Polygon of(List<LatLon> points) {
        if (points.size() < 3) {
            return new Polygon(points);
        }
        List<LatLon> pts = new ArrayList<>(new LinkedHashSet<>(points));
        int n = pts.size();
        if (n < 3) {
            return new Polygon(pts);
        }

        int start = 0;
        for (int i = 1; i < n; i++) {
            LatLon p = pts.get(i), s = pts.get(start);
            if (p.lat() < s.lat() || (p.lat() == s.lat() && p.lon() < s.lon())) {
                start = i;
            }
        }

        List<LatLon> hull = new ArrayList<>();
        int current = start;
        do {
            hull.add(pts.get(current));
            LatLon o = pts.get(current);
            int next = current == 0 ? 1 : 0;

            for (int i = 0; i < n; i++) {
                if (i == current || i == next) continue;
                double c = cross(o, pts.get(next), pts.get(i));
                if (c < 0 || (c == 0 && dist2(o, pts.get(i)) > dist2(o, pts.get(next)))) {
                    next = i;
                }
            }
            current = next;
        } while (current != start && hull.size() < n);

        return new Polygon(hull);
    }

    // z-component of (a - o) x (b - o) with lat as x and lon as y; negative means b lies
    // clockwise of o->a in that plane, which is counter-clockwise on a north-up map
    static double cross(LatLon o, LatLon a, LatLon b) {
        return (a.lat() - o.lat()) * (b.lon() - o.lon()) - (a.lon() - o.lon()) * (b.lat() - o.lat());
    }

    private static double dist2(LatLon a, LatLon b) {
        double dLat = a.lat() - b.lat(), dLon = a.lon() - b.lon();
        return dLat * dLat + dLon * dLon;
    }
}
