package com.tazifor.routeplanner.geo.util;

import com.tazifor.routeplanner.geo.model.BBox;
import com.tazifor.routeplanner.geo.model.LatLon;

import java.util.List;

public final class GeoMath {
    private GeoMath() {}

    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Flat-earth conversion used for grid cells and area estimates. */
    public static final double KM_PER_DEGREE_LAT = 111.0;

    /** Floor for {@link #boundingBoxAreaKm2(List)}, keeps density finite. */
    public static final double MIN_AREA_KM2 = 0.1;

    /**
     * Haversine great-circle distance in kilometres.
     * <p>
     * Returns {@link Double#POSITIVE_INFINITY} when any coordinate is NaN or
     * infinite. Every {@code distance <= radius} test then fails on its own,
     * so callers never have to special-case broken input.
     * </p>
     *
     * @param a first point
     * @param b second point
     * @return distance in km, or +Infinity for non-finite input
     */
    public static double distanceKm(LatLon a, LatLon b) {
        if (!Double.isFinite(a.lat()) || !Double.isFinite(a.lon())
            || !Double.isFinite(b.lat()) || !Double.isFinite(b.lon())) {
            return Double.POSITIVE_INFINITY;
        }
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLon = Math.toRadians(b.lon() - a.lon());
        double la1 = Math.toRadians(a.lat()), la2 = Math.toRadians(b.lat());
        double h = Math.sin(dLat/2)*Math.sin(dLat/2) +
            Math.cos(la1)*Math.cos(la2) * Math.sin(dLon/2)*Math.sin(dLon/2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /**
     * Arithmetic mean of latitudes and longitudes.
     *
     * @throws IllegalArgumentException if {@code points} is empty
     */
    public static LatLon centroid(List<LatLon> points) {
        if (points.isEmpty())
            throw new IllegalArgumentException("centroid of an empty point set");
        double sumLat = 0, sumLon = 0;
        for (LatLon p : points) {
            sumLat += p.lat();
            sumLon += p.lon();
        }
        return new LatLon(sumLat / points.size(), sumLon / points.size());
    }

    public static BBox boundingBox(List<LatLon> points) {
        double minLat = Double.MAX_VALUE, minLon = Double.MAX_VALUE;
        double maxLat = -Double.MAX_VALUE, maxLon = -Double.MAX_VALUE;

        for (LatLon pt : points) {
            minLat = Math.min(minLat, pt.lat());
            minLon = Math.min(minLon, pt.lon());
            maxLat = Math.max(maxLat, pt.lat());
            maxLon = Math.max(maxLon, pt.lon());
        }
        return new BBox(minLat, minLon, maxLat, maxLon);
    }

    /**
     * Approximate area of the box spanned by {@code points}.
     * <p>
     * Latitude span is converted at 111 km/degree, longitude span at
     * {@code 111 * cos(centroidLat)} km/degree. The result never drops below
     * {@link #MIN_AREA_KM2}: three customers in the same building still get a
     * finite density.
     * </p>
     */
    public static double boundingBoxAreaKm2(List<LatLon> points) {
        BBox box = boundingBox(points);
        LatLon c = centroid(points);
        double latKm = box.latSpan() * KM_PER_DEGREE_LAT;
        double lonKm = box.lonSpan() * KM_PER_DEGREE_LAT * Math.cos(Math.toRadians(c.lat()));
        return Math.max(latKm * lonKm, MIN_AREA_KM2);
    }
}
