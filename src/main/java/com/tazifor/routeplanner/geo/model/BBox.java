package com.tazifor.routeplanner.geo.model;

public record BBox(double minLat, double minLon, double maxLat, double maxLon) {
    public double latSpan() { return maxLat - minLat; }

    public double lonSpan() { return maxLon - minLon; }
}
