package com.tazifor.routeplanner.geo.model;

/**
 * Integer address of one cell in a {@link com.tazifor.routeplanner.geo.index.SpatialGrid}.
 * {@code x} is the longitude column, {@code y} the latitude row.
 */
public record CellKey(long x, long y) {
    public CellKey offset(int dx, int dy) {
        return new CellKey(x + dx, y + dy);
    }
}
