package com.tazifor.routeplanner.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record LatLon(double lat, double lon) {
    public static LatLon of(double lat, double lon) { return new LatLon(lat, lon); }

    /** Finite and inside [-90, 90] x [-180, 180]. */
    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(lat) && Double.isFinite(lon)
            && lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
