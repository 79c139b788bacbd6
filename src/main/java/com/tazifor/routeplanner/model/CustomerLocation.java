package com.tazifor.routeplanner.model;

import com.tazifor.routeplanner.geo.model.LatLon;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * CustomerLocation Model
 *
 * Point-in-time copy of a customer record as supplied by the customer store.
 * The recommendation engine only reads these; it never writes them back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerLocation {

    private String id;
    private LatLon location;
    private String displayName;

    // ===== Optional attributes =====
    private String areaName;         // postal area, drives the area fallback
    private String category;

    // ===== Visit scheduling =====
    private LocalDate nextDueDate;   // explicit next visit, if known
    private List<ServiceSchedule> services;

    /**
     * True when the location is present, finite and within lat/lon range.
     */
    public boolean hasValidLocation() {
        return location != null && location.isValid();
    }
}
