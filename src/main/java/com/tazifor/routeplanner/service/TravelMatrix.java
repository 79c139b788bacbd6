package com.tazifor.routeplanner.service;

import java.util.List;

/**
 * One row of a travel-time matrix: depot to each destination, in request order.
 * Entries may be null where the routing service found no route.
 *
 * @param durationsSeconds driving time per destination
 * @param distancesMeters  driving distance per destination, may be empty
 */
public record TravelMatrix(List<Double> durationsSeconds, List<Double> distancesMeters) {
}
