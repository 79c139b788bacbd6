package com.tazifor.routeplanner.service;

import com.tazifor.routeplanner.geo.model.LatLon;

import java.util.List;
import java.util.Optional;

/**
 * Port to an external road-routing service that can answer
 * "how long from the depot to each of these points".
 * <p>
 * No implementation ships with this service; deployments that have a routing
 * backend register one as a Spring bean.
 * </p>
 */
public interface TravelMatrixProvider {

    /**
     * @param depot        origin
     * @param destinations customer locations, at most {@link TravelMatrixRefiner#MAX_DESTINATIONS}
     * @return the matrix row, or empty when the service has no answer
     */
    Optional<TravelMatrix> fromDepot(LatLon depot, List<LatLon> destinations);
}
