package com.tazifor.routeplanner.cluster;

import com.tazifor.routeplanner.model.CustomerLocation;

import java.util.List;

/**
 * Output of one DBSCAN pass.
 *
 * @param clusters groups in order of discovery, members in input order
 * @param noise    points that ended up in no group, in input order
 */
public record DbscanResult(List<List<CustomerLocation>> clusters, List<CustomerLocation> noise) {

    public static DbscanResult empty() {
        return new DbscanResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }
}
