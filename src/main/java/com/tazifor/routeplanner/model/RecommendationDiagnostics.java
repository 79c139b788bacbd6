package com.tazifor.routeplanner.model;

/**
 * Funnel counts for one snapshot, plus the reason a run came back empty.
 *
 * @param totalCustomers      records in the snapshot
 * @param withValidLocation   records with usable coordinates
 * @param withDueDate         records whose next due date resolves
 * @param eligible            valid location and due within the horizon
 * @param clusterCount        clusters in the ranked result
 * @param emptyReason         why nothing was recommended, {@link EmptyReason#NONE} otherwise
 */
public record RecommendationDiagnostics(
    int totalCustomers,
    int withValidLocation,
    int withDueDate,
    int eligible,
    int clusterCount,
    EmptyReason emptyReason
) {

    public enum EmptyReason {
        NONE,
        NO_CUSTOMERS,
        NO_COORDINATES,
        NO_DUE_DATES,
        NONE_DUE_WITHIN_HORIZON,
        TOO_FEW_ELIGIBLE,
        NO_GROUPING_FOUND
    }
}
