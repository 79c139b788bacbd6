package com.tazifor.routeplanner.service;

import static com.tazifor.routeplanner.TestCustomers.TODAY;
import static com.tazifor.routeplanner.TestCustomers.customer;
import static com.tazifor.routeplanner.TestCustomers.ids;
import static com.tazifor.routeplanner.TestCustomers.scattered;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tazifor.routeplanner.cluster.DbscanClusterer;
import com.tazifor.routeplanner.geo.model.LatLon;
import com.tazifor.routeplanner.geo.util.GeoMath;
import com.tazifor.routeplanner.model.Cluster;
import com.tazifor.routeplanner.model.ClusterParameters;
import com.tazifor.routeplanner.model.CustomerLocation;
import com.tazifor.routeplanner.model.RecommendationDiagnostics;
import com.tazifor.routeplanner.model.RecommendationDiagnostics.EmptyReason;

class RecommendationEngineTest {

    private static final LatLon TROMSO = LatLon.of(69.0, 18.0);

    private RecommendationEngine engine;
    private ClusterParameters params;

    @BeforeEach
    void setUp() {
        DueDateResolver dueDates = new DueDateResolver();
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
        engine = new RecommendationEngine(new DbscanClusterer(), new EfficiencyScorer(dueDates), dueDates, clock);
        params = ClusterParameters.defaults();
    }

    private List<CustomerLocation> tightGroup(String prefix, double lat, double lon) {
        return List.of(
                customer(prefix + "1", lat, lon),
                customer(prefix + "2", lat + 0.001, lon + 0.001),
                customer(prefix + "3", lat + 0.002, lon));
    }

    @Test
    void testThreeCloseCustomersFormOneCluster() {
        List<CustomerLocation> snapshot = List.of(
                customer("a", 69.000, 18.000),
                customer("b", 69.001, 18.001),
                customer("c", 69.002, 18.000),
                customer("d", 69.050, 18.500));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertEquals(1, clusters.size());
        Cluster cluster = clusters.get(0);
        assertEquals(List.of("a", "b", "c"), cluster.memberIds());
        assertEquals(0, cluster.getId());
        assertEquals(100, cluster.getEfficiencyScore());
        assertEquals(91, cluster.getEstimatedTravelMinutes());
        assertFalse(cluster.isAreaFallback());
        assertFalse(cluster.isTrimmed());
    }

    @Test
    void testNothingEligibleGivesEmptyResult() {
        List<CustomerLocation> snapshot = List.of(
                customer("a", 69.0, 18.0, TODAY.plusDays(200), null),
                customer("b", 69.001, 18.0, null, null));

        assertTrue(engine.generateRecommendations(snapshot, params, TROMSO, TODAY).isEmpty());
        assertTrue(engine.generateRecommendations(List.of(), params, TROMSO, TODAY).isEmpty());
        assertTrue(engine.generateRecommendations(null, params, TROMSO, TODAY).isEmpty());
    }

    @Test
    void testScatteredSameAreaFallsBackToArea() {
        // at least 22 km between any two points
        List<CustomerLocation> snapshot = List.of(
                customer("a", 70.0, 25.0, TODAY, "Senja"),
                customer("b", 70.2, 25.0, TODAY, "Senja"),
                customer("c", 70.4, 25.0, TODAY, "Senja"),
                customer("d", 70.0, 25.6, TODAY, "Senja"),
                customer("e", 70.2, 25.6, TODAY, "Senja"));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertEquals(1, clusters.size());
        assertEquals(List.of("a", "b", "c", "d", "e"), clusters.get(0).memberIds());
        assertTrue(clusters.get(0).isAreaFallback());
        assertEquals("Senja", clusters.get(0).getPrimaryAreaName());
    }

    @Test
    void testRetryAtDoubleRadius() {
        // ~7 km apart: out of reach at 5 km, chained at 10 km
        List<CustomerLocation> snapshot = List.of(
                customer("a", 60.000, 10.0, TODAY, "Nord"),
                customer("b", 60.063, 10.0, TODAY, "Sør"),
                customer("c", 60.126, 10.0, TODAY, "Vest"));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, LatLon.of(60.0, 10.0), TODAY);

        assertEquals(1, clusters.size());
        assertEquals(List.of("a", "b", "c"), clusters.get(0).memberIds());
        assertFalse(clusters.get(0).isAreaFallback());
    }

    @Test
    void testTooFewForClusteringGroupsByArea() {
        List<CustomerLocation> snapshot = List.of(
                customer("a", 69.0, 18.0, TODAY, "Kvaløya"),
                customer("b", 69.3, 18.9, TODAY, "Kvaløya"));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertEquals(1, clusters.size());
        assertTrue(clusters.get(0).isAreaFallback());
        assertEquals(List.of("a", "b"), clusters.get(0).memberIds());
    }

    @Test
    void testSingletonAreasAreNotRecommended() {
        List<CustomerLocation> snapshot = List.of(
                customer("a", 69.0, 18.0, TODAY, "Kvaløya"),
                customer("b", 69.3, 18.9, TODAY, "Tromsø"));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertTrue(clusters.isEmpty());
        RecommendationDiagnostics diagnostics = engine.diagnose(snapshot, params, TODAY, clusters);
        assertEquals(EmptyReason.TOO_FEW_ELIGIBLE, diagnostics.emptyReason());
    }

    @Test
    void testEligibilityFilters() {
        List<CustomerLocation> snapshot = new ArrayList<>(Arrays.asList(
                customer("ok", 69.0, 18.0, TODAY.plusDays(10), null),
                customer("overdue", 69.0, 18.0, TODAY.minusDays(30), null),
                customer("edge", 69.0, 18.0, TODAY.plusDays(60), null),
                customer("late", 69.0, 18.0, TODAY.plusDays(61), null),
                customer("nodate", 69.0, 18.0, null, null),
                customer("nan", Double.NaN, 18.0, TODAY, null),
                customer("pole", 95.0, 18.0, TODAY, null),
                null));
        CustomerLocation noLocation = customer("noloc", 0, 0, TODAY, null);
        noLocation.setLocation(null);
        snapshot.add(noLocation);

        List<CustomerLocation> eligible = engine.eligibleCustomers(snapshot, params, TODAY);

        assertEquals(List.of("ok", "overdue", "edge"), ids(eligible));
    }

    @Test
    void testClockSuppliesToday() {
        List<CustomerLocation> snapshot = List.of(
                customer("a", 69.000, 18.000, TODAY.plusDays(60), null),
                customer("b", 69.001, 18.001, TODAY.plusDays(60), null),
                customer("c", 69.002, 18.000, TODAY.plusDays(60), null));

        assertEquals(1, engine.generateRecommendations(snapshot, params, TROMSO).size());
        assertTrue(engine.generateRecommendations(snapshot, params.withDaysAheadHorizon(59), TROMSO).isEmpty());
    }

    @Test
    void testOversizedClusterIsTrimmedToNearest() {
        Random rnd = new Random(42);
        List<CustomerLocation> snapshot = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            snapshot.add(customer("t" + i, 69.0 + rnd.nextDouble() * 0.01, 18.0 + rnd.nextDouble() * 0.02));
        }
        ClusterParameters quick = params.withServiceTimeMinutesPerStop(10);

        List<Cluster> clusters = engine.generateRecommendations(snapshot, quick, TROMSO, TODAY);

        assertEquals(1, clusters.size());
        Cluster cluster = clusters.get(0);
        assertTrue(cluster.isTrimmed());
        assertEquals(15, cluster.getMemberCount());

        List<LatLon> all = new ArrayList<>();
        snapshot.forEach(c -> all.add(c.getLocation()));
        LatLon centroid = GeoMath.centroid(all);
        List<CustomerLocation> byDistance = new ArrayList<>(snapshot);
        byDistance.sort(Comparator.comparingDouble(c -> GeoMath.distanceKm(c.getLocation(), centroid)));
        assertEquals(ids(byDistance.subList(0, 15)), cluster.memberIds());
    }

    @Test
    void testOversizedAndTooFarIsDiscarded() {
        List<CustomerLocation> snapshot = scattered(20, 1, 69.0, 18.0, 0.01, 0.02);
        LatLon farDepot = LatLon.of(64.5, 18.0);

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, farDepot, TODAY);

        assertTrue(clusters.isEmpty());
        assertEquals(EmptyReason.NO_GROUPING_FOUND, engine.diagnose(snapshot, params, TODAY, clusters).emptyReason());
    }

    @Test
    void testSmallButTooFarIsKept() {
        List<CustomerLocation> snapshot = tightGroup("a", 69.0, 18.0);
        LatLon farDepot = LatLon.of(64.5, 18.0);

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, farDepot, TODAY);

        assertEquals(1, clusters.size());
        assertTrue(clusters.get(0).getEstimatedTravelMinutes() > params.maxTravelMinutes());
    }

    @Test
    void testRankedByScoreBestFirst() {
        List<CustomerLocation> snapshot = List.of(
                customer("y1", 61.00, 10.0),
                customer("y2", 61.05, 10.0),
                customer("y3", 61.00, 10.1),
                customer("y4", 61.05, 10.1),
                customer("x1", 60.00, 10.0),
                customer("x2", 60.05, 10.0),
                customer("x3", 60.00, 10.1),
                customer("x4", 60.05, 10.1));

        List<Cluster> clusters = engine.generateRecommendations(
                snapshot, params.withClusterRadiusKm(8.0), LatLon.of(60.0, 10.0), TODAY);

        assertEquals(2, clusters.size());
        assertEquals(List.of("x1", "x2", "x3", "x4"), clusters.get(0).memberIds());
        assertEquals(22, clusters.get(0).getEfficiencyScore());
        assertEquals(0, clusters.get(0).getId());
        assertEquals(7, clusters.get(1).getEfficiencyScore());
        assertEquals(1, clusters.get(1).getId());
    }

    @Test
    void testEqualScoresKeepDiscoveryOrder() {
        List<CustomerLocation> snapshot = new ArrayList<>();
        snapshot.addAll(tightGroup("b", 69.5, 18.0));
        snapshot.addAll(tightGroup("a", 69.0, 18.0));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertEquals(2, clusters.size());
        assertEquals(100, clusters.get(0).getEfficiencyScore());
        assertEquals(100, clusters.get(1).getEfficiencyScore());
        assertEquals("b1", clusters.get(0).memberIds().get(0));
        assertEquals("a1", clusters.get(1).memberIds().get(0));
    }

    @Test
    void testNoCustomerInTwoClusters() {
        List<CustomerLocation> snapshot = scattered(300, 7, 69.0, 17.5, 0.6, 1.6);
        ClusterParameters wide = params.withClusterRadiusKm(3.0).withMaxCustomersPerCluster(8);

        List<Cluster> clusters = engine.generateRecommendations(snapshot, wide, TROMSO, TODAY);

        assertFalse(clusters.isEmpty());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < clusters.size(); i++) {
            Cluster cluster = clusters.get(i);
            assertEquals(i, cluster.getId());
            assertTrue(cluster.getMemberCount() >= 2 && cluster.getMemberCount() <= 8);
            assertTrue(cluster.getEfficiencyScore() >= 0 && cluster.getEfficiencyScore() <= 100);
            if (i > 0) {
                assertTrue(clusters.get(i - 1).getEfficiencyScore() >= cluster.getEfficiencyScore());
            }
            for (String id : cluster.memberIds()) {
                assertTrue(seen.add(id), "customer in two clusters: " + id);
            }
        }
    }

    @Test
    void testRepeatedRunsAgree() {
        List<CustomerLocation> snapshot = scattered(150, 9, 69.0, 17.5, 0.4, 1.0);

        List<Cluster> first = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);
        List<Cluster> second = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);

        assertEquals(first, second);
    }

    @Test
    void testInvalidDepotIsRejected() {
        List<CustomerLocation> snapshot = tightGroup("a", 69.0, 18.0);
        assertThrows(IllegalArgumentException.class,
                () -> engine.generateRecommendations(snapshot, params, LatLon.of(91.0, 18.0), TODAY));
        assertThrows(IllegalArgumentException.class,
                () -> engine.generateRecommendations(snapshot, params, null, TODAY));
    }

    @Test
    void testDiagnosticsFunnel() {
        List<CustomerLocation> snapshot = List.of(
                customer("ok", 69.0, 18.0, TODAY, null),
                customer("nan", Double.NaN, 18.0, TODAY, null),
                customer("nodate", 69.0, 18.0, null, null),
                customer("later", 69.0, 18.0, TODAY.plusDays(400), null));

        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);
        RecommendationDiagnostics diagnostics = engine.diagnose(snapshot, params, TODAY, clusters);

        assertEquals(4, diagnostics.totalCustomers());
        assertEquals(3, diagnostics.withValidLocation());
        assertEquals(3, diagnostics.withDueDate());
        assertEquals(1, diagnostics.eligible());
        assertEquals(0, diagnostics.clusterCount());
        assertEquals(EmptyReason.TOO_FEW_ELIGIBLE, diagnostics.emptyReason());
    }

    @Test
    void testDiagnosticsReasons() {
        assertEquals(EmptyReason.NO_CUSTOMERS, reasonFor(List.of()));
        assertEquals(EmptyReason.NO_COORDINATES, reasonFor(List.of(
                customer("a", Double.NaN, 18.0, TODAY, null))));
        assertEquals(EmptyReason.NO_DUE_DATES, reasonFor(List.of(
                customer("a", 69.0, 18.0, null, null))));
        assertEquals(EmptyReason.NONE_DUE_WITHIN_HORIZON, reasonFor(List.of(
                customer("a", 69.0, 18.0, TODAY.plusDays(90), null))));
        assertEquals(EmptyReason.NO_GROUPING_FOUND, reasonFor(List.of(
                customer("a", 70.0, 25.0, TODAY, "Nord"),
                customer("b", 70.2, 25.0, TODAY, "Sør"),
                customer("c", 70.4, 25.0, TODAY, "Vest"))));
        assertEquals(EmptyReason.NONE, reasonFor(tightGroup("a", 69.0, 18.0)));
    }

    private EmptyReason reasonFor(List<CustomerLocation> snapshot) {
        List<Cluster> clusters = engine.generateRecommendations(snapshot, params, TROMSO, TODAY);
        return engine.diagnose(snapshot, params, TODAY, clusters).emptyReason();
    }
}
