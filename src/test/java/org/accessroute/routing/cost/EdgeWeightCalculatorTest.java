package org.accessroute.routing.cost;

import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;
import org.accessroute.routing.profile.BuiltInProfiles;
import org.accessroute.routing.profile.ExclusionRule;
import org.accessroute.routing.profile.MobilityProfile;
import org.accessroute.routing.profile.SlopeBand;
import org.accessroute.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Edge Weight Calculator Tests")
class EdgeWeightCalculatorTest {
    private static final MobilityProfile STANDARD = BuiltInProfiles.standard();
    private static final MobilityProfile WHEELCHAIR = BuiltInProfiles.wheelchair();

    @Test
    @DisplayName("Neutral attributes cost exactly their length")
    void testNeutralCost() {
        assertEquals(42.0d, EdgeWeightCalculator.weigh(42.0d, EdgeAttributes.neutral(), false, STANDARD), 0.0d);
        assertEquals(42.0d, EdgeWeightCalculator.weigh(42.0d, EdgeAttributes.neutral(), true, WHEELCHAIR), 0.0d);
    }

    @Test
    @DisplayName("Factors multiply: surface, slope, crossing, width and access")
    void testFactorComposition() {
        EdgeAttributes attributes = EdgeAttributes.builder()
                .surface(SurfaceClass.COMPACTED)
                .inclinePercent(3.0d)
                .crossing(CrossingKind.UNMARKED)
                .widthMeters(1.2d)
                .wheelchair(WheelchairAccess.LIMITED)
                .build();

        double expected = 10.0d * 1.5d * 1.3d * 2.0d * 1.5d * 1.5d;
        assertEquals(expected, EdgeWeightCalculator.weigh(10.0d, attributes, false, WHEELCHAIR), 1e-9);

        CostBreakdown breakdown = EdgeWeightCalculator.explain(10.0d, attributes, false, WHEELCHAIR);
        assertFalse(breakdown.isExcluded());
        assertEquals(SlopeBand.GENTLE, breakdown.getSlopeBand());
        assertEquals(1.3d, breakdown.getSlopeFactor(), 0.0d);
        assertEquals(expected, breakdown.getCost(), 1e-9);
        assertEquals(breakdown.getCost(), breakdown.getLengthMeters() * breakdown.combinedFactor(), 1e-9);
        assertEquals(BuiltInProfiles.WHEELCHAIR, breakdown.getProfileName());
    }

    @Test
    @DisplayName("Direction matters: ascent and descent use different tables")
    void testDirection() {
        EdgeAttributes uphill = EdgeAttributes.builder().inclinePercent(6.0d).build();

        assertEquals(20.0d, EdgeWeightCalculator.weigh(10.0d, uphill, false, WHEELCHAIR), 1e-9);
        assertEquals(15.0d, EdgeWeightCalculator.weigh(10.0d, uphill, true, WHEELCHAIR), 1e-9);
        assertEquals(10.0d, EdgeWeightCalculator.weigh(10.0d, uphill, true, STANDARD), 1e-9);
    }

    @Test
    @DisplayName("Exclusions make a traversal impassable")
    void testExclusion() {
        EdgeAttributes stairs = RoutingFixtureFactory.stairs();

        double cost = EdgeWeightCalculator.weigh(10.0d, stairs, false, WHEELCHAIR);
        assertEquals(EdgeWeightCalculator.IMPASSABLE, cost);
        assertFalse(EdgeWeightCalculator.isPassable(cost));

        CostBreakdown breakdown = EdgeWeightCalculator.explain(10.0d, stairs, false, WHEELCHAIR);
        assertTrue(breakdown.isExcluded());
        assertEquals(ExclusionRule.STEPS_WITHOUT_RAMP, breakdown.getExclusion());
        assertEquals(1.0d, breakdown.combinedFactor(), 0.0d);
    }

    @Test
    @DisplayName("Steps factor applies only to steps without a ramp")
    void testStepsFactor() {
        MobilityProfile impaired = BuiltInProfiles.temporaryImpairment();
        EdgeAttributes stairsWithRamp = RoutingFixtureFactory.stairs().toBuilder().ramp(true).build();

        assertEquals(500.0d, EdgeWeightCalculator.weigh(10.0d, RoutingFixtureFactory.stairs(), false, impaired), 1e-9);
        assertEquals(10.0d, EdgeWeightCalculator.weigh(10.0d, stairsWithRamp, false, impaired), 1e-9);
        assertEquals(10.0d, EdgeWeightCalculator.weigh(10.0d, RoutingFixtureFactory.stairs(), false, STANDARD), 1e-9);
    }

    @Test
    @DisplayName("Non-positive or non-finite lengths are rejected")
    void testInvalidLength() {
        assertThrows(IllegalArgumentException.class,
                () -> EdgeWeightCalculator.weigh(0.0d, EdgeAttributes.neutral(), false, STANDARD));
        assertThrows(IllegalArgumentException.class,
                () -> EdgeWeightCalculator.weigh(Double.NaN, EdgeAttributes.neutral(), false, STANDARD));
    }

    @Test
    @DisplayName("Every arc weight is positive finite or impassable, never below its length")
    void testWeightRange() {
        PathGraph graph = RoutingFixtureFactory.grid(8, 8, 7L);
        for (MobilityProfile profile : BuiltInProfiles.all()) {
            for (int arc = 0; arc < graph.arcCount(); arc++) {
                double cost = EdgeWeightCalculator.weigh(graph, arc, profile);
                double length = graph.edgeLength(PathGraph.arcEdge(arc));
                assertTrue(cost == EdgeWeightCalculator.IMPASSABLE || (Double.isFinite(cost) && cost >= length),
                        profile.name() + " arc " + arc + " cost " + cost);
                assertEquals(cost, EdgeWeightCalculator.weigh(graph, arc, profile), 0.0d);
            }
        }
    }

    @Test
    @DisplayName("Time factor covers surface and directed slope only")
    void testTimeFactor() {
        EdgeAttributes attributes = EdgeAttributes.builder()
                .surface(SurfaceClass.UNPAVED)
                .inclinePercent(-9.0d)
                .crossing(CrossingKind.UNMARKED)
                .build();

        assertEquals(1.5d * 2.0d, EdgeWeightCalculator.timeFactor(attributes, false, BuiltInProfiles.elderly()), 1e-9);
        assertEquals(1.5d * 2.5d, EdgeWeightCalculator.timeFactor(attributes, true, BuiltInProfiles.elderly()), 1e-9);
    }

    @Test
    @DisplayName("Built-in profiles charge stairs above ramps and unpaved above paved")
    void testBuiltInOrdering() {
        EdgeAttributes stairs = EdgeAttributes.builder().steps(true).build();
        EdgeAttributes ramp = EdgeAttributes.builder().ramp(true).inclinePercent(6.0d).build();
        EdgeAttributes paved = EdgeAttributes.builder().surface(SurfaceClass.PAVED).build();
        EdgeAttributes unpaved = EdgeAttributes.builder().surface(SurfaceClass.UNPAVED).build();

        for (MobilityProfile profile : BuiltInProfiles.all()) {
            if (profile.name().equals(BuiltInProfiles.STANDARD)) {
                assertEquals(EdgeWeightCalculator.weigh(10.0d, paved, false, profile),
                        EdgeWeightCalculator.weigh(10.0d, unpaved, false, profile), 0.0d);
                continue;
            }
            assertTrue(EdgeWeightCalculator.weigh(10.0d, stairs, false, profile)
                    > EdgeWeightCalculator.weigh(10.0d, ramp, false, profile), profile.name());
            assertTrue(EdgeWeightCalculator.weigh(10.0d, unpaved, false, profile)
                    > EdgeWeightCalculator.weigh(10.0d, paved, false, profile), profile.name());
        }
    }
}
