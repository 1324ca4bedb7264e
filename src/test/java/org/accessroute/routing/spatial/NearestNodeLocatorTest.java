package org.accessroute.routing.spatial;

import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Nearest Node Locator Tests")
class NearestNodeLocatorTest {

    @Test
    @DisplayName("Snaps to the closest node and reports the distance")
    void testNearest() {
        PathGraph graph = RoutingFixtureFactory.line(5);
        NearestNodeLocator locator = new NearestNodeLocator(graph);

        NodeMatch match = locator.nearest(0.00001d, 0.00021d);

        assertNotNull(match);
        assertEquals("n2", match.nodeId());
        assertEquals(graph.nodeIndex("n2"), match.nodeIndex());
        assertEquals(0.0d, match.nodeLat(), 0.0d);
        assertTrue(match.distanceMeters() > 0.0d && match.distanceMeters() < 3.0d);
    }

    @Test
    @DisplayName("Eligibility filter skips rejected nodes")
    void testFilter() {
        NearestNodeLocator locator = new NearestNodeLocator(RoutingFixtureFactory.line(5));

        NodeMatch match = locator.nearest(0.0d, 0.0002d, node -> node != 2);

        assertNotNull(match);
        assertTrue(match.nodeId().equals("n1") || match.nodeId().equals("n3"));
        assertNull(locator.nearest(0.0d, 0.0d, node -> false));
    }

    @Test
    @DisplayName("Points beyond the snap radius are out of coverage")
    void testSnapRadius() {
        NearestNodeLocator locator = new NearestNodeLocator(RoutingFixtureFactory.line(3), 50.0d);

        assertEquals(50.0d, locator.maxSnapDistanceMeters(), 0.0d);
        assertNotNull(locator.nearest(0.0003d, 0.0d));
        assertNull(locator.nearest(0.01d, 0.0d));
        assertEquals(NearestNodeLocator.DEFAULT_MAX_SNAP_DISTANCE_METERS,
                new NearestNodeLocator(RoutingFixtureFactory.line(1)).maxSnapDistanceMeters(), 0.0d);
    }

    @Test
    @DisplayName("Invalid coordinates and radii are rejected")
    void testValidation() {
        PathGraph graph = RoutingFixtureFactory.line(2);

        assertThrows(IllegalArgumentException.class, () -> new NearestNodeLocator(graph, 0.0d));
        assertThrows(IllegalArgumentException.class, () -> new NearestNodeLocator(graph, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new NearestNodeLocator(graph).nearest(91.0d, 0.0d));
        assertThrows(IllegalArgumentException.class, () -> new NearestNodeLocator(graph).nearest(0.0d, Double.NaN));
    }
}
