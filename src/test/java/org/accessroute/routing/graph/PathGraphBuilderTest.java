package org.accessroute.routing.graph;

import org.accessroute.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Graph Builder Tests")
class PathGraphBuilderTest {

    @Test
    @DisplayName("Undirected edges expose two twin arcs with CSR adjacency")
    void testArcsAndAdjacency() {
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.0001d)
                .addNode("c", 0.0001d, 0.0001d)
                .addEdge("a", "b", EdgeAttributes.neutral())
                .addEdge("b", "c", EdgeAttributes.neutral())
                .build();

        assertEquals(3, graph.nodeCount());
        assertEquals(2, graph.edgeCount());
        assertEquals(4, graph.arcCount());
        assertEquals(1, graph.degree(graph.nodeIndex("a")));
        assertEquals(2, graph.degree(graph.nodeIndex("b")));

        int forward = PathGraph.forwardArc(1);
        int reverse = PathGraph.reverseArc(1);
        assertEquals(reverse, PathGraph.twinArc(forward));
        assertEquals(forward, PathGraph.twinArc(reverse));
        assertEquals(1, PathGraph.arcEdge(reverse));
        assertTrue(PathGraph.isReverseArc(reverse));
        assertEquals(graph.nodeIndex("b"), graph.arcOrigin(forward));
        assertEquals(graph.nodeIndex("c"), graph.arcTarget(forward));
        assertEquals(graph.nodeIndex("c"), graph.arcOrigin(reverse));
        assertEquals(graph.nodeIndex("b"), graph.arcTarget(reverse));

        int b = graph.nodeIndex("b");
        for (int i = graph.outgoingStart(b); i < graph.outgoingEnd(b); i++) {
            assertEquals(b, graph.arcOrigin(graph.outgoingArcAt(i)));
        }
    }

    @Test
    @DisplayName("Length is derived from geometry, not the endpoint chord")
    void testGeometryLength() {
        Coordinate bend = new Coordinate(0.001d, 0.0005d);
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.001d)
                .addEdge("a", "b", null, List.of(bend), EdgeAttributes.neutral())
                .build();

        double expected = GeoDistance.greatCircleMeters(new Coordinate(0.0d, 0.0d), bend)
                + GeoDistance.greatCircleMeters(bend, new Coordinate(0.0d, 0.001d));
        assertEquals(expected, graph.edgeLength(0), 1e-6);
        assertTrue(graph.edgeLength(0) > GeoDistance.greatCircleMeters(0.0d, 0.0d, 0.0d, 0.001d));
        assertEquals(List.of(bend), graph.edgeGeometry(0));
    }

    @Test
    @DisplayName("Explicit length is kept at or above the chord and replaced below it")
    void testExplicitLengthChordRule() {
        double chord = GeoDistance.greatCircleMeters(0.0d, 0.0d, 0.0d, 0.001d);
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.001d)
                .addEdge("a", "b", chord + 25.0d, EdgeAttributes.neutral())
                .addEdge("a", "b", chord / 2.0d, EdgeAttributes.neutral())
                .build();

        assertEquals(2, graph.edgeCount());
        assertEquals(chord + 25.0d, graph.edgeLength(0), 1e-9);
        assertEquals(chord, graph.edgeLength(1), 1e-6);
    }

    @Test
    @DisplayName("Invalid edges are dropped and counted; the load continues")
    void testDroppedEdges() {
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.001d)
                .addEdge("a", "missing", EdgeAttributes.neutral())
                .addEdge("a", "b", null, List.of(new Coordinate(Double.NaN, 0.0d)), EdgeAttributes.neutral())
                .addEdge("a", "a", EdgeAttributes.neutral())
                .addEdge("a", "b", EdgeAttributes.neutral())
                .build();

        assertEquals(1, graph.edgeCount());
        assertEquals(3, graph.droppedEdgeCount());
    }

    @Test
    @DisplayName("Kept edges keep insertion order, endpoints and lengths around dropped ones")
    void testKeptEdgesAroundDropped() {
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.001d)
                .addNode("c", 0.001d, 0.001d)
                .addEdge("a", "missing", EdgeAttributes.neutral())
                .addEdge("a", "b", 140.0d, EdgeAttributes.neutral())
                .addEdge("b", "b", EdgeAttributes.neutral())
                .addEdge("c", "b", 175.5d, EdgeAttributes.neutral())
                .addEdge("c", "missing", EdgeAttributes.neutral())
                .addEdge("a", "c", 210.25d, EdgeAttributes.neutral())
                .build();

        assertEquals(3, graph.edgeCount());
        assertEquals(3, graph.droppedEdgeCount());
        int a = graph.nodeIndex("a");
        int b = graph.nodeIndex("b");
        int c = graph.nodeIndex("c");
        assertEquals(a, graph.edgeFrom(0));
        assertEquals(b, graph.edgeTo(0));
        assertEquals(140.0d, graph.edgeLength(0), 1e-9);
        assertEquals(c, graph.edgeFrom(1));
        assertEquals(b, graph.edgeTo(1));
        assertEquals(175.5d, graph.edgeLength(1), 1e-9);
        assertEquals(a, graph.edgeFrom(2));
        assertEquals(c, graph.edgeTo(2));
        assertEquals(210.25d, graph.edgeLength(2), 1e-9);
    }

    @Test
    @DisplayName("Duplicate, blank and out-of-range nodes are skipped and counted")
    void testDroppedNodes() {
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("a", 1.0d, 1.0d)
                .addNode(" ", 0.0d, 0.0d)
                .addNode("far", 91.0d, 0.0d)
                .build();

        assertEquals(1, graph.nodeCount());
        assertEquals(3, graph.droppedNodeCount());
        assertEquals(new Coordinate(0.0d, 0.0d), graph.nodeCoordinate(0));
        assertEquals(-1, graph.nodeIndex("far"));
    }

    @Test
    @DisplayName("Parallel edges between one node pair stay independent")
    void testParallelEdges() {
        PathGraph graph = RoutingFixtureFactory.stairsVersusRamp();

        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertTrue(graph.edgeAttributes(0).isSteps());
        assertTrue(graph.edgeAttributes(1).isRamp());
        assertEquals(10.0d, graph.edgeLength(0), 1e-9);
    }

    @Test
    @DisplayName("Reverse arc polyline walks the geometry backwards")
    void testArcPolyline() {
        Coordinate bend = new Coordinate(0.0005d, 0.0005d);
        PathGraph graph = new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.001d)
                .addEdge("a", "b", null, List.of(bend), EdgeAttributes.neutral())
                .build();

        assertEquals(
                List.of(new Coordinate(0.0d, 0.0d), bend, new Coordinate(0.0d, 0.001d)),
                graph.arcPolyline(PathGraph.forwardArc(0)));
        assertEquals(
                List.of(new Coordinate(0.0d, 0.001d), bend, new Coordinate(0.0d, 0.0d)),
                graph.arcPolyline(PathGraph.reverseArc(0)));
    }

    @Test
    @DisplayName("Great-circle distance: known values and antimeridian wrap")
    void testGeoDistance() {
        // One degree of latitude is ~111.2 km on the mean sphere.
        assertEquals(111_195.0d, GeoDistance.greatCircleMeters(0.0d, 0.0d, 1.0d, 0.0d), 1.0d);
        assertEquals(0.0d, GeoDistance.greatCircleMeters(10.0d, 20.0d, 10.0d, 20.0d), 1e-9);
        assertEquals(
                GeoDistance.greatCircleMeters(0.0d, 179.9d, 0.0d, -179.9d),
                GeoDistance.greatCircleMeters(0.0d, 0.0d, 0.0d, 0.2d),
                1e-6);
        assertEquals(0.0d, GeoDistance.polylineMeters(List.of(new Coordinate(1.0d, 1.0d))), 1e-9);
    }
}
