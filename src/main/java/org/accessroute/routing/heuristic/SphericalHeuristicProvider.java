package org.accessroute.routing.heuristic;

import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.GeoDistance;
import org.accessroute.routing.graph.PathGraph;

import java.util.Objects;

/**
 * Great-circle heuristic for geodetic path graphs.
 *
 * <p>Estimate: {@code greatCircle(node, goal)} in meters. Every edge is at least as long as
 * the chord between its endpoints and profile factors are never below {@code 1.0}, so the
 * estimate never exceeds the true remaining cost (admissible) and drops by at most one arc
 * cost across an arc (consistent). Profiles cannot tighten the bound: their {@code UNKNOWN}
 * buckets stay neutral.</p>
 */
public final class SphericalHeuristicProvider implements HeuristicProvider {
    private final PathGraph graph;
    private final double baseSpeedMetersPerSecond;

    public SphericalHeuristicProvider(WeightedGraph weightedGraph) {
        Objects.requireNonNull(weightedGraph, "weightedGraph");
        this.graph = weightedGraph.graph();
        this.baseSpeedMetersPerSecond = weightedGraph.profile().baseSpeedMetersPerSecond();
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.SPHERICAL;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        validateNode(goalNodeId, "goalNodeId");
        return new BoundSphericalHeuristic(
                graph,
                graph.nodeLat(goalNodeId),
                graph.nodeLon(goalNodeId)
        );
    }

    /**
     * Lower bound on walking time between two nodes, in seconds, at the profile's base speed.
     */
    public double estimateSeconds(int fromNodeId, int goalNodeId) {
        validateNode(fromNodeId, "fromNodeId");
        validateNode(goalNodeId, "goalNodeId");
        double meters = GeoDistance.greatCircleMeters(
                graph.nodeLat(fromNodeId),
                graph.nodeLon(fromNodeId),
                graph.nodeLat(goalNodeId),
                graph.nodeLon(goalNodeId)
        );
        return meters / baseSpeedMetersPerSecond;
    }

    private void validateNode(int nodeId, String label) {
        if (nodeId < 0 || nodeId >= graph.nodeCount()) {
            throw new IllegalArgumentException(
                    label + " out of bounds: " + nodeId + " [0, " + graph.nodeCount() + ")"
            );
        }
    }

    private static final class BoundSphericalHeuristic implements GoalBoundHeuristic {
        private final PathGraph graph;
        private final double goalLatDeg;
        private final double goalLonDeg;

        private BoundSphericalHeuristic(PathGraph graph, double goalLatDeg, double goalLonDeg) {
            this.graph = graph;
            this.goalLatDeg = goalLatDeg;
            this.goalLonDeg = goalLonDeg;
        }

        @Override
        public double estimateFromNode(int nodeId) {
            return GeoDistance.greatCircleMeters(
                    graph.nodeLat(nodeId),
                    graph.nodeLon(nodeId),
                    goalLatDeg,
                    goalLonDeg
            );
        }
    }
}
