package org.accessroute.routing.heuristic;

import org.accessroute.routing.cost.WeightedGraph;

import java.util.Objects;

/**
 * Zero heuristic. A* driven by this provider expands nodes exactly like Dijkstra.
 */
public final class NullHeuristicProvider implements HeuristicProvider {
    private final int nodeCount;
    private final GoalBoundHeuristic zeroEstimator;

    public NullHeuristicProvider(WeightedGraph weightedGraph) {
        Objects.requireNonNull(weightedGraph, "weightedGraph");
        this.nodeCount = weightedGraph.nodeCount();
        this.zeroEstimator = nodeId -> 0.0d;
    }

    @Override
    public HeuristicType type() {
        return HeuristicType.NONE;
    }

    @Override
    public GoalBoundHeuristic bindGoal(int goalNodeId) {
        if (goalNodeId < 0 || goalNodeId >= nodeCount) {
            throw new IllegalArgumentException(
                    "goalNodeId out of bounds: " + goalNodeId + " [0, " + nodeCount + ")"
            );
        }
        return zeroEstimator;
    }
}
