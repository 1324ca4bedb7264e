package org.accessroute.routing.search;

import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.heuristic.GoalBoundHeuristic;

/**
 * Forward uniform-cost search from the origin.
 */
public final class DijkstraStrategy extends UnidirectionalSearch {
    private static final GoalBoundHeuristic ZERO = nodeId -> 0.0d;

    public DijkstraStrategy() {
        this(SearchBudget.defaults());
    }

    public DijkstraStrategy(SearchBudget budget) {
        super(budget);
    }

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.DIJKSTRA;
    }

    @Override
    GoalBoundHeuristic heuristic(WeightedGraph graph, int destination) {
        return ZERO;
    }
}
