package org.accessroute.routing.search;

import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.heuristic.GoalBoundHeuristic;
import org.accessroute.routing.heuristic.HeuristicFactory;
import org.accessroute.routing.heuristic.HeuristicType;

import java.util.Objects;

/**
 * Goal-directed search guided by an admissible, consistent heuristic.
 */
public final class AStarStrategy extends UnidirectionalSearch {
    private final HeuristicType heuristicType;

    public AStarStrategy() {
        this(SearchBudget.defaults());
    }

    public AStarStrategy(SearchBudget budget) {
        this(budget, HeuristicType.SPHERICAL);
    }

    /**
     * @param heuristicType {@link HeuristicType#NONE} degrades to Dijkstra expansion order.
     */
    public AStarStrategy(SearchBudget budget, HeuristicType heuristicType) {
        super(budget);
        this.heuristicType = Objects.requireNonNull(heuristicType, "heuristicType");
    }

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.A_STAR;
    }

    public HeuristicType heuristicType() {
        return heuristicType;
    }

    @Override
    GoalBoundHeuristic heuristic(WeightedGraph graph, int destination) {
        return HeuristicFactory.create(heuristicType, graph).bindGoal(destination);
    }
}
