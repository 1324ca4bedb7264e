package org.accessroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.PathGraph;

import java.util.Collections;
import java.util.Objects;

/**
 * Shared request screening and budget handling for all strategies.
 *
 * <p>Screening order: endpoints out of range, then {@code origin == destination}, then
 * endpoints without any passable incident arc. Only then is {@link #search} invoked.</p>
 */
abstract class AbstractSearchStrategy implements SearchStrategy {
    static final double INF = Double.POSITIVE_INFINITY;
    static final int NO_ARC = -1;

    private final SearchBudget budget;

    AbstractSearchStrategy(SearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public final SearchResult find(WeightedGraph graph, int origin, int destination, ExplorationCounter counter) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(counter, "counter");
        PathGraph pathGraph = graph.graph();
        if (!pathGraph.containsNode(origin) || !pathGraph.containsNode(destination)) {
            return SearchResult.noRoute(0);
        }
        if (origin == destination) {
            counter.markFinalized(origin);
            return SearchResult.found(new int[]{origin}, new int[0], 0.0d, 1);
        }
        if (!graph.hasPassableIncidentArc(origin) || !graph.hasPassableIncidentArc(destination)) {
            return SearchResult.noRoute(0);
        }

        int exploredBefore = counter.count();
        try {
            return search(graph, origin, destination, counter, exploredBefore);
        } catch (SearchBudget.BudgetExceededException ex) {
            return SearchResult.boundExceeded(counter.count() - exploredBefore);
        }
    }

    /**
     * Runs the strategy for screened, distinct, range-checked endpoints.
     *
     * @param exploredBefore counter value before the search, for per-query explored counts.
     */
    abstract SearchResult search(
            WeightedGraph graph,
            int origin,
            int destination,
            ExplorationCounter counter,
            int exploredBefore
    );

    SearchBudget budget() {
        return budget;
    }

    /**
     * Walks predecessor arcs from {@code node} back to the lane's root.
     *
     * @return arcs in walking order from the root to {@code node}.
     */
    static IntArrayList unwindForward(PathGraph graph, int[] predecessorArc, int node) {
        IntArrayList arcs = new IntArrayList();
        int current = node;
        while (predecessorArc[current] != NO_ARC) {
            int arc = predecessorArc[current];
            arcs.add(arc);
            current = graph.arcOrigin(arc);
        }
        Collections.reverse(arcs);
        return arcs;
    }

    /**
     * Converts an arc path starting at {@code origin} into its node sequence.
     */
    static int[] toNodePath(PathGraph graph, int origin, int[] arcPath) {
        int[] nodes = new int[arcPath.length + 1];
        nodes[0] = origin;
        for (int i = 0; i < arcPath.length; i++) {
            nodes[i + 1] = graph.arcTarget(arcPath[i]);
        }
        return nodes;
    }

    static double pathCost(WeightedGraph graph, int[] arcPath) {
        double cost = 0.0d;
        for (int arc : arcPath) {
            cost += graph.arcCost(arc);
        }
        return cost;
    }
}
