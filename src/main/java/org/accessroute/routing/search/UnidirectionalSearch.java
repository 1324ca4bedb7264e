package org.accessroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.heuristic.GoalBoundHeuristic;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Single-frontier label-setting search with priority {@code g + h}.
 *
 * <p>With a zero heuristic this is Dijkstra; with a consistent heuristic it is A*. The
 * search stops as soon as the destination is finalized.</p>
 */
abstract class UnidirectionalSearch extends AbstractSearchStrategy {

    UnidirectionalSearch(SearchBudget budget) {
        super(budget);
    }

    /**
     * @return heuristic bound to {@code destination} for this graph.
     */
    abstract GoalBoundHeuristic heuristic(WeightedGraph graph, int destination);

    @Override
    final SearchResult search(
            WeightedGraph graph,
            int origin,
            int destination,
            ExplorationCounter counter,
            int exploredBefore
    ) {
        PathGraph pathGraph = graph.graph();
        int nodeCount = pathGraph.nodeCount();
        GoalBoundHeuristic heuristic = heuristic(graph, destination);

        double[] bestCost = new double[nodeCount];
        int[] predecessorArc = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        Arrays.fill(bestCost, INF);
        Arrays.fill(predecessorArc, NO_ARC);

        PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        long sequence = 0L;
        bestCost[origin] = 0.0d;
        frontier.add(new FrontierEntry(origin, 0.0d, heuristic.estimateFromNode(origin), sequence++));

        int settledCount = 0;
        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            int node = entry.node();
            if (settled[node] || entry.cost() > bestCost[node]) {
                continue;
            }
            settled[node] = true;
            counter.markFinalized(node);
            budget().checkSettledNodes(++settledCount);

            if (node == destination) {
                IntArrayList arcs = unwindForward(pathGraph, predecessorArc, destination);
                int[] arcPath = arcs.toIntArray();
                return SearchResult.found(
                        toNodePath(pathGraph, origin, arcPath),
                        arcPath,
                        bestCost[destination],
                        counter.count() - exploredBefore
                );
            }

            double g = bestCost[node];
            int end = pathGraph.outgoingEnd(node);
            for (int i = pathGraph.outgoingStart(node); i < end; i++) {
                int arc = pathGraph.outgoingArcAt(i);
                double arcCost = graph.arcCost(arc);
                if (arcCost == INF) {
                    continue;
                }
                int next = pathGraph.arcTarget(arc);
                if (settled[next]) {
                    continue;
                }
                double nextCost = g + arcCost;
                if (nextCost < bestCost[next]) {
                    bestCost[next] = nextCost;
                    predecessorArc[next] = arc;
                    frontier.add(new FrontierEntry(
                            next,
                            nextCost,
                            nextCost + heuristic.estimateFromNode(next),
                            sequence++
                    ));
                    budget().checkFrontierSize(frontier.size());
                }
            }
        }
        return SearchResult.noRoute(counter.count() - exploredBefore);
    }
}
