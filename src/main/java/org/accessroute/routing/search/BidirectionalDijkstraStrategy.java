package org.accessroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.PathGraph;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Bidirectional uniform-cost search.
 *
 * <p>A forward lane grows from the origin over outgoing arcs and a backward lane grows from
 * the destination over incoming arcs, both in walking direction costs. Each step expands
 * the lane with the smaller frontier (forward on ties). {@code mu} tracks the best
 * origin-destination total seen through any node labelled by both lanes; the search stops
 * once {@code topForward + topBackward >= mu}.</p>
 */
public final class BidirectionalDijkstraStrategy extends AbstractSearchStrategy {

    public BidirectionalDijkstraStrategy() {
        this(SearchBudget.defaults());
    }

    public BidirectionalDijkstraStrategy(SearchBudget budget) {
        super(budget);
    }

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.BIDIRECTIONAL_DIJKSTRA;
    }

    @Override
    SearchResult search(
            WeightedGraph graph,
            int origin,
            int destination,
            ExplorationCounter counter,
            int exploredBefore
    ) {
        PathGraph pathGraph = graph.graph();
        Lane forward = new Lane(pathGraph.nodeCount(), origin);
        Lane backward = new Lane(pathGraph.nodeCount(), destination);

        double mu = INF;
        int meetingNode = -1;
        int settledCount = 0;

        while (true) {
            forward.dropStale();
            backward.dropStale();
            if (forward.frontier.isEmpty() || backward.frontier.isEmpty()) {
                break;
            }
            if (forward.frontier.peek().cost() + backward.frontier.peek().cost() >= mu) {
                break;
            }

            boolean expandForward = forward.frontier.size() <= backward.frontier.size();
            Lane lane = expandForward ? forward : backward;
            Lane other = expandForward ? backward : forward;

            FrontierEntry entry = lane.frontier.poll();
            int node = entry.node();
            lane.settled[node] = true;
            counter.markFinalized(node);
            budget().checkSettledNodes(++settledCount);

            double g = lane.bestCost[node];
            int end = pathGraph.outgoingEnd(node);
            for (int i = pathGraph.outgoingStart(node); i < end; i++) {
                int outgoing = pathGraph.outgoingArcAt(i);
                // Backward lane walks the twin arc, i.e. from the neighbour towards this node.
                int walked = expandForward ? outgoing : PathGraph.twinArc(outgoing);
                double arcCost = graph.arcCost(walked);
                if (arcCost == INF) {
                    continue;
                }
                int next = pathGraph.arcTarget(outgoing);
                if (lane.settled[next]) {
                    continue;
                }
                double nextCost = g + arcCost;
                if (nextCost < lane.bestCost[next]) {
                    lane.bestCost[next] = nextCost;
                    lane.predecessorArc[next] = walked;
                    lane.push(next, nextCost);
                    budget().checkFrontierSize(forward.frontier.size() + backward.frontier.size());
                }
                if (other.bestCost[next] != INF && lane.bestCost[next] + other.bestCost[next] < mu) {
                    mu = lane.bestCost[next] + other.bestCost[next];
                    meetingNode = next;
                }
            }
        }

        int explored = counter.count() - exploredBefore;
        if (meetingNode < 0) {
            return SearchResult.noRoute(explored);
        }

        IntArrayList arcs = unwindForward(pathGraph, forward.predecessorArc, meetingNode);
        int current = meetingNode;
        while (backward.predecessorArc[current] != NO_ARC) {
            int arc = backward.predecessorArc[current];
            arcs.add(arc);
            current = pathGraph.arcTarget(arc);
        }
        int[] arcPath = arcs.toIntArray();
        return SearchResult.found(toNodePath(pathGraph, origin, arcPath), arcPath, mu, explored);
    }

    /**
     * Per-direction search state. For the backward lane, {@code predecessorArc[v]} is the arc
     * walked from {@code v} towards the destination.
     */
    private static final class Lane {
        private final double[] bestCost;
        private final int[] predecessorArc;
        private final boolean[] settled;
        private final PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>();
        private long sequence;

        private Lane(int nodeCount, int root) {
            this.bestCost = new double[nodeCount];
            this.predecessorArc = new int[nodeCount];
            this.settled = new boolean[nodeCount];
            Arrays.fill(bestCost, INF);
            Arrays.fill(predecessorArc, NO_ARC);
            bestCost[root] = 0.0d;
            push(root, 0.0d);
        }

        private void push(int node, double cost) {
            frontier.add(new FrontierEntry(node, cost, cost, sequence++));
        }

        private void dropStale() {
            while (!frontier.isEmpty()) {
                FrontierEntry top = frontier.peek();
                if (!settled[top.node()] && top.cost() <= bestCost[top.node()]) {
                    return;
                }
                frontier.poll();
            }
        }
    }
}
