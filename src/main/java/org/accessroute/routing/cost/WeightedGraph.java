package org.accessroute.routing.cost;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.MobilityProfile;

import java.util.Objects;

/**
 * Immutable profile-specific view of a {@link PathGraph}: one cost per directed arc.
 * <p>
 * Costs are positive finite effort-meters or {@link EdgeWeightCalculator#IMPASSABLE}.
 * Built once per profile (see {@link WeightedGraphCache}) and shared read-only by
 * concurrent searches.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class WeightedGraph {
    private final PathGraph graph;
    private final MobilityProfile profile;
    @Getter(AccessLevel.NONE)
    private final double[] costByArc;
    private final int passableArcCount;

    private WeightedGraph(PathGraph graph, MobilityProfile profile, double[] costByArc, int passableArcCount) {
        this.graph = graph;
        this.profile = profile;
        this.costByArc = costByArc;
        this.passableArcCount = passableArcCount;
    }

    /**
     * Weighs every arc of the graph for one profile.
     */
    public static WeightedGraph build(PathGraph graph, MobilityProfile profile) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(profile, "profile");
        double[] costs = new double[graph.arcCount()];
        int passable = 0;
        for (int arc = 0; arc < costs.length; arc++) {
            costs[arc] = EdgeWeightCalculator.weigh(graph, arc, profile);
            if (EdgeWeightCalculator.isPassable(costs[arc])) {
                passable++;
            }
        }
        return new WeightedGraph(graph, profile, costs, passable);
    }

    /**
     * @return cost of traversing the arc, {@code +INF} when impassable.
     */
    public double arcCost(int arc) {
        return costByArc[arc];
    }

    public boolean isPassable(int arc) {
        return costByArc[arc] != EdgeWeightCalculator.IMPASSABLE;
    }

    /**
     * Returns whether any passable arc touches the node in either direction.
     * Arcs are paired, so an outgoing arc's twin is the matching incoming arc.
     */
    public boolean hasPassableIncidentArc(int node) {
        int end = graph.outgoingEnd(node);
        for (int i = graph.outgoingStart(node); i < end; i++) {
            int arc = graph.outgoingArcAt(i);
            if (isPassable(arc) || isPassable(PathGraph.twinArc(arc))) {
                return true;
            }
        }
        return false;
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int arcCount() {
        return costByArc.length;
    }

    public int impassableArcCount() {
        return costByArc.length - passableArcCount;
    }
}
