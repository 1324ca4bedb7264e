package org.accessroute.routing.route;

import lombok.experimental.UtilityClass;
import org.accessroute.routing.cost.EdgeWeightCalculator;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.MobilityProfile;
import org.accessroute.routing.search.SearchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts search paths into {@link Route} values.
 * <p>
 * Metrics:
 * </p>
 * <pre>
 * distance = sum of physical arc lengths
 * time     = sum of length / baseSpeed * f_surface * f_slope(direction)
 * steps    = floor(distance / STRIDE_LENGTH_METERS)
 * </pre>
 */
@UtilityClass
public class RouteAssembler {
    public static final double STRIDE_LENGTH_METERS = 0.75d;

    /**
     * Assembles the arc path of a found search result.
     *
     * @throws IllegalArgumentException when the result is not {@code FOUND}.
     */
    public static Route assemble(WeightedGraph graph, SearchResult result) {
        Objects.requireNonNull(result, "result");
        if (!result.isFound()) {
            throw new IllegalArgumentException("cannot assemble route from " + result.outcome() + " result");
        }
        return assembleArcs(graph, result.nodePath()[0], result.arcPath());
    }

    /**
     * Assembles a node path, walking the cheapest passable arc between consecutive nodes.
     *
     * @throws IllegalArgumentException when two consecutive nodes share no passable arc.
     */
    public static Route assemble(WeightedGraph graph, int[] nodePath) {
        Objects.requireNonNull(nodePath, "nodePath");
        if (nodePath.length == 0) {
            throw new IllegalArgumentException("nodePath must contain at least one node");
        }
        int[] arcs = new int[nodePath.length - 1];
        for (int i = 0; i < arcs.length; i++) {
            arcs[i] = cheapestArc(graph, nodePath[i], nodePath[i + 1]);
        }
        return assembleArcs(graph, nodePath[0], arcs);
    }

    private static Route assembleArcs(WeightedGraph graph, int origin, int[] arcPath) {
        PathGraph pathGraph = graph.graph();
        MobilityProfile profile = graph.profile();

        Route.RouteBuilder route = Route.builder()
                .profileName(profile.name())
                .nodeId(pathGraph.nodeId(origin));
        List<Coordinate> coordinates = new ArrayList<>();
        coordinates.add(pathGraph.nodeCoordinate(origin));

        double distance = 0.0d;
        double seconds = 0.0d;
        double cost = 0.0d;
        for (int arc : arcPath) {
            int edge = PathGraph.arcEdge(arc);
            double length = pathGraph.edgeLength(edge);
            distance += length;
            seconds += length / profile.baseSpeedMetersPerSecond()
                    * EdgeWeightCalculator.timeFactor(pathGraph.edgeAttributes(edge), PathGraph.isReverseArc(arc), profile);
            cost += graph.arcCost(arc);

            List<Coordinate> polyline = pathGraph.arcPolyline(arc);
            for (int i = 0; i < polyline.size(); i++) {
                Coordinate point = polyline.get(i);
                if (i == 0 && point.equals(coordinates.get(coordinates.size() - 1))) {
                    continue;
                }
                coordinates.add(point);
            }
            route.nodeId(pathGraph.nodeId(pathGraph.arcTarget(arc)));
        }

        return route.coordinates(coordinates)
                .distanceMeters(distance)
                .estimatedSeconds(seconds)
                .stepCount(stepCount(distance))
                .weightedCost(cost)
                .build();
    }

    /**
     * @return {@code floor(distance / 0.75)}.
     */
    public static long stepCount(double distanceMeters) {
        return (long) Math.floor(distanceMeters / STRIDE_LENGTH_METERS);
    }

    private static int cheapestArc(WeightedGraph graph, int from, int to) {
        PathGraph pathGraph = graph.graph();
        int best = -1;
        double bestCost = EdgeWeightCalculator.IMPASSABLE;
        int end = pathGraph.outgoingEnd(from);
        for (int i = pathGraph.outgoingStart(from); i < end; i++) {
            int arc = pathGraph.outgoingArcAt(i);
            if (pathGraph.arcTarget(arc) == to && graph.arcCost(arc) < bestCost) {
                best = arc;
                bestCost = graph.arcCost(arc);
            }
        }
        if (best < 0) {
            throw new IllegalArgumentException(
                    "no passable arc between " + pathGraph.nodeId(from) + " and " + pathGraph.nodeId(to));
        }
        return best;
    }
}
