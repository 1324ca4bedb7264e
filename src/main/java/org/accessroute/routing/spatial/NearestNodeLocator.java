package org.accessroute.routing.spatial;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.GeoDistance;
import org.accessroute.routing.graph.PathGraph;

import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Snaps WGS-84 coordinates to the nearest graph node by great-circle distance.
 *
 * <p>Campus graphs are small, so lookup is a linear scan. Matches farther than
 * {@link #maxSnapDistanceMeters()} are rejected.</p>
 */
public final class NearestNodeLocator {
    public static final double DEFAULT_MAX_SNAP_DISTANCE_METERS = 250.0d;

    private final PathGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final double maxSnapDistanceMeters;

    public NearestNodeLocator(PathGraph graph) {
        this(graph, DEFAULT_MAX_SNAP_DISTANCE_METERS);
    }

    public NearestNodeLocator(PathGraph graph, double maxSnapDistanceMeters) {
        this.graph = Objects.requireNonNull(graph, "graph");
        if (!(maxSnapDistanceMeters > 0.0d)) {
            throw new IllegalArgumentException("maxSnapDistanceMeters must be > 0, got " + maxSnapDistanceMeters);
        }
        this.maxSnapDistanceMeters = maxSnapDistanceMeters;
    }

    /**
     * @return nearest node within the snap distance, or {@code null}.
     */
    public NodeMatch nearest(double lat, double lon) {
        return nearest(lat, lon, node -> true);
    }

    /**
     * @param eligible filter on internal node indices, e.g. nodes with a passable arc.
     * @return nearest eligible node within the snap distance, or {@code null}.
     */
    public NodeMatch nearest(double lat, double lon, IntPredicate eligible) {
        if (!Coordinate.isValid(lat, lon)) {
            throw new IllegalArgumentException("coordinate out of WGS-84 bounds: (" + lat + ", " + lon + ")");
        }
        int bestNode = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (!eligible.test(node)) {
                continue;
            }
            double distance = GeoDistance.greatCircleMeters(lat, lon, graph.nodeLat(node), graph.nodeLon(node));
            if (distance < bestDistance) {
                bestDistance = distance;
                bestNode = node;
            }
        }
        if (bestNode < 0 || bestDistance > maxSnapDistanceMeters) {
            return null;
        }
        return new NodeMatch(bestNode, graph.nodeId(bestNode), graph.nodeLat(bestNode), graph.nodeLon(bestNode), bestDistance);
    }
}
