package org.accessroute.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.PathGraph;

/**
 * Creates heuristic providers with uniform validation and reason codes.
 */
@UtilityClass
public class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "HEURISTIC_GRAPH_REQUIRED";
    public static final String REASON_SPHERICAL_LAT_RANGE = "HEURISTIC_SPHERICAL_LAT_RANGE";
    public static final String REASON_SPHERICAL_LON_RANGE = "HEURISTIC_SPHERICAL_LON_RANGE";

    /**
     * @param type requested heuristic type.
     * @param weightedGraph profile-specific graph the estimates are bounded against.
     * @return initialized heuristic provider.
     */
    public static HeuristicProvider create(HeuristicType type, WeightedGraph weightedGraph) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, SPHERICAL)"
            );
        }
        if (weightedGraph == null) {
            throw new HeuristicConfigurationException(REASON_GRAPH_REQUIRED, "weightedGraph must be provided");
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider(weightedGraph);
            case SPHERICAL -> {
                ensureGeodeticCoordinateRanges(weightedGraph.graph());
                yield new SphericalHeuristicProvider(weightedGraph);
            }
        };
    }

    private static void ensureGeodeticCoordinateRanges(PathGraph graph) {
        for (int nodeId = 0; nodeId < graph.nodeCount(); nodeId++) {
            double lat = graph.nodeLat(nodeId);
            double lon = graph.nodeLon(nodeId);
            if (!Double.isFinite(lat) || lat < -90.0d || lat > 90.0d) {
                throw new HeuristicConfigurationException(
                        REASON_SPHERICAL_LAT_RANGE,
                        "node " + graph.nodeId(nodeId) + " latitude must be finite and in [-90,90], got " + lat
                );
            }
            if (!Double.isFinite(lon) || lon < -180.0d || lon > 180.0d) {
                throw new HeuristicConfigurationException(
                        REASON_SPHERICAL_LON_RANGE,
                        "node " + graph.nodeId(nodeId) + " longitude must be finite and in [-180,180], got " + lon
                );
            }
        }
    }
}
