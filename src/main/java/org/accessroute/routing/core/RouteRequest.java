package org.accessroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.search.SearchAlgorithm;

/**
 * Client-facing point-to-point route request.
 *
 * <p>Each endpoint is given either as an external node id or as a coordinate that is
 * snapped to the nearest node usable by the profile. Mapping into internal node indices is
 * handled by {@link RouteCore}.</p>
 */
@Value
@Builder
public class RouteRequest {
    /** External identifier of the origin node. */
    String sourceNodeId;
    /** External identifier of the destination node. */
    String targetNodeId;
    /** Origin coordinate, used when no origin node id is given. */
    Coordinate sourceCoordinate;
    /** Destination coordinate, used when no destination node id is given. */
    Coordinate targetCoordinate;
    /** Mobility profile name; {@code standard} when absent. */
    String profileName;
    /** Search algorithm to execute. */
    SearchAlgorithm algorithm;
    /** Max coordinate snap distance in meters; the facade default when absent. */
    Double maxSnapDistanceMeters;
}
