package org.accessroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.accessroute.routing.route.Route;
import org.accessroute.routing.search.SearchAlgorithm;
import org.accessroute.routing.search.SearchOutcome;

/**
 * Client-facing point-to-point route response.
 *
 * <p>{@code route} is {@code null} unless the outcome is {@link SearchOutcome#FOUND}.</p>
 */
@Value
@Builder
public class RouteResponse {
    SearchOutcome outcome;
    String profileName;
    SearchAlgorithm algorithm;
    /** Resolved origin node id, after snapping when a coordinate was given. */
    String sourceNodeId;
    /** Resolved destination node id, after snapping when a coordinate was given. */
    String targetNodeId;
    /** Snap distance for the origin, {@code 0} when addressed by node id. */
    double sourceSnapMeters;
    /** Snap distance for the destination, {@code 0} when addressed by node id. */
    double targetSnapMeters;
    /** Weighted cost in effort-meters, {@code +INF} unless found. */
    double totalCost;
    /** Distinct nodes finalized by the search. */
    int nodesExplored;
    Route route;

    public boolean isReachable() {
        return outcome == SearchOutcome.FOUND;
    }
}
