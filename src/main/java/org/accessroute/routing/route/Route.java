package org.accessroute.routing.route;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.accessroute.routing.graph.Coordinate;

import java.util.List;

/**
 * Walkable route for one profile: ordered node ids, full geometry and travel metrics.
 */
@Value
@Builder
public class Route {
    String profileName;
    @Singular
    List<String> nodeIds;
    /** Full geometry in walking order; points shared by consecutive edges appear once. */
    @Singular
    List<Coordinate> coordinates;
    double distanceMeters;
    double estimatedSeconds;
    long stepCount;
    double weightedCost;

    public double estimatedMinutes() {
        return estimatedSeconds / 60.0d;
    }

    public boolean isTrivial() {
        return nodeIds.size() <= 1;
    }
}
