package org.accessroute.routing.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Immutable nearest-node match result.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class NodeMatch {
    private final int nodeIndex;
    private final String nodeId;
    private final double nodeLat;
    private final double nodeLon;
    private final double distanceMeters;

    @Override
    public String toString() {
        return "NodeMatch{" + nodeId + " @ " + String.format(Locale.ROOT, "%.1f", distanceMeters) + " m}";
    }
}
