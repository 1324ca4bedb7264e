package org.accessroute.routing.graph;

import java.util.Locale;

/**
 * Pedestrian crossing classification of an edge.
 *
 * <p>{@link #NONE} means the edge is not a crossing at all; {@link #UNKNOWN} means it is a
 * crossing whose control type is not tagged.</p>
 */
public enum CrossingKind {
    NONE,
    MARKED,
    SIGNALIZED,
    UNMARKED,
    UNKNOWN;

    /**
     * Maps a raw OSM {@code crossing} value.
     *
     * @param raw tag value, may be null.
     * @param isCrossingWay whether the edge itself is tagged as a crossing way.
     */
    public static CrossingKind fromTag(String raw, boolean isCrossingWay) {
        if (raw == null || raw.isBlank()) {
            return isCrossingWay ? UNKNOWN : NONE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "marked", "zebra", "uncontrolled", "yes" -> MARKED;
            case "traffic_signals", "controlled" -> SIGNALIZED;
            case "unmarked", "informal" -> UNMARKED;
            case "no" -> NONE;
            default -> UNKNOWN;
        };
    }
}
