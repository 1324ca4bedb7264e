package org.accessroute.routing.graph;

import java.util.Locale;

/**
 * Path class of a walkable segment, reduced from the OSM {@code highway} tag.
 */
public enum HighwayClass {
    FOOTWAY,
    PATH,
    PEDESTRIAN,
    STEPS,
    SERVICE,
    RESIDENTIAL,
    CROSSING,
    OTHER;

    /**
     * Maps a raw {@code highway} value; unknown or missing values map to {@link #OTHER}.
     */
    public static HighwayClass fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "footway", "sidewalk", "corridor" -> FOOTWAY;
            case "path", "track", "bridleway", "cycleway" -> PATH;
            case "pedestrian", "living_street" -> PEDESTRIAN;
            case "steps" -> STEPS;
            case "service" -> SERVICE;
            case "residential", "unclassified", "tertiary", "secondary", "primary" -> RESIDENTIAL;
            case "crossing" -> CROSSING;
            default -> OTHER;
        };
    }
}
