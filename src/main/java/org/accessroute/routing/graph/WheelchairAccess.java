package org.accessroute.routing.graph;

import java.util.Locale;

/**
 * Value of the OSM {@code wheelchair} tag.
 */
public enum WheelchairAccess {
    YES,
    LIMITED,
    NO,
    UNKNOWN;

    public static WheelchairAccess fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "designated" -> YES;
            case "limited" -> LIMITED;
            case "no" -> NO;
            default -> UNKNOWN;
        };
    }
}
