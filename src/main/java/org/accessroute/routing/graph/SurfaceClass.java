package org.accessroute.routing.graph;

import java.util.Locale;

/**
 * Surface category relevant to wheeled and reduced mobility.
 */
public enum SurfaceClass {
    PAVED,
    COMPACTED,
    UNPAVED,
    UNKNOWN;

    /**
     * Maps a raw OSM {@code surface} value; unrecognized values map to {@link #UNKNOWN}.
     */
    public static SurfaceClass fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "paved", "asphalt", "concrete", "concrete:plates", "paving_stones", "sett", "metal", "wood" -> PAVED;
            case "compacted", "fine_gravel", "cobblestone", "unhewn_cobblestone", "pebblestone" -> COMPACTED;
            case "unpaved", "gravel", "dirt", "earth", "ground", "grass", "sand", "mud" -> UNPAVED;
            default -> UNKNOWN;
        };
    }
}
