package org.accessroute.routing.graph;

import java.util.Locale;

/**
 * WGS-84 position in degrees.
 *
 * @param lat latitude in {@code [-90, 90]}.
 * @param lon longitude in {@code [-180, 180]}.
 */
public record Coordinate(double lat, double lon) {
    private static final double MAX_LAT = 90.0d;
    private static final double MAX_LON = 180.0d;

    /**
     * Returns whether both components are finite and inside WGS-84 bounds.
     */
    public boolean isValid() {
        return isValid(lat, lon);
    }

    /**
     * Returns whether a latitude/longitude pair is finite and inside WGS-84 bounds.
     */
    public static boolean isValid(double lat, double lon) {
        return Double.isFinite(lat)
                && Double.isFinite(lon)
                && lat >= -MAX_LAT && lat <= MAX_LAT
                && lon >= -MAX_LON && lon <= MAX_LON;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.7f, %.7f)", lat, lon);
    }
}
