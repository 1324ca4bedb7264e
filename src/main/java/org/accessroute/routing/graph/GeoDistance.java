package org.accessroute.routing.graph;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Great-circle distance helpers shared by graph loading, heuristics and benchmarking.
 *
 * <p>Edge lengths and heuristic estimates both go through {@link #greatCircleMeters}, so a
 * straight great-circle estimate can never exceed the polyline length of a real edge.</p>
 */
@UtilityClass
public final class GeoDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes great-circle distance in meters using the haversine formulation.
     */
    public static double greatCircleMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a)));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Great-circle distance between two coordinates.
     */
    public static double greatCircleMeters(Coordinate from, Coordinate to) {
        return greatCircleMeters(from.lat(), from.lon(), to.lat(), to.lon());
    }

    /**
     * Sums great-circle segment lengths along an ordered polyline.
     *
     * @return total length in meters, {@code 0} for fewer than two points.
     */
    public static double polylineMeters(List<Coordinate> points) {
        double total = 0.0d;
        for (int i = 1; i < points.size(); i++) {
            total += greatCircleMeters(points.get(i - 1), points.get(i));
        }
        return total;
    }

    /**
     * Normalizes delta-longitude into {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value) {
        if (value < 0.0d) {
            return 0.0d;
        }
        return Math.min(value, 1.0d);
    }
}
