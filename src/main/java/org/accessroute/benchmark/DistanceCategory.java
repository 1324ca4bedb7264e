package org.accessroute.benchmark;

/**
 * Geometric origin-destination distance class.
 */
public enum DistanceCategory {
    /** Under 200 m. */
    SHORT,
    /** 200 m up to 500 m. */
    MEDIUM,
    /** 500 m and above. */
    LONG;

    static final double MEDIUM_FROM_METERS = 200.0d;
    static final double LONG_FROM_METERS = 500.0d;

    public static DistanceCategory of(double geometricMeters) {
        if (geometricMeters < MEDIUM_FROM_METERS) {
            return SHORT;
        }
        if (geometricMeters < LONG_FROM_METERS) {
            return MEDIUM;
        }
        return LONG;
    }
}
