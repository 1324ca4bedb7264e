package org.accessroute.routing.profile;

/**
 * Clearance band of a walkable segment.
 */
public enum WidthBand {
    /** Below 0.9 m: too narrow for a standard wheelchair. */
    NARROW,
    /** 0.9 m up to 1.5 m. */
    RESTRICTED,
    /** 1.5 m and above. */
    STANDARD,
    UNKNOWN;

    static final double RESTRICTED_FROM_METERS = 0.9d;
    static final double STANDARD_FROM_METERS = 1.5d;

    /**
     * @param widthMeters width, {@code null} when unknown.
     */
    public static WidthBand fromWidth(Double widthMeters) {
        if (widthMeters == null || !Double.isFinite(widthMeters) || widthMeters <= 0.0d) {
            return UNKNOWN;
        }
        if (widthMeters >= STANDARD_FROM_METERS) {
            return STANDARD;
        }
        if (widthMeters >= RESTRICTED_FROM_METERS) {
            return RESTRICTED;
        }
        return NARROW;
    }
}
