package org.accessroute.routing.profile;

/**
 * Incline band by absolute grade. Direction (ascent vs. descent) is handled by the
 * profile's separate ascent and descent tables.
 */
public enum SlopeBand {
    /** Below 2 %. */
    FLAT,
    /** 2 % up to 5 %. */
    GENTLE,
    /** 5 % up to 8 %. */
    MODERATE,
    /** 8 % and above. */
    STEEP,
    UNKNOWN;

    static final double GENTLE_FROM_PERCENT = 2.0d;
    static final double MODERATE_FROM_PERCENT = 5.0d;
    static final double STEEP_FROM_PERCENT = 8.0d;

    /**
     * @param inclinePercent signed incline, {@code null} when unknown.
     */
    public static SlopeBand fromIncline(Double inclinePercent) {
        if (inclinePercent == null || !Double.isFinite(inclinePercent)) {
            return UNKNOWN;
        }
        double grade = Math.abs(inclinePercent);
        if (grade >= STEEP_FROM_PERCENT) {
            return STEEP;
        }
        if (grade >= MODERATE_FROM_PERCENT) {
            return MODERATE;
        }
        if (grade >= GENTLE_FROM_PERCENT) {
            return GENTLE;
        }
        return FLAT;
    }
}
