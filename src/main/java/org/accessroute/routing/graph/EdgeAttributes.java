package org.accessroute.routing.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Map;

/**
 * Physical and accessibility attributes of one undirected edge.
 *
 * <p>{@code inclinePercent} is signed relative to the edge's from-to direction. Absent or
 * malformed source values are represented as unknown ({@code null} or the enum's
 * {@code UNKNOWN}/{@code NONE} member) and weigh neutrally.</p>
 */
@Value
@Builder(toBuilder = true)
public class EdgeAttributes {
    /** Incline assumed for bare {@code incline=up/down} tags, in percent. */
    public static final double DEFAULT_DIRECTIONAL_INCLINE = 5.0d;

    private static final EdgeAttributes NEUTRAL = EdgeAttributes.builder().build();

    @Builder.Default
    HighwayClass highway = HighwayClass.OTHER;
    @Builder.Default
    SurfaceClass surface = SurfaceClass.UNKNOWN;
    @Builder.Default
    WheelchairAccess wheelchair = WheelchairAccess.UNKNOWN;
    boolean steps;
    boolean ramp;
    /** Signed incline in percent along from-to, {@code null} when unknown. */
    Double inclinePercent;
    /** Usable width in meters, {@code null} when unknown. */
    Double widthMeters;
    @Builder.Default
    CrossingKind crossing = CrossingKind.NONE;

    /**
     * Returns attributes with every value unknown.
     */
    public static EdgeAttributes neutral() {
        return NEUTRAL;
    }

    /**
     * Returns the incline as seen when traversing the edge in the given direction.
     *
     * @param reverse true when walking to-from.
     * @return signed incline percent or {@code null} when unknown.
     */
    public Double directedInclinePercent(boolean reverse) {
        if (inclinePercent == null) {
            return null;
        }
        return reverse ? -inclinePercent : inclinePercent;
    }

    /**
     * Builds attributes from raw OSM-style tags. Malformed values degrade to unknown.
     *
     * @param tags raw tag map, may be null.
     * @return parsed attributes.
     */
    public static EdgeAttributes fromTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return NEUTRAL;
        }
        String highwayTag = tags.get("highway");
        HighwayClass highway = HighwayClass.fromTag(highwayTag);
        boolean crossingWay = highway == HighwayClass.CROSSING || "crossing".equals(tags.get("footway"));

        return EdgeAttributes.builder()
                .highway(highway)
                .surface(SurfaceClass.fromTag(tags.get("surface")))
                .wheelchair(WheelchairAccess.fromTag(tags.get("wheelchair")))
                .steps(highway == HighwayClass.STEPS || parsePositiveInt(tags.get("step_count")))
                .ramp(isYes(tags.get("ramp"))
                        || isYes(tags.get("ramp:wheelchair"))
                        || (highwayTag != null && highwayTag.toLowerCase(Locale.ROOT).contains("ramp")))
                .inclinePercent(parseIncline(tags.get("incline")))
                .widthMeters(parseWidth(tags.get("width")))
                .crossing(CrossingKind.fromTag(tags.get("crossing"), crossingWay))
                .build();
    }

    /**
     * Parses an OSM incline value: {@code 5%}, {@code -3.5 %}, {@code 10°}, {@code up}, {@code down}.
     *
     * @return signed percent, or {@code null} when missing or malformed.
     */
    static Double parseIncline(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("up")) {
            return DEFAULT_DIRECTIONAL_INCLINE;
        }
        if (value.equals("down")) {
            return -DEFAULT_DIRECTIONAL_INCLINE;
        }
        try {
            if (value.endsWith("°")) {
                double degrees = Double.parseDouble(value.substring(0, value.length() - 1).trim());
                return finiteOrNull(Math.tan(Math.toRadians(degrees)) * 100.0d);
            }
            if (value.endsWith("%")) {
                value = value.substring(0, value.length() - 1).trim();
            }
            return finiteOrNull(Double.parseDouble(value));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Parses an OSM width value in meters: {@code 1.2}, {@code 1.2 m}, {@code 1,2}.
     *
     * @return positive width, or {@code null} when missing or malformed.
     */
    static Double parseWidth(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace(',', '.');
        if (value.endsWith("m")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        try {
            double width = Double.parseDouble(value);
            return Double.isFinite(width) && width > 0.0d ? width : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static boolean isYes(String raw) {
        return raw != null && raw.trim().equalsIgnoreCase("yes");
    }

    private static boolean parsePositiveInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        try {
            return Integer.parseInt(raw.trim()) > 0;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
