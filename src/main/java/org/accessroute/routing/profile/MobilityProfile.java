package org.accessroute.routing.profile;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable mobility persona: base walking speed, one factor table per attribute category
 * and an ordered list of hard exclusion rules.
 *
 * <p>All factors are {@code >= 1.0}, so no traversal can cost less than its physical
 * length. Great-circle meters are therefore a lower bound on cost for every profile.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MobilityProfile {
    public static final String REASON_NAME_REQUIRED = "PROFILE_NAME_REQUIRED";
    public static final String REASON_INVALID_SPEED = "PROFILE_INVALID_SPEED";
    public static final String REASON_INVALID_STEPS_FACTOR = "PROFILE_INVALID_STEPS_FACTOR";

    private final String name;
    private final String label;
    private final double baseSpeedMetersPerSecond;
    private final FactorTable<SurfaceClass> surfaceFactors;
    private final FactorTable<SlopeBand> ascentFactors;
    private final FactorTable<SlopeBand> descentFactors;
    private final FactorTable<CrossingKind> crossingFactors;
    private final FactorTable<WidthBand> widthFactors;
    private final FactorTable<WheelchairAccess> accessFactors;
    private final double stepsFactor;
    private final List<ExclusionRule> exclusionRules;

    /**
     * Creates a validated profile. Omitted tables are neutral; the descent table defaults
     * to the ascent table for profiles that model slope effort symmetrically.
     *
     * @throws ProfileConfigurationException when the definition is invalid.
     */
    @Builder
    public MobilityProfile(
            String name,
            String label,
            double baseSpeedMetersPerSecond,
            FactorTable<SurfaceClass> surfaceFactors,
            FactorTable<SlopeBand> ascentFactors,
            FactorTable<SlopeBand> descentFactors,
            FactorTable<CrossingKind> crossingFactors,
            FactorTable<WidthBand> widthFactors,
            FactorTable<WheelchairAccess> accessFactors,
            Double stepsFactor,
            @Singular List<ExclusionRule> exclusionRules
    ) {
        this.name = normalizeName(name);
        this.label = label == null || label.isBlank() ? this.name : label.trim();
        if (!Double.isFinite(baseSpeedMetersPerSecond) || baseSpeedMetersPerSecond <= 0.0d) {
            throw new ProfileConfigurationException(
                    REASON_INVALID_SPEED,
                    "profile '" + this.name + "' base speed must be finite and > 0, got " + baseSpeedMetersPerSecond
            );
        }
        this.baseSpeedMetersPerSecond = baseSpeedMetersPerSecond;
        this.surfaceFactors = orNeutral(surfaceFactors, SurfaceClass.class);
        this.ascentFactors = orNeutral(ascentFactors, SlopeBand.class);
        this.descentFactors = descentFactors == null ? this.ascentFactors : descentFactors;
        this.crossingFactors = orNeutral(crossingFactors, CrossingKind.class);
        this.widthFactors = orNeutral(widthFactors, WidthBand.class);
        this.accessFactors = orNeutral(accessFactors, WheelchairAccess.class);

        double steps = stepsFactor == null ? FactorTable.NEUTRAL : stepsFactor;
        if (!Double.isFinite(steps) || steps < FactorTable.NEUTRAL) {
            throw new ProfileConfigurationException(
                    REASON_INVALID_STEPS_FACTOR,
                    "profile '" + this.name + "' steps factor must be finite and >= 1.0, got " + steps
            );
        }
        this.stepsFactor = steps;
        this.exclusionRules = exclusionRules == null ? List.of() : List.copyOf(exclusionRules);
    }

    /**
     * Returns the first declared exclusion rule matching a traversal, or {@code null}.
     */
    public ExclusionRule matchingExclusion(EdgeAttributes attributes, boolean reverse) {
        for (ExclusionRule rule : exclusionRules) {
            if (rule.matches(attributes, reverse)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Slope factor for a directed incline; positive inclines use the ascent table.
     */
    public double slopeFactor(Double directedInclinePercent) {
        SlopeBand band = SlopeBand.fromIncline(directedInclinePercent);
        if (band == SlopeBand.UNKNOWN) {
            return FactorTable.NEUTRAL;
        }
        return directedInclinePercent > 0.0d ? ascentFactors.factor(band) : descentFactors.factor(band);
    }

    /**
     * Whether ascent and descent effort differ for this profile.
     */
    public boolean isSlopeAsymmetric() {
        return ascentFactors != descentFactors;
    }

    private static <E extends Enum<E>> FactorTable<E> orNeutral(FactorTable<E> table, Class<E> category) {
        return table == null ? FactorTable.neutral(category) : table;
    }

    /**
     * Profile names are registry keys: trimmed and lower-cased.
     */
    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProfileConfigurationException(REASON_NAME_REQUIRED, "profile name must be non-blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "MobilityProfile{" + name + ", speed=" + baseSpeedMetersPerSecond
                + " m/s, exclusions=" + exclusionRules + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MobilityProfile other)) {
            return false;
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }
}
