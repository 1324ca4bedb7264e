package org.accessroute.routing.profile;

import lombok.experimental.UtilityClass;
import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;

import java.util.List;

/**
 * Built-in mobility profiles shipped with the engine.
 */
@UtilityClass
public class BuiltInProfiles {
    public static final String STANDARD = "standard";
    public static final String WHEELCHAIR = "wheelchair";
    public static final String ELDERLY = "elderly";
    public static final String PREGNANT = "pregnant";
    public static final String STROLLER = "stroller";
    public static final String TEMPORARY_IMPAIRMENT = "temporary_impairment";

    /**
     * @return built-in profiles in catalog order, {@code standard} first.
     */
    public static List<MobilityProfile> all() {
        return List.of(standard(), wheelchair(), elderly(), pregnant(), stroller(), temporaryImpairment());
    }

    public static MobilityProfile standard() {
        return MobilityProfile.builder()
                .name(STANDARD)
                .label("Unrestricted adult")
                .baseSpeedMetersPerSecond(1.4d)
                .build();
    }

    public static MobilityProfile wheelchair() {
        return MobilityProfile.builder()
                .name(WHEELCHAIR)
                .label("Wheelchair user")
                .baseSpeedMetersPerSecond(1.0d)
                .surfaceFactors(FactorTable.builder(SurfaceClass.class)
                        .set(SurfaceClass.COMPACTED, 1.5d)
                        .set(SurfaceClass.UNPAVED, 2.0d)
                        .build())
                .ascentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.GENTLE, 1.3d)
                        .set(SlopeBand.MODERATE, 2.0d)
                        .set(SlopeBand.STEEP, 4.0d)
                        .build())
                .descentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.GENTLE, 1.1d)
                        .set(SlopeBand.MODERATE, 1.5d)
                        .build())
                .crossingFactors(FactorTable.builder(CrossingKind.class)
                        .set(CrossingKind.UNMARKED, 2.0d)
                        .build())
                .widthFactors(FactorTable.builder(WidthBand.class)
                        .set(WidthBand.RESTRICTED, 1.5d)
                        .build())
                .accessFactors(FactorTable.builder(WheelchairAccess.class)
                        .set(WheelchairAccess.LIMITED, 1.5d)
                        .build())
                .exclusionRule(ExclusionRule.STEPS_WITHOUT_RAMP)
                .exclusionRule(ExclusionRule.WHEELCHAIR_NO)
                .exclusionRule(ExclusionRule.NARROW_PASSAGE)
                .exclusionRule(ExclusionRule.STEEP_INCLINE)
                .build();
    }

    public static MobilityProfile elderly() {
        return MobilityProfile.builder()
                .name(ELDERLY)
                .label("Elderly pedestrian")
                .baseSpeedMetersPerSecond(1.1d)
                .surfaceFactors(FactorTable.builder(SurfaceClass.class)
                        .set(SurfaceClass.COMPACTED, 1.2d)
                        .set(SurfaceClass.UNPAVED, 1.5d)
                        .build())
                .ascentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.GENTLE, 1.2d)
                        .set(SlopeBand.MODERATE, 1.5d)
                        .set(SlopeBand.STEEP, 2.5d)
                        .build())
                .descentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.MODERATE, 1.3d)
                        .set(SlopeBand.STEEP, 2.0d)
                        .build())
                .crossingFactors(FactorTable.builder(CrossingKind.class)
                        .set(CrossingKind.UNMARKED, 2.0d)
                        .build())
                .stepsFactor(3.0d)
                .build();
    }

    public static MobilityProfile pregnant() {
        return MobilityProfile.builder()
                .name(PREGNANT)
                .label("Pregnant pedestrian")
                .baseSpeedMetersPerSecond(1.2d)
                .surfaceFactors(FactorTable.builder(SurfaceClass.class)
                        .set(SurfaceClass.UNPAVED, 1.4d)
                        .build())
                .ascentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.GENTLE, 1.2d)
                        .set(SlopeBand.MODERATE, 1.6d)
                        .set(SlopeBand.STEEP, 2.5d)
                        .build())
                .descentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.STEEP, 1.5d)
                        .build())
                .crossingFactors(FactorTable.builder(CrossingKind.class)
                        .set(CrossingKind.UNMARKED, 1.8d)
                        .build())
                .stepsFactor(2.5d)
                .build();
    }

    public static MobilityProfile stroller() {
        return MobilityProfile.builder()
                .name(STROLLER)
                .label("Caregiver with stroller")
                .baseSpeedMetersPerSecond(1.2d)
                .surfaceFactors(FactorTable.builder(SurfaceClass.class)
                        .set(SurfaceClass.COMPACTED, 1.4d)
                        .set(SurfaceClass.UNPAVED, 2.5d)
                        .build())
                .ascentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.MODERATE, 1.5d)
                        .set(SlopeBand.STEEP, 2.5d)
                        .build())
                .descentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.MODERATE, 1.3d)
                        .set(SlopeBand.STEEP, 2.0d)
                        .build())
                .crossingFactors(FactorTable.builder(CrossingKind.class)
                        .set(CrossingKind.UNMARKED, 1.5d)
                        .build())
                .widthFactors(FactorTable.builder(WidthBand.class)
                        .set(WidthBand.RESTRICTED, 1.3d)
                        .build())
                .accessFactors(FactorTable.builder(WheelchairAccess.class)
                        .set(WheelchairAccess.LIMITED, 1.3d)
                        .build())
                .exclusionRule(ExclusionRule.STEPS_WITHOUT_RAMP)
                .exclusionRule(ExclusionRule.NARROW_PASSAGE)
                .build();
    }

    public static MobilityProfile temporaryImpairment() {
        return MobilityProfile.builder()
                .name(TEMPORARY_IMPAIRMENT)
                .label("Temporary impairment (crutches, cast)")
                .baseSpeedMetersPerSecond(0.9d)
                .surfaceFactors(FactorTable.builder(SurfaceClass.class)
                        .set(SurfaceClass.UNPAVED, 1.8d)
                        .build())
                .ascentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.GENTLE, 1.3d)
                        .set(SlopeBand.MODERATE, 1.8d)
                        .set(SlopeBand.STEEP, 3.0d)
                        .build())
                .descentFactors(FactorTable.builder(SlopeBand.class)
                        .set(SlopeBand.MODERATE, 1.5d)
                        .set(SlopeBand.STEEP, 2.5d)
                        .build())
                .crossingFactors(FactorTable.builder(CrossingKind.class)
                        .set(CrossingKind.UNMARKED, 1.5d)
                        .build())
                .stepsFactor(50.0d)
                .build();
    }
}
