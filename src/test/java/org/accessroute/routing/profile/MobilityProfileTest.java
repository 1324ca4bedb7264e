package org.accessroute.routing.profile;

import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Mobility Profile Tests")
class MobilityProfileTest {

    @Test
    @DisplayName("Names are normalized and labels default to the name")
    void testNameNormalization() {
        MobilityProfile profile = MobilityProfile.builder()
                .name("  Crutches ")
                .baseSpeedMetersPerSecond(0.8d)
                .build();

        assertEquals("crutches", profile.name());
        assertEquals("crutches", profile.label());
        assertEquals(profile, MobilityProfile.builder().name("CRUTCHES").baseSpeedMetersPerSecond(1.0d).build());
    }

    @Test
    @DisplayName("Invalid definitions are rejected with reason codes")
    void testValidation() {
        ProfileConfigurationException noName = assertThrows(ProfileConfigurationException.class,
                () -> MobilityProfile.builder().name(" ").baseSpeedMetersPerSecond(1.0d).build());
        assertEquals(MobilityProfile.REASON_NAME_REQUIRED, noName.reasonCode());

        ProfileConfigurationException badSpeed = assertThrows(ProfileConfigurationException.class,
                () -> MobilityProfile.builder().name("x").baseSpeedMetersPerSecond(0.0d).build());
        assertEquals(MobilityProfile.REASON_INVALID_SPEED, badSpeed.reasonCode());

        ProfileConfigurationException badSteps = assertThrows(ProfileConfigurationException.class,
                () -> MobilityProfile.builder().name("x").baseSpeedMetersPerSecond(1.0d).stepsFactor(0.5d).build());
        assertEquals(MobilityProfile.REASON_INVALID_STEPS_FACTOR, badSteps.reasonCode());
    }

    @Test
    @DisplayName("Slope factor picks the ascent or descent table by sign")
    void testDirectionalSlope() {
        MobilityProfile wheelchair = BuiltInProfiles.wheelchair();

        assertEquals(2.0d, wheelchair.slopeFactor(6.0d), 0.0d);
        assertEquals(1.5d, wheelchair.slopeFactor(-6.0d), 0.0d);
        assertEquals(1.0d, wheelchair.slopeFactor(null), 0.0d);
        assertEquals(1.0d, wheelchair.slopeFactor(0.5d), 0.0d);
        assertTrue(wheelchair.isSlopeAsymmetric());
    }

    @Test
    @DisplayName("Missing descent table mirrors the ascent table")
    void testSymmetricSlope() {
        MobilityProfile profile = MobilityProfile.builder()
                .name("sym")
                .baseSpeedMetersPerSecond(1.0d)
                .ascentFactors(FactorTable.builder(SlopeBand.class).set(SlopeBand.STEEP, 3.0d).build())
                .build();

        assertFalse(profile.isSlopeAsymmetric());
        assertEquals(3.0d, profile.slopeFactor(9.0d), 0.0d);
        assertEquals(3.0d, profile.slopeFactor(-9.0d), 0.0d);
    }

    @Test
    @DisplayName("First matching exclusion rule is reported")
    void testMatchingExclusion() {
        MobilityProfile wheelchair = BuiltInProfiles.wheelchair();
        EdgeAttributes stairs = EdgeAttributes.builder().steps(true).build();
        EdgeAttributes stairsWithRamp = EdgeAttributes.builder().steps(true).ramp(true).build();
        EdgeAttributes blocked = EdgeAttributes.builder().wheelchair(WheelchairAccess.NO).build();
        EdgeAttributes steep = EdgeAttributes.builder().inclinePercent(-9.0d).build();

        assertEquals(ExclusionRule.STEPS_WITHOUT_RAMP, wheelchair.matchingExclusion(stairs, false));
        assertNull(wheelchair.matchingExclusion(stairsWithRamp, false));
        assertEquals(ExclusionRule.WHEELCHAIR_NO, wheelchair.matchingExclusion(blocked, true));
        assertEquals(ExclusionRule.STEEP_INCLINE, wheelchair.matchingExclusion(steep, false));
        assertEquals(ExclusionRule.STEEP_INCLINE, wheelchair.matchingExclusion(steep, true));
        assertNull(BuiltInProfiles.standard().matchingExclusion(stairs, false));
    }

    @Test
    @DisplayName("Unknown attribute values never trigger an exclusion")
    void testUnknownNeverExcludes() {
        EdgeAttributes unknown = EdgeAttributes.neutral();
        for (MobilityProfile profile : BuiltInProfiles.all()) {
            assertNull(profile.matchingExclusion(unknown, false), profile.name());
            assertNull(profile.matchingExclusion(unknown, true), profile.name());
        }
        assertFalse(ExclusionRule.UNPAVED_SURFACE.matches(
                EdgeAttributes.builder().surface(SurfaceClass.UNKNOWN).build(), false));
    }

    @Test
    @DisplayName("Built-ins: six distinct profiles whose UNKNOWN buckets stay neutral")
    void testBuiltIns() {
        assertEquals(6, BuiltInProfiles.all().size());
        assertEquals(BuiltInProfiles.STANDARD, BuiltInProfiles.all().get(0).name());
        for (MobilityProfile profile : BuiltInProfiles.all()) {
            assertEquals(FactorTable.NEUTRAL, profile.surfaceFactors().factor(SurfaceClass.UNKNOWN), 0.0d);
            assertEquals(FactorTable.NEUTRAL, profile.ascentFactors().factor(SlopeBand.UNKNOWN), 0.0d);
            assertEquals(FactorTable.NEUTRAL, profile.descentFactors().factor(SlopeBand.UNKNOWN), 0.0d);
            assertEquals(FactorTable.NEUTRAL, profile.crossingFactors().factor(CrossingKind.UNKNOWN), 0.0d);
            assertEquals(FactorTable.NEUTRAL, profile.widthFactors().factor(WidthBand.UNKNOWN), 0.0d);
            assertEquals(FactorTable.NEUTRAL, profile.accessFactors().factor(WheelchairAccess.UNKNOWN), 0.0d);
            assertTrue(profile.stepsFactor() >= FactorTable.NEUTRAL, profile.name());
            assertTrue(profile.baseSpeedMetersPerSecond() > 0.0d, profile.name());
        }
        assertEquals(50.0d, BuiltInProfiles.temporaryImpairment().stepsFactor(), 0.0d);
        assertTrue(BuiltInProfiles.stroller().exclusionRules().contains(ExclusionRule.STEPS_WITHOUT_RAMP));
    }
}
