package org.accessroute.routing.profile;

import org.accessroute.routing.graph.SurfaceClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Factor Table Tests")
class FactorTableTest {

    @Test
    @DisplayName("Unset values are neutral and null lookups are neutral")
    void testDefaults() {
        FactorTable<SurfaceClass> table = FactorTable.builder(SurfaceClass.class)
                .set(SurfaceClass.UNPAVED, 2.0d)
                .build();

        assertEquals(2.0d, table.factor(SurfaceClass.UNPAVED), 0.0d);
        assertEquals(FactorTable.NEUTRAL, table.factor(SurfaceClass.PAVED), 0.0d);
        assertEquals(FactorTable.NEUTRAL, table.factor(null), 0.0d);
        assertEquals(Map.of(SurfaceClass.UNPAVED, 2.0d), table.nonNeutralEntries());
    }

    @Test
    @DisplayName("Factors below 1.0 are rejected")
    void testBelowNeutral() {
        ProfileConfigurationException ex = assertThrows(
                ProfileConfigurationException.class,
                () -> FactorTable.builder(SurfaceClass.class).set(SurfaceClass.PAVED, 0.5d).build());
        assertEquals(FactorTable.REASON_FACTOR_BELOW_NEUTRAL, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + FactorTable.REASON_FACTOR_BELOW_NEUTRAL + "]"));
    }

    @Test
    @DisplayName("Non-finite factors are rejected")
    void testNonFinite() {
        Map<SurfaceClass, Double> entries = new EnumMap<>(SurfaceClass.class);
        entries.put(SurfaceClass.COMPACTED, Double.POSITIVE_INFINITY);
        ProfileConfigurationException ex = assertThrows(
                ProfileConfigurationException.class,
                () -> FactorTable.of(SurfaceClass.class, entries));
        assertEquals(FactorTable.REASON_FACTOR_NON_FINITE, ex.reasonCode());

        entries.put(SurfaceClass.COMPACTED, Double.NaN);
        assertThrows(ProfileConfigurationException.class, () -> FactorTable.of(SurfaceClass.class, entries));
    }

    @Test
    @DisplayName("UNKNOWN values must stay neutral")
    void testUnknownNeutral() {
        ProfileConfigurationException ex = assertThrows(
                ProfileConfigurationException.class,
                () -> FactorTable.builder(SlopeBand.class).set(SlopeBand.UNKNOWN, 1.5d).build());
        assertEquals(FactorTable.REASON_UNKNOWN_NOT_NEUTRAL, ex.reasonCode());
    }

    @Test
    @DisplayName("Slope and width bands classify by absolute value")
    void testBands() {
        assertEquals(SlopeBand.FLAT, SlopeBand.fromIncline(1.9d));
        assertEquals(SlopeBand.GENTLE, SlopeBand.fromIncline(-2.0d));
        assertEquals(SlopeBand.MODERATE, SlopeBand.fromIncline(5.0d));
        assertEquals(SlopeBand.STEEP, SlopeBand.fromIncline(-8.0d));
        assertEquals(SlopeBand.UNKNOWN, SlopeBand.fromIncline(null));

        assertEquals(WidthBand.NARROW, WidthBand.fromWidth(0.8d));
        assertEquals(WidthBand.RESTRICTED, WidthBand.fromWidth(0.9d));
        assertEquals(WidthBand.STANDARD, WidthBand.fromWidth(1.5d));
        assertEquals(WidthBand.UNKNOWN, WidthBand.fromWidth(null));
        assertEquals(WidthBand.UNKNOWN, WidthBand.fromWidth(0.0d));
    }
}
