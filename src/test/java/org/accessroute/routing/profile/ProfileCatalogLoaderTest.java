package org.accessroute.routing.profile;

import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.testutil.RoutingFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Profile Catalog Loader Tests")
class ProfileCatalogLoaderTest {
    private final ProfileCatalogLoader loader = new ProfileCatalogLoader();

    @Test
    @DisplayName("Fixture catalog loads and overrides built-ins in a registry")
    void testLoadFixture() {
        List<MobilityProfile> profiles = loader.load(RoutingFixtureFactory.resourcePath(RoutingFixtureFactory.PROFILE_CATALOG));

        assertEquals(2, profiles.size());
        MobilityProfile powerChair = profiles.get(0);
        assertEquals("power_chair", powerChair.name());
        assertEquals("Powered wheelchair", powerChair.label());
        assertEquals(1.6d, powerChair.baseSpeedMetersPerSecond(), 0.0d);
        assertEquals(1.6d, powerChair.surfaceFactors().factor(SurfaceClass.UNPAVED), 0.0d);
        assertEquals(1.2d, powerChair.slopeFactor(-6.0d), 0.0d);
        assertEquals(1.4d, powerChair.slopeFactor(6.0d), 0.0d);
        assertEquals(
                List.of(ExclusionRule.STEPS_WITHOUT_RAMP, ExclusionRule.WHEELCHAIR_NO, ExclusionRule.NARROW_PASSAGE),
                powerChair.exclusionRules());

        ProfileRegistry registry = new ProfileRegistry(profiles);
        assertEquals(7, registry.size());
        assertEquals("Campus visitor", registry.profile("standard").label());
    }

    @Test
    @DisplayName("Missing file fails with an unreadable-catalog reason")
    void testMissingFile(@TempDir Path dir) {
        ProfileConfigurationException ex = assertThrows(ProfileConfigurationException.class,
                () -> loader.load(dir.resolve("absent.json")));
        assertEquals(ProfileCatalogLoader.REASON_CATALOG_UNREADABLE, ex.reasonCode());
    }

    @Test
    @DisplayName("Malformed documents are rejected")
    void testMalformed() {
        assertReason(ProfileCatalogLoader.REASON_CATALOG_MALFORMED, "{not json");
        assertReason(ProfileCatalogLoader.REASON_CATALOG_MALFORMED, "{\"profiles\": {}}");
        assertReason(ProfileCatalogLoader.REASON_CATALOG_MALFORMED, "{\"profiles\": [42]}");
    }

    @Test
    @DisplayName("Unknown category keys and exclusion names are rejected")
    void testUnknownKeys() {
        assertReason(ProfileCatalogLoader.REASON_UNKNOWN_KEY,
                "{\"profiles\": [{\"name\": \"x\", \"baseSpeed\": 1.0, \"surface\": {\"lava\": 2.0}}]}");
        assertReason(ProfileCatalogLoader.REASON_UNKNOWN_KEY,
                "{\"profiles\": [{\"name\": \"x\", \"baseSpeed\": 1.0, \"exclusions\": [\"no_fun\"]}]}");
    }

    @Test
    @DisplayName("Profile-level validation applies to catalog entries")
    void testProfileValidation() {
        assertReason(MobilityProfile.REASON_INVALID_SPEED,
                "{\"profiles\": [{\"name\": \"x\"}]}");
        assertReason(MobilityProfile.REASON_NAME_REQUIRED,
                "{\"profiles\": [{\"baseSpeed\": 1.0}]}");
        assertReason(FactorTable.REASON_FACTOR_BELOW_NEUTRAL,
                "{\"profiles\": [{\"name\": \"x\", \"baseSpeed\": 1.0, \"width\": {\"narrow\": 0.2}}]}");
        assertReason(FactorTable.REASON_FACTOR_NON_FINITE,
                "{\"profiles\": [{\"name\": \"x\", \"baseSpeed\": 1.0, \"steps\": \"many\"}]}");
    }

    private void assertReason(String reason, String json) {
        ProfileConfigurationException ex = assertThrows(ProfileConfigurationException.class, () -> load(json));
        assertEquals(reason, ex.reasonCode(), ex.getMessage());
    }

    private List<MobilityProfile> load(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return loader.load(in);
        }
    }
}
