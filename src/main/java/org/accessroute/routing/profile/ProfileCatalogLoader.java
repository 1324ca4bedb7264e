package org.accessroute.routing.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads mobility profile definitions from JSON.
 *
 * <p>Expected shape:</p>
 * <pre>
 * {"profiles": [{
 *   "name": "wheelchair", "label": "Wheelchair user", "baseSpeed": 1.0,
 *   "surface": {"UNPAVED": 2.0}, "ascent": {"STEEP": 4.0}, "descent": {...},
 *   "crossing": {...}, "width": {...}, "access": {...},
 *   "steps": 3.0, "exclusions": ["STEPS_WITHOUT_RAMP"]
 * }]}
 * </pre>
 * Every definition is validated while loading; the first invalid one aborts the load.
 */
public final class ProfileCatalogLoader {
    public static final String REASON_CATALOG_UNREADABLE = "PROFILE_CATALOG_UNREADABLE";
    public static final String REASON_CATALOG_MALFORMED = "PROFILE_CATALOG_MALFORMED";
    public static final String REASON_UNKNOWN_KEY = "PROFILE_UNKNOWN_KEY";

    private static final Logger logger = LoggerFactory.getLogger(ProfileCatalogLoader.class);

    private final ObjectMapper mapper;

    public ProfileCatalogLoader() {
        this(new ObjectMapper());
    }

    public ProfileCatalogLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<MobilityProfile> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ProfileConfigurationException(REASON_CATALOG_UNREADABLE, "profile catalog not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<MobilityProfile> profiles = load(in);
            logger.info("Loaded {} profile definitions from {}", profiles.size(), path);
            return profiles;
        } catch (IOException e) {
            throw new ProfileConfigurationException(
                    REASON_CATALOG_UNREADABLE, "cannot read profile catalog " + path + ": " + e.getMessage(), e);
        }
    }

    public List<MobilityProfile> load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ProfileConfigurationException(
                    REASON_CATALOG_MALFORMED, "profile catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("profiles").isArray()) {
            throw new ProfileConfigurationException(REASON_CATALOG_MALFORMED, "profile catalog must contain a 'profiles' array");
        }
        List<MobilityProfile> profiles = new ArrayList<>();
        for (JsonNode node : root.get("profiles")) {
            profiles.add(parseProfile(node));
        }
        return profiles;
    }

    private MobilityProfile parseProfile(JsonNode node) {
        if (!node.isObject()) {
            throw new ProfileConfigurationException(REASON_CATALOG_MALFORMED, "profile entry must be an object");
        }
        String name = node.path("name").asText(null);
        JsonNode speed = node.get("baseSpeed");
        if (speed == null || !speed.isNumber()) {
            throw new ProfileConfigurationException(
                    MobilityProfile.REASON_INVALID_SPEED, "profile '" + name + "' requires numeric 'baseSpeed'");
        }

        MobilityProfile.MobilityProfileBuilder builder = MobilityProfile.builder()
                .name(name)
                .label(node.path("label").asText(null))
                .baseSpeedMetersPerSecond(speed.asDouble())
                .surfaceFactors(table(node.get("surface"), SurfaceClass.class))
                .ascentFactors(table(node.get("ascent"), SlopeBand.class))
                .descentFactors(table(node.get("descent"), SlopeBand.class))
                .crossingFactors(table(node.get("crossing"), CrossingKind.class))
                .widthFactors(table(node.get("width"), WidthBand.class))
                .accessFactors(table(node.get("access"), WheelchairAccess.class));

        JsonNode steps = node.get("steps");
        if (steps != null && !steps.isNull()) {
            builder.stepsFactor(numeric(steps, "steps"));
        }
        JsonNode exclusions = node.get("exclusions");
        if (exclusions != null && exclusions.isArray()) {
            for (JsonNode rule : exclusions) {
                builder.exclusionRule(constant(ExclusionRule.class, rule.asText()));
            }
        }
        return builder.build();
    }

    private static <E extends Enum<E>> FactorTable<E> table(JsonNode node, Class<E> category) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ProfileConfigurationException(
                    REASON_CATALOG_MALFORMED, category.getSimpleName() + " factors must be an object");
        }
        Map<E, Double> entries = new EnumMap<>(category);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(constant(category, field.getKey()), numeric(field.getValue(), field.getKey()));
        }
        return FactorTable.of(category, entries);
    }

    private static double numeric(JsonNode value, String field) {
        if (!value.isNumber()) {
            throw new ProfileConfigurationException(
                    FactorTable.REASON_FACTOR_NON_FINITE, "factor '" + field + "' must be numeric, got " + value);
        }
        return value.asDouble();
    }

    private static <E extends Enum<E>> E constant(Class<E> category, String raw) {
        try {
            return Enum.valueOf(category, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProfileConfigurationException(
                    REASON_UNKNOWN_KEY, "unknown " + category.getSimpleName() + " value '" + raw + "'", e);
        }
    }
}
