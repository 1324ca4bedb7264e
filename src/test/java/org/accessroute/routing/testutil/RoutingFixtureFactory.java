package org.accessroute.routing.testutil;

import org.accessroute.io.graph.PathGraphJsonLoader;
import org.accessroute.routing.graph.CrossingKind;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.HighwayClass;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.graph.PathGraphBuilder;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.Random;

/**
 * Shared test fixture factory for routing tests.
 */
public final class RoutingFixtureFactory {
    public static final String CAMPUS_GRAPH = "/fixtures/campus-graph.json";
    public static final String CAMPUS_POI = "/fixtures/campus-poi.txt";
    public static final String PROFILE_CATALOG = "/fixtures/profiles.json";

    /** Roughly 11 m between neighbouring grid nodes near the equator. */
    public static final double GRID_SPACING_DEGREES = 0.0001d;

    private static final SurfaceClass[] SURFACES = SurfaceClass.values();
    private static final WheelchairAccess[] ACCESS = WheelchairAccess.values();
    private static final CrossingKind[] CROSSINGS = CrossingKind.values();

    private RoutingFixtureFactory() {
    }

    /**
     * Two nodes joined by a 10 m stairway and by a 40 m ramp detour through {@code landing}.
     */
    public static PathGraph stairsVersusRamp() {
        return new PathGraphBuilder()
                .addNode("bottom", 0.0d, 0.0d)
                .addNode("top", 0.0d, 0.00005d)
                .addNode("landing", 0.00005d, 0.000025d)
                .addEdge("bottom", "top", 10.0d, stairs())
                .addEdge("bottom", "landing", 20.0d, ramp())
                .addEdge("landing", "top", 20.0d, ramp())
                .build();
    }

    /**
     * Two disjoint components: {@code a-b-c} and {@code x-y}.
     */
    public static PathGraph disconnected() {
        return new PathGraphBuilder()
                .addNode("a", 0.0d, 0.0d)
                .addNode("b", 0.0d, 0.0001d)
                .addNode("c", 0.0d, 0.0002d)
                .addNode("x", 0.001d, 0.0d)
                .addNode("y", 0.001d, 0.0001d)
                .addEdge("a", "b", footway())
                .addEdge("b", "c", footway())
                .addEdge("x", "y", footway())
                .build();
    }

    /**
     * A straight chain {@code n0 - n1 - ... - n(count-1)} of neutral footways.
     */
    public static PathGraph line(int count) {
        PathGraphBuilder builder = new PathGraphBuilder();
        for (int i = 0; i < count; i++) {
            builder.addNode("n" + i, 0.0d, i * GRID_SPACING_DEGREES);
        }
        for (int i = 1; i < count; i++) {
            builder.addEdge("n" + (i - 1), "n" + i, footway());
        }
        return builder.build();
    }

    /**
     * Grid with node ids {@code r{row}c{col}}. Edge attributes are drawn from the seeded random
     * source so every profile sees a mix of surfaces, inclines, widths and crossings.
     */
    public static PathGraph grid(int rows, int cols, long seed) {
        Random random = new Random(seed);
        PathGraphBuilder builder = new PathGraphBuilder();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                builder.addNode(gridId(r, c), r * GRID_SPACING_DEGREES, c * GRID_SPACING_DEGREES);
            }
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (c + 1 < cols) {
                    builder.addEdge(gridId(r, c), gridId(r, c + 1), randomLength(random), randomAttributes(random));
                }
                if (r + 1 < rows) {
                    builder.addEdge(gridId(r, c), gridId(r + 1, c), randomLength(random), randomAttributes(random));
                }
            }
        }
        return builder.build();
    }

    public static String gridId(int row, int col) {
        return "r" + row + "c" + col;
    }

    public static PathGraph campusGraph() {
        try (InputStream in = open(CAMPUS_GRAPH)) {
            return new PathGraphJsonLoader().load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static InputStream open(String resource) {
        InputStream in = RoutingFixtureFactory.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("missing test resource " + resource);
        }
        return in;
    }

    public static Path resourcePath(String resource) {
        URL url = RoutingFixtureFactory.class.getResource(resource);
        if (url == null) {
            throw new IllegalStateException("missing test resource " + resource);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static EdgeAttributes footway() {
        return EdgeAttributes.builder()
                .highway(HighwayClass.FOOTWAY)
                .surface(SurfaceClass.PAVED)
                .build();
    }

    public static EdgeAttributes stairs() {
        return EdgeAttributes.builder()
                .highway(HighwayClass.STEPS)
                .steps(true)
                .build();
    }

    public static EdgeAttributes ramp() {
        return EdgeAttributes.builder()
                .highway(HighwayClass.FOOTWAY)
                .surface(SurfaceClass.PAVED)
                .ramp(true)
                .build();
    }

    private static double randomLength(Random random) {
        // Grid spacing chord is ~11.1 m; explicit lengths stay above it.
        return 12.0d + random.nextDouble() * 20.0d;
    }

    private static EdgeAttributes randomAttributes(Random random) {
        EdgeAttributes.EdgeAttributesBuilder builder = EdgeAttributes.builder()
                .highway(HighwayClass.FOOTWAY)
                .surface(SURFACES[random.nextInt(SURFACES.length)])
                .wheelchair(ACCESS[random.nextInt(ACCESS.length)])
                .crossing(CROSSINGS[random.nextInt(CROSSINGS.length)]);
        int incline = random.nextInt(4);
        if (incline > 0) {
            builder.inclinePercent((random.nextBoolean() ? 1.0d : -1.0d) * random.nextDouble() * 12.0d);
        }
        if (random.nextInt(5) == 0) {
            builder.widthMeters(0.5d + random.nextDouble() * 2.0d);
        }
        if (random.nextInt(8) == 0) {
            builder.steps(true).ramp(random.nextBoolean());
        }
        return builder.build();
    }
}
