package org.accessroute.app;

import org.accessroute.benchmark.BenchmarkConfig;
import org.accessroute.benchmark.BenchmarkCsvWriter;
import org.accessroute.benchmark.BenchmarkHarness;
import org.accessroute.benchmark.BenchmarkJsonWriter;
import org.accessroute.benchmark.BenchmarkReport;
import org.accessroute.benchmark.BenchmarkRun;
import org.accessroute.benchmark.BenchmarkSite;
import org.accessroute.io.gpx.GpxExporter;
import org.accessroute.io.graph.PathGraphJsonLoader;
import org.accessroute.io.poi.PoiCatalog;
import org.accessroute.io.poi.PoiCatalogParser;
import org.accessroute.io.poi.PointOfInterest;
import org.accessroute.routing.core.RouteCore;
import org.accessroute.routing.core.RouteCoreException;
import org.accessroute.routing.core.RouteRequest;
import org.accessroute.routing.core.RouteResponse;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.MobilityProfile;
import org.accessroute.routing.profile.ProfileCatalogLoader;
import org.accessroute.routing.profile.ProfileRegistry;
import org.accessroute.routing.route.Route;
import org.accessroute.routing.search.SearchAlgorithm;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point.
 *
 * <pre>
 * route     --graph campus.json --from-node A --to-poi "Library" --profile wheelchair --gpx out.gpx
 * benchmark --graph campus.json --poi poi.txt --pairs 50 --csv results.csv --json results.json
 * profiles  [--profiles profiles.json]
 * </pre>
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_NO_ROUTE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 3;

    private static final int MIN_SAMPLING_ATTEMPTS = 1_000;
    private static final int SAMPLING_ATTEMPTS_PER_PAIR = 20;

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String GRAPH_OPT = "graph";
    private static final String POI_OPT = "poi";
    private static final String PROFILES_OPT = "profiles";
    private static final String PROFILE_OPT = "profile";
    private static final String ALGORITHM_OPT = "algorithm";
    private static final String FROM_NODE_OPT = "from-node";
    private static final String TO_NODE_OPT = "to-node";
    private static final String FROM_COORD_OPT = "from";
    private static final String TO_COORD_OPT = "to";
    private static final String FROM_POI_OPT = "from-poi";
    private static final String TO_POI_OPT = "to-poi";
    private static final String SNAP_OPT = "snap";
    private static final String GPX_OPT = "gpx";
    private static final String PAIRS_OPT = "pairs";
    private static final String REPETITIONS_OPT = "repetitions";
    private static final String WARMUP_OPT = "warmup";
    private static final String SEED_OPT = "seed";
    private static final String CSV_OPT = "csv";
    private static final String JSON_OPT = "json";
    private static final String REPORT_OPT = "report";
    private static final String HELP_OPT = "help";

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(err);
            return EXIT_USAGE;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, rest, false);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (cmd.hasOption(HELP_OPT)) {
            printUsage(out);
            return EXIT_OK;
        }
        if (!cmd.getArgList().isEmpty()) {
            err.println("Unexpected argument(s): " + cmd.getArgList());
            return EXIT_USAGE;
        }

        try {
            switch (command) {
                case "route":
                    return route(cmd, out, err);
                case "benchmark":
                    return benchmark(cmd, out, err);
                case "profiles":
                    return listProfiles(cmd, out);
                default:
                    err.println("Unknown command: " + args[0]);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (RouteCoreException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException | RuntimeException e) {
            logger.error("Command {} failed", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int route(CommandLine cmd, PrintStream out, PrintStream err) throws IOException {
        RouteCore core = routeCore(cmd);
        PoiCatalog catalog = poiCatalog(cmd);

        RouteRequest.RouteRequestBuilder request = RouteRequest.builder()
                .profileName(cmd.getOptionValue(PROFILE_OPT))
                .algorithm(parseAlgorithm(cmd.getOptionValue(ALGORITHM_OPT, SearchAlgorithm.A_STAR.name())));
        if (cmd.hasOption(SNAP_OPT)) {
            request.maxSnapDistanceMeters(parseDouble(SNAP_OPT, cmd.getOptionValue(SNAP_OPT)));
        }
        request.sourceNodeId(cmd.getOptionValue(FROM_NODE_OPT));
        request.targetNodeId(cmd.getOptionValue(TO_NODE_OPT));
        request.sourceCoordinate(endpointCoordinate(cmd, FROM_COORD_OPT, FROM_POI_OPT, catalog));
        request.targetCoordinate(endpointCoordinate(cmd, TO_COORD_OPT, TO_POI_OPT, catalog));

        RouteResponse response = core.route(request.build());
        out.printf(Locale.ROOT, "profile=%s algorithm=%s outcome=%s explored=%d%n",
                response.getProfileName(), response.getAlgorithm(), response.getOutcome(), response.getNodesExplored());
        if (!response.isReachable()) {
            err.println("No route between " + response.getSourceNodeId() + " and " + response.getTargetNodeId());
            return EXIT_NO_ROUTE;
        }

        Route route = response.getRoute();
        out.printf(Locale.ROOT, "nodes: %s%n", String.join(" -> ", route.getNodeIds()));
        out.printf(Locale.ROOT, "distance: %.1f m%n", route.getDistanceMeters());
        out.printf(Locale.ROOT, "time: %.1f min%n", route.estimatedMinutes());
        out.printf(Locale.ROOT, "steps: %d%n", route.getStepCount());
        out.printf(Locale.ROOT, "cost: %.1f%n", route.getWeightedCost());
        if (cmd.hasOption(GPX_OPT)) {
            Path gpx = Path.of(cmd.getOptionValue(GPX_OPT));
            String name = response.getSourceNodeId() + " to " + response.getTargetNodeId()
                    + " (" + response.getProfileName() + ")";
            new GpxExporter().write(route, name, gpx);
            out.println("gpx: " + gpx);
        }
        return EXIT_OK;
    }

    private static int benchmark(CommandLine cmd, PrintStream out, PrintStream err) throws IOException {
        RouteCore core = routeCore(cmd);
        PoiCatalog catalog = poiCatalog(cmd);
        List<BenchmarkSite> sites = catalog.isEmpty()
                ? BenchmarkSite.fromGraphNodes(core.graph())
                : BenchmarkSite.fromCatalog(catalog);

        BenchmarkConfig.BenchmarkConfigBuilder config = BenchmarkConfig.builder();
        if (cmd.hasOption(PAIRS_OPT)) {
            int pairs = parseInt(PAIRS_OPT, cmd.getOptionValue(PAIRS_OPT));
            config.pairCount(pairs);
            config.maxSamplingAttempts(Math.max(MIN_SAMPLING_ATTEMPTS, pairs * SAMPLING_ATTEMPTS_PER_PAIR));
        }
        if (cmd.hasOption(REPETITIONS_OPT)) {
            config.repetitions(parseInt(REPETITIONS_OPT, cmd.getOptionValue(REPETITIONS_OPT)));
        }
        if (cmd.hasOption(WARMUP_OPT)) {
            config.warmupRepetitions(parseInt(WARMUP_OPT, cmd.getOptionValue(WARMUP_OPT)));
        }
        if (cmd.hasOption(SEED_OPT)) {
            config.seed(parseLong(SEED_OPT, cmd.getOptionValue(SEED_OPT)));
        }
        for (String profile : parseCsvList(cmd, PROFILE_OPT)) {
            config.profileName(profile);
        }
        for (String algorithm : parseCsvList(cmd, ALGORITHM_OPT)) {
            config.algorithm(parseAlgorithm(algorithm));
        }
        BenchmarkConfig built = config.build();
        built.validate();

        BenchmarkRun run = new BenchmarkHarness(core, sites).run(built);
        BenchmarkReport report = BenchmarkReport.of(run);
        out.print(report.render());

        if (cmd.hasOption(CSV_OPT)) {
            Path csv = Path.of(cmd.getOptionValue(CSV_OPT));
            new BenchmarkCsvWriter().write(run, csv);
            out.println("csv: " + csv);
        }
        if (cmd.hasOption(JSON_OPT)) {
            Path json = Path.of(cmd.getOptionValue(JSON_OPT));
            new BenchmarkJsonWriter().write(run, json);
            out.println("json: " + json);
        }
        if (cmd.hasOption(REPORT_OPT)) {
            Path text = Path.of(cmd.getOptionValue(REPORT_OPT));
            Files.writeString(text, report.render(), StandardCharsets.UTF_8);
            out.println("report: " + text);
        }
        if (run.getTestedPairs() < built.getPairCount()) {
            err.printf(Locale.ROOT, "Only %d of %d pairs could be sampled%n", run.getTestedPairs(), built.getPairCount());
        }
        return EXIT_OK;
    }

    private static int listProfiles(CommandLine cmd, PrintStream out) {
        ProfileRegistry registry = profileRegistry(cmd);
        for (MobilityProfile profile : registry.profiles()) {
            out.printf(Locale.ROOT, "%-22s %-32s %.2f m/s  exclusions=%s%n",
                    profile.name(), profile.label(), profile.baseSpeedMetersPerSecond(), profile.exclusionRules());
        }
        return EXIT_OK;
    }

    private static RouteCore routeCore(CommandLine cmd) {
        if (!cmd.hasOption(GRAPH_OPT)) {
            throw new IllegalArgumentException("--" + GRAPH_OPT + " is required");
        }
        PathGraph graph = new PathGraphJsonLoader().load(Path.of(cmd.getOptionValue(GRAPH_OPT)));
        return RouteCore.builder()
                .graph(graph)
                .profileRegistry(profileRegistry(cmd))
                .build();
    }

    private static ProfileRegistry profileRegistry(CommandLine cmd) {
        if (!cmd.hasOption(PROFILES_OPT)) {
            return ProfileRegistry.defaultRegistry();
        }
        List<MobilityProfile> custom = new ProfileCatalogLoader().load(Path.of(cmd.getOptionValue(PROFILES_OPT)));
        logger.info("Loaded {} custom profiles", custom.size());
        return new ProfileRegistry(custom);
    }

    private static PoiCatalog poiCatalog(CommandLine cmd) {
        if (!cmd.hasOption(POI_OPT)) {
            return PoiCatalog.empty();
        }
        return new PoiCatalogParser().parse(Path.of(cmd.getOptionValue(POI_OPT)));
    }

    private static Coordinate endpointCoordinate(CommandLine cmd, String coordOpt, String poiOpt, PoiCatalog catalog) {
        if (cmd.hasOption(coordOpt) && cmd.hasOption(poiOpt)) {
            throw new IllegalArgumentException("--" + coordOpt + " and --" + poiOpt + " are mutually exclusive");
        }
        if (cmd.hasOption(coordOpt)) {
            return parseCoordinate(coordOpt, cmd.getOptionValue(coordOpt));
        }
        if (cmd.hasOption(poiOpt)) {
            String name = cmd.getOptionValue(poiOpt);
            PointOfInterest poi = catalog.find(name);
            if (poi == null) {
                throw new IllegalArgumentException("Unknown point of interest: " + name);
            }
            return poi.coordinate();
        }
        return null;
    }

    static Coordinate parseCoordinate(String option, String value) {
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("--" + option + " expects lat,lon but got '" + value + "'");
        }
        return new Coordinate(parseDouble(option, parts[0].trim()), parseDouble(option, parts[1].trim()));
    }

    static SearchAlgorithm parseAlgorithm(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return SearchAlgorithm.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown algorithm '" + value + "', expected one of " + Arrays.toString(SearchAlgorithm.values()), e);
        }
    }

    private static List<String> parseCsvList(CommandLine cmd, String option) {
        return cmd.hasOption(option)
                ? Arrays.asList(cmd.getOptionValue(option).split("\\s*,\\s*"))
                : List.of();
    }

    private static double parseDouble(String option, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects a number but got '" + value + "'", e);
        }
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects an integer but got '" + value + "'", e);
        }
    }

    private static long parseLong(String option, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects an integer but got '" + value + "'", e);
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption("g", GRAPH_OPT, true, "Path graph JSON file.");
        options.addOption(null, POI_OPT, true, "Points of interest text file. (Optional)");
        options.addOption(null, PROFILES_OPT, true, "Profile catalog JSON overriding built-in profiles. (Optional)");
        options.addOption("p", PROFILE_OPT, true, "Mobility profile; comma separated list for benchmark.");
        options.addOption("a", ALGORITHM_OPT, true, "DIJKSTRA, BIDIRECTIONAL_DIJKSTRA or A_STAR; comma separated list for benchmark.");
        options.addOption(null, FROM_NODE_OPT, true, "Origin node id.");
        options.addOption(null, TO_NODE_OPT, true, "Destination node id.");
        options.addOption(null, FROM_COORD_OPT, true, "Origin as lat,lon.");
        options.addOption(null, TO_COORD_OPT, true, "Destination as lat,lon.");
        options.addOption(null, FROM_POI_OPT, true, "Origin point of interest name.");
        options.addOption(null, TO_POI_OPT, true, "Destination point of interest name.");
        options.addOption(null, SNAP_OPT, true, "Max coordinate snap distance in meters.");
        options.addOption(null, GPX_OPT, true, "Write the route as GPX 1.1 to this file.");
        options.addOption(null, PAIRS_OPT, true, "Benchmark pair count.");
        options.addOption(null, REPETITIONS_OPT, true, "Timed repetitions per pair and algorithm.");
        options.addOption(null, WARMUP_OPT, true, "Warm-up repetitions per pair and algorithm.");
        options.addOption(null, SEED_OPT, true, "Pair sampling seed.");
        options.addOption(null, CSV_OPT, true, "Write benchmark records as CSV.");
        options.addOption(null, JSON_OPT, true, "Write benchmark records as JSON.");
        options.addOption(null, REPORT_OPT, true, "Write the benchmark report as text.");
        options.addOption("h", HELP_OPT, false, "Print all command line options, then exit.");
        return options;
    }

    private static void printUsage(PrintStream stream) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(120);
        PrintWriter writer = new PrintWriter(stream, true, StandardCharsets.UTF_8);
        formatter.printHelp(writer, 120, "access-route <route|benchmark|profiles> [options]",
                null, options(), formatter.getLeftPadding(), formatter.getDescPadding(), null);
        writer.flush();
    }
}
