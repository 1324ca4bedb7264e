package org.accessroute.benchmark;

import org.accessroute.routing.core.RouteCore;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.graph.GeoDistance;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.BuiltInProfiles;
import org.accessroute.routing.route.Route;
import org.accessroute.routing.route.RouteAssembler;
import org.accessroute.routing.search.ExplorationCounter;
import org.accessroute.routing.search.SearchAlgorithm;
import org.accessroute.routing.search.SearchOutcome;
import org.accessroute.routing.search.SearchResult;
import org.accessroute.routing.search.SearchStrategy;
import org.accessroute.routing.spatial.NearestNodeLocator;
import org.accessroute.routing.spatial.NodeMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Measures every configured (profile, pair, algorithm) combination.
 * <p>
 * Pairs are sampled from the sites with a seeded {@link Random}; a pair is kept only when it
 * is reachable under {@code standard}, otherwise it is discarded and another pair drawn.
 * Each measurement runs the warm-ups, then the timed repetitions, each with a fresh
 * {@link ExplorationCounter}. A failing trial is recorded and the run continues.
 * </p>
 */
public final class BenchmarkHarness {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0d;

    private final RouteCore routeCore;
    private final List<BenchmarkSite> sites;

    public BenchmarkHarness(RouteCore routeCore, List<BenchmarkSite> sites) {
        this.routeCore = Objects.requireNonNull(routeCore, "routeCore");
        this.sites = List.copyOf(Objects.requireNonNull(sites, "sites"));
    }

    /**
     * @throws IllegalArgumentException when the config is invalid or fewer than two sites
     *                                  snap onto the graph.
     */
    public BenchmarkRun run(BenchmarkConfig config) {
        config.validate();
        Instant startedAt = Instant.now();
        PathGraph graph = routeCore.graph();
        WeightedGraph standard = routeCore.weightedGraph(BuiltInProfiles.STANDARD);

        List<SnappedSite> snapped = snapSites(graph, standard);
        if (snapped.size() < 2) {
            throw new IllegalArgumentException(
                    "benchmark needs at least two sites on the graph, got " + snapped.size());
        }

        Random random = new Random(config.getSeed());
        SearchStrategy connectivityCheck = routeCore.strategy(SearchAlgorithm.DIJKSTRA);
        List<Pair> pairs = new ArrayList<>(config.getPairCount());
        int discarded = 0;
        int attempts = 0;
        while (pairs.size() < config.getPairCount() && attempts < config.getMaxSamplingAttempts()) {
            attempts++;
            int first = random.nextInt(snapped.size());
            int second = random.nextInt(snapped.size() - 1);
            if (second >= first) {
                second++;
            }
            SnappedSite origin = snapped.get(first);
            SnappedSite destination = snapped.get(second);
            if (!connectivityCheck.find(standard, origin.node(), destination.node()).isFound()) {
                discarded++;
                continue;
            }
            double geometric = GeoDistance.greatCircleMeters(origin.site().coordinate(), destination.site().coordinate());
            pairs.add(new Pair(origin, destination, geometric, DistanceCategory.of(geometric)));
        }
        if (pairs.size() < config.getPairCount()) {
            logger.warn("Sampled only {} of {} pairs within {} attempts",
                    pairs.size(), config.getPairCount(), config.getMaxSamplingAttempts());
        }
        logger.info("Benchmark: {} pairs, {} discarded, seed {}, {} repetitions ({} warm-up)",
                pairs.size(), discarded, config.getSeed(), config.getRepetitions(), config.getWarmupRepetitions());

        BenchmarkRun.BenchmarkRunBuilder run = BenchmarkRun.builder()
                .config(config)
                .startedAt(startedAt)
                .testedPairs(pairs.size())
                .discardedPairs(discarded);
        for (String profileName : config.effectiveProfileNames()) {
            WeightedGraph weighted = routeCore.weightedGraph(profileName);
            logger.info("Measuring profile {}", weighted.profile().name());
            for (int pairIndex = 0; pairIndex < pairs.size(); pairIndex++) {
                for (SearchAlgorithm algorithm : config.effectiveAlgorithms()) {
                    run.record(measure(weighted, pairIndex, pairs.get(pairIndex), algorithm, config));
                }
            }
        }
        return run.build();
    }

    private BenchmarkRecord measure(
            WeightedGraph weighted,
            int pairIndex,
            Pair pair,
            SearchAlgorithm algorithm,
            BenchmarkConfig config
    ) {
        BenchmarkRecord.BenchmarkRecordBuilder record = BenchmarkRecord.builder()
                .profileName(weighted.profile().name())
                .pairIndex(pairIndex)
                .origin(pair.origin().site().name())
                .destination(pair.destination().site().name())
                .geometricDistanceMeters(pair.geometricMeters())
                .category(pair.category())
                .algorithm(algorithm);
        SearchStrategy strategy = routeCore.strategy(algorithm);
        int origin = pair.origin().node();
        int destination = pair.destination().node();
        try {
            for (int i = 0; i < config.getWarmupRepetitions(); i++) {
                strategy.find(weighted, origin, destination, new ExplorationCounter());
            }
            double[] samples = new double[config.getRepetitions()];
            SearchResult last = null;
            for (int i = 0; i < samples.length; i++) {
                ExplorationCounter counter = new ExplorationCounter();
                long started = System.nanoTime();
                last = strategy.find(weighted, origin, destination, counter);
                samples[i] = (System.nanoTime() - started) / NANOS_PER_MILLI;
                if (!last.isFound()) {
                    return record.status(statusOf(last.outcome()))
                            .nodesExplored(last.nodesExplored())
                            .error(last.outcome() == SearchOutcome.NO_ROUTE ? "no route" : "search bound exceeded")
                            .build();
                }
            }
            Route route = RouteAssembler.assemble(weighted, last);
            return record.status(TrialStatus.OK)
                    .timing(TimingStatistics.of(samples))
                    .nodesExplored(last.nodesExplored())
                    .routeDistanceMeters(route.getDistanceMeters())
                    .routePointCount(route.getCoordinates().size())
                    .build();
        } catch (RuntimeException ex) {
            logger.warn("Trial {} {} -> {} under {} failed", algorithm, pair.origin().site().name(),
                    pair.destination().site().name(), weighted.profile().name(), ex);
            return record.status(TrialStatus.FAILED).error(ex.toString()).build();
        }
    }

    private List<SnappedSite> snapSites(PathGraph graph, WeightedGraph standard) {
        NearestNodeLocator locator = new NearestNodeLocator(graph);
        List<SnappedSite> snapped = new ArrayList<>(sites.size());
        for (BenchmarkSite site : sites) {
            NodeMatch match = locator.nearest(
                    site.coordinate().lat(), site.coordinate().lon(), standard::hasPassableIncidentArc);
            if (match == null) {
                logger.warn("Site {} at {} is not near the path network, skipped", site.name(), site.coordinate());
                continue;
            }
            snapped.add(new SnappedSite(site, match.nodeIndex()));
        }
        return snapped;
    }

    private static TrialStatus statusOf(SearchOutcome outcome) {
        return switch (outcome) {
            case FOUND -> TrialStatus.OK;
            case NO_ROUTE -> TrialStatus.NO_ROUTE;
            case BOUND_EXCEEDED -> TrialStatus.BOUND_EXCEEDED;
        };
    }

    private record SnappedSite(BenchmarkSite site, int node) {
    }

    private record Pair(SnappedSite origin, SnappedSite destination, double geometricMeters, DistanceCategory category) {
    }
}
