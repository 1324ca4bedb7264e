package org.accessroute.routing.core;

import lombok.Builder;
import org.accessroute.routing.cost.WeightedGraph;
import org.accessroute.routing.cost.WeightedGraphCache;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.BuiltInProfiles;
import org.accessroute.routing.profile.MobilityProfile;
import org.accessroute.routing.profile.ProfileRegistry;
import org.accessroute.routing.route.Route;
import org.accessroute.routing.route.RouteAssembler;
import org.accessroute.routing.search.ExplorationCounter;
import org.accessroute.routing.search.SearchAlgorithm;
import org.accessroute.routing.search.SearchBudget;
import org.accessroute.routing.search.SearchResult;
import org.accessroute.routing.search.SearchStrategies;
import org.accessroute.routing.search.SearchStrategy;
import org.accessroute.routing.spatial.NearestNodeLocator;
import org.accessroute.routing.spatial.NodeMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Main routing entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request and resolve the mobility profile.</li>
 * <li>Fetch (or lazily build) the profile's weighted graph.</li>
 * <li>Resolve endpoints from external node ids or snap coordinates to usable nodes.</li>
 * <li>Run the selected strategy with a fresh {@link ExplorationCounter}.</li>
 * <li>Assemble the found path into a {@link Route}.</li>
 * </ul>
 */
public final class RouteCore implements RouterService {
    public static final String REASON_ROUTE_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_SOURCE_REQUIRED = "ROUTE_SOURCE_REQUIRED";
    public static final String REASON_TARGET_REQUIRED = "ROUTE_TARGET_REQUIRED";
    public static final String REASON_AMBIGUOUS_ENDPOINT = "ROUTE_AMBIGUOUS_ENDPOINT";
    public static final String REASON_ALGORITHM_REQUIRED = "ALGORITHM_REQUIRED";
    public static final String REASON_UNKNOWN_NODE = "UNKNOWN_NODE";
    public static final String REASON_UNKNOWN_PROFILE = "UNKNOWN_PROFILE";
    public static final String REASON_INVALID_COORDINATE = "INVALID_COORDINATE";
    public static final String REASON_INVALID_SNAP_DISTANCE = "INVALID_SNAP_DISTANCE";
    public static final String REASON_COORDINATE_OUT_OF_COVERAGE = "COORDINATE_OUT_OF_COVERAGE";

    private static final Logger logger = LoggerFactory.getLogger(RouteCore.class);

    private final PathGraph graph;
    private final ProfileRegistry profileRegistry;
    private final WeightedGraphCache weightedGraphs;
    private final Map<SearchAlgorithm, SearchStrategy> strategies;
    private final double defaultMaxSnapDistanceMeters;

    /**
     * @param graph path network.
     * @param profileRegistry profiles; built-ins when {@code null}.
     * @param searchBudget per-query budget; system-property defaults when {@code null}.
     * @param maxSnapDistanceMeters default coordinate snap radius; 250 m when {@code null}.
     */
    @Builder
    public RouteCore(
            PathGraph graph,
            ProfileRegistry profileRegistry,
            SearchBudget searchBudget,
            Double maxSnapDistanceMeters
    ) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.profileRegistry = profileRegistry == null ? ProfileRegistry.defaultRegistry() : profileRegistry;
        this.weightedGraphs = new WeightedGraphCache(graph);
        this.strategies = SearchStrategies.all(searchBudget == null ? SearchBudget.defaults() : searchBudget);
        this.defaultMaxSnapDistanceMeters = maxSnapDistanceMeters == null
                ? NearestNodeLocator.DEFAULT_MAX_SNAP_DISTANCE_METERS
                : requireSnapDistance(maxSnapDistanceMeters);
    }

    /**
     * Executes one client point-to-point request.
     *
     * @throws RouteCoreException when request contracts fail.
     */
    @Override
    public RouteResponse route(RouteRequest request) {
        if (request == null) {
            throw new RouteCoreException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        if (request.getAlgorithm() == null) {
            throw new RouteCoreException(
                    REASON_ALGORITHM_REQUIRED,
                    "algorithm must be provided (DIJKSTRA, BIDIRECTIONAL_DIJKSTRA, A_STAR)"
            );
        }
        WeightedGraph weighted = weightedGraph(request.getProfileName());
        double snapRadius = request.getMaxSnapDistanceMeters() == null
                ? defaultMaxSnapDistanceMeters
                : requireSnapDistance(request.getMaxSnapDistanceMeters());

        Endpoint source = resolveEndpoint(
                weighted, request.getSourceNodeId(), request.getSourceCoordinate(), snapRadius, "source", REASON_SOURCE_REQUIRED);
        Endpoint target = resolveEndpoint(
                weighted, request.getTargetNodeId(), request.getTargetCoordinate(), snapRadius, "target", REASON_TARGET_REQUIRED);

        SearchStrategy strategy = strategies.get(request.getAlgorithm());
        SearchResult result = strategy.find(weighted, source.node(), target.node(), new ExplorationCounter());
        logger.debug("{} {} -> {} under {}: {} ({} nodes explored)",
                request.getAlgorithm(), graph.nodeId(source.node()), graph.nodeId(target.node()),
                weighted.profile().name(), result.outcome(), result.nodesExplored());

        Route route = result.isFound() ? RouteAssembler.assemble(weighted, result) : null;
        return RouteResponse.builder()
                .outcome(result.outcome())
                .profileName(weighted.profile().name())
                .algorithm(request.getAlgorithm())
                .sourceNodeId(graph.nodeId(source.node()))
                .targetNodeId(graph.nodeId(target.node()))
                .sourceSnapMeters(source.snapMeters())
                .targetSnapMeters(target.snapMeters())
                .totalCost(result.totalCost())
                .nodesExplored(result.nodesExplored())
                .route(route)
                .build();
    }

    /**
     * Returns the cached weighted graph for a profile name ({@code standard} when null).
     *
     * @throws RouteCoreException when the profile is not registered.
     */
    public WeightedGraph weightedGraph(String profileName) {
        String name = profileName == null ? BuiltInProfiles.STANDARD : profileName;
        MobilityProfile profile = profileRegistry.profile(name);
        if (profile == null) {
            throw new RouteCoreException(
                    REASON_UNKNOWN_PROFILE,
                    "unknown profile '" + name + "', expected one of " + profileRegistry.profileNames()
            );
        }
        return weightedGraphs.get(profile);
    }

    public SearchStrategy strategy(SearchAlgorithm algorithm) {
        if (algorithm == null) {
            throw new RouteCoreException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        return strategies.get(algorithm);
    }

    public PathGraph graph() {
        return graph;
    }

    public ProfileRegistry profileRegistry() {
        return profileRegistry;
    }

    private Endpoint resolveEndpoint(
            WeightedGraph weighted,
            String nodeId,
            Coordinate coordinate,
            double snapRadius,
            String role,
            String missingReason
    ) {
        if (nodeId != null && coordinate != null) {
            throw new RouteCoreException(
                    REASON_AMBIGUOUS_ENDPOINT, role + " must be given as node id or coordinate, not both");
        }
        if (nodeId != null) {
            int node = graph.nodeIndex(nodeId);
            if (node < 0) {
                throw new RouteCoreException(REASON_UNKNOWN_NODE, "unknown " + role + " node id: " + nodeId);
            }
            return new Endpoint(node, 0.0d);
        }
        if (coordinate == null) {
            throw new RouteCoreException(missingReason, role + " node id or coordinate must be provided");
        }
        if (!coordinate.isValid()) {
            throw new RouteCoreException(
                    REASON_INVALID_COORDINATE, role + " coordinate out of WGS-84 bounds: " + coordinate);
        }
        NodeMatch match = new NearestNodeLocator(graph, snapRadius)
                .nearest(coordinate.lat(), coordinate.lon(), weighted::hasPassableIncidentArc);
        if (match == null) {
            throw new RouteCoreException(
                    REASON_COORDINATE_OUT_OF_COVERAGE,
                    role + " coordinate " + coordinate + " has no usable node within " + snapRadius + " m"
            );
        }
        return new Endpoint(match.nodeIndex(), match.distanceMeters());
    }

    private static double requireSnapDistance(double meters) {
        if (!Double.isFinite(meters) || meters <= 0.0d) {
            throw new RouteCoreException(
                    REASON_INVALID_SNAP_DISTANCE, "max snap distance must be finite and > 0, got " + meters);
        }
        return meters;
    }

    private record Endpoint(int node, double snapMeters) {
    }
}
