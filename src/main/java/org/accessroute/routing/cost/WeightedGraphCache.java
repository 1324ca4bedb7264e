package org.accessroute.routing.cost;

import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.MobilityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily builds and memoizes one {@link WeightedGraph} per profile name.
 * <p>
 * The first caller for a profile computes the weighted graph; concurrent callers for the
 * same profile block on that computation instead of repeating it. A cached entry built
 * from a different profile instance under the same name is rebuilt.
 * </p>
 */
public final class WeightedGraphCache {
    private static final Logger logger = LoggerFactory.getLogger(WeightedGraphCache.class);

    private final PathGraph graph;
    private final ConcurrentHashMap<String, WeightedGraph> byProfileName = new ConcurrentHashMap<>();

    public WeightedGraphCache(PathGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Returns the weighted graph for a profile, building it on first use.
     */
    public WeightedGraph get(MobilityProfile profile) {
        Objects.requireNonNull(profile, "profile");
        WeightedGraph cached = byProfileName.get(profile.name());
        if (cached != null && cached.profile() == profile) {
            return cached;
        }
        return byProfileName.compute(profile.name(), (name, existing) -> {
            if (existing != null && existing.profile() == profile) {
                return existing;
            }
            return buildLogged(profile);
        });
    }

    /**
     * @return cached weighted graph or {@code null} when not built yet.
     */
    public WeightedGraph peek(String profileName) {
        return profileName == null ? null : byProfileName.get(profileName);
    }

    public void invalidate(String profileName) {
        if (profileName != null && byProfileName.remove(profileName) != null) {
            logger.debug("Invalidated weighted graph for profile {}", profileName);
        }
    }

    public void clear() {
        byProfileName.clear();
    }

    public int size() {
        return byProfileName.size();
    }

    public PathGraph graph() {
        return graph;
    }

    private WeightedGraph buildLogged(MobilityProfile profile) {
        long started = System.nanoTime();
        WeightedGraph weighted = WeightedGraph.build(graph, profile);
        long elapsedMicros = (System.nanoTime() - started) / 1_000L;
        logger.info("Weighted graph for profile {} built in {} us: {} arcs, {} impassable",
                profile.name(), elapsedMicros, weighted.arcCount(), weighted.impassableArcCount());
        return weighted;
    }
}
