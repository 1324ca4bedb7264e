package org.accessroute.routing.search;

import org.accessroute.routing.cost.WeightedGraph;

/**
 * Point-to-point least-cost search over a weighted graph.
 *
 * <p>Implementations are stateless and safe for concurrent use; all search state is
 * allocated per call.</p>
 */
public interface SearchStrategy {

    /**
     * @return algorithm implemented by this strategy.
     */
    SearchAlgorithm algorithm();

    /**
     * Finds a least-cost path between two internal node ids.
     *
     * @param graph profile-specific weighted graph.
     * @param origin internal origin node id.
     * @param destination internal destination node id.
     * @param counter receives every node finalized by this search.
     * @return search result; never throws for out-of-range or unreachable endpoints.
     */
    SearchResult find(WeightedGraph graph, int origin, int destination, ExplorationCounter counter);

    /**
     * Convenience overload with a fresh exploration counter.
     */
    default SearchResult find(WeightedGraph graph, int origin, int destination) {
        return find(graph, origin, destination, new ExplorationCounter());
    }
}
