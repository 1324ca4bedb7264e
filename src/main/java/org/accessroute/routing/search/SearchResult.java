package org.accessroute.routing.search;

/**
 * Outcome of one shortest-path search in internal node and arc space.
 *
 * @param outcome terminal state.
 * @param nodePath visited nodes from origin to destination, empty unless found.
 * @param arcPath traversed arcs in walking order, {@code nodePath.length - 1} entries.
 * @param totalCost sum of arc costs, {@code +INF} unless found.
 * @param nodesExplored distinct nodes finalized by the search.
 */
public record SearchResult(
        SearchOutcome outcome,
        int[] nodePath,
        int[] arcPath,
        double totalCost,
        int nodesExplored
) {
    private static final int[] EMPTY = new int[0];

    public static SearchResult found(int[] nodePath, int[] arcPath, double totalCost, int nodesExplored) {
        return new SearchResult(SearchOutcome.FOUND, nodePath, arcPath, totalCost, nodesExplored);
    }

    public static SearchResult noRoute(int nodesExplored) {
        return new SearchResult(SearchOutcome.NO_ROUTE, EMPTY, EMPTY, Double.POSITIVE_INFINITY, nodesExplored);
    }

    public static SearchResult boundExceeded(int nodesExplored) {
        return new SearchResult(SearchOutcome.BOUND_EXCEEDED, EMPTY, EMPTY, Double.POSITIVE_INFINITY, nodesExplored);
    }

    public boolean isFound() {
        return outcome == SearchOutcome.FOUND;
    }
}
