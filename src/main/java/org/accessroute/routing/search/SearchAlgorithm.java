package org.accessroute.routing.search;

/**
 * Shortest-path strategy selector.
 */
public enum SearchAlgorithm {
    DIJKSTRA,
    BIDIRECTIONAL_DIJKSTRA,
    A_STAR
}
