package org.accessroute.routing.search;

/**
 * Terminal state of one search.
 */
public enum SearchOutcome {
    /** A least-cost path was found. */
    FOUND,
    /** The destination is unreachable through passable arcs. */
    NO_ROUTE,
    /** The search budget was exhausted before the search could decide. */
    BOUND_EXCEEDED
}
