package org.accessroute.routing.heuristic;

/**
 * Supported heuristic modes.
 *
 * <p>{@code NONE} disables guidance (uniform-cost search).</p>
 * <p>{@code SPHERICAL} scales great-circle distance by the profile's minimum cost factor.</p>
 */
public enum HeuristicType {
    NONE,
    SPHERICAL
}
