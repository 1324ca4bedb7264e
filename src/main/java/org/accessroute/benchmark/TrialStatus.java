package org.accessroute.benchmark;

/**
 * Outcome of one (profile, pair, algorithm) measurement.
 */
public enum TrialStatus {
    OK,
    NO_ROUTE,
    BOUND_EXCEEDED,
    /** The trial threw; see {@link BenchmarkRecord#getError()}. */
    FAILED
}
