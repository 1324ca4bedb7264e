package org.accessroute.benchmark;

import lombok.Builder;
import lombok.Value;
import org.accessroute.routing.search.SearchAlgorithm;

/**
 * Measurement of one algorithm on one origin-destination pair under one profile.
 */
@Value
@Builder
public class BenchmarkRecord {
    String profileName;
    /** Position of the pair in sampling order, shared by all algorithms measured on it. */
    int pairIndex;
    String origin;
    String destination;
    /** Great-circle distance between the two sites. */
    double geometricDistanceMeters;
    DistanceCategory category;
    SearchAlgorithm algorithm;
    TrialStatus status;
    @Builder.Default
    TimingStatistics timing = TimingStatistics.empty();
    int nodesExplored;
    double routeDistanceMeters;
    int routePointCount;
    /** Failure description, {@code null} unless the status is not {@link TrialStatus#OK}. */
    String error;

    public boolean isOk() {
        return status == TrialStatus.OK;
    }
}
