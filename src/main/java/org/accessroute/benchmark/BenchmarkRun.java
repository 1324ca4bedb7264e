package org.accessroute.benchmark;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.accessroute.routing.search.SearchAlgorithm;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Complete result of one benchmark run.
 */
@Value
@Builder
public class BenchmarkRun {
    BenchmarkConfig config;
    Instant startedAt;
    /** Pairs that passed the connectivity check and were measured. */
    int testedPairs;
    /** Sampled pairs dropped because they were unreachable under {@code standard}. */
    int discardedPairs;
    @Singular
    List<BenchmarkRecord> records;

    /**
     * Finds the record for one measurement, if present.
     */
    public Optional<BenchmarkRecord> find(String profileName, int pairIndex, SearchAlgorithm algorithm) {
        return records.stream()
                .filter(r -> r.getProfileName().equals(profileName)
                        && r.getPairIndex() == pairIndex
                        && r.getAlgorithm() == algorithm)
                .findFirst();
    }
}
