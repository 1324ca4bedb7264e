package org.accessroute.benchmark;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.accessroute.routing.profile.BuiltInProfiles;
import org.accessroute.routing.search.SearchAlgorithm;

import java.util.Arrays;
import java.util.List;

/**
 * Benchmark run parameters. Defaults: 50 pairs, 20 timed repetitions after 3 warm-ups,
 * seed 42, the {@code standard} profile and every search algorithm.
 */
@Value
@Builder(toBuilder = true)
public class BenchmarkConfig {
    @Builder.Default
    int pairCount = 50;
    @Builder.Default
    int repetitions = 20;
    @Builder.Default
    int warmupRepetitions = 3;
    @Builder.Default
    long seed = 42L;
    /** Upper bound on sampling attempts, including discarded unreachable pairs. */
    @Builder.Default
    int maxSamplingAttempts = 1_000;
    /** Profiles to measure; {@code standard} when empty. */
    @Singular
    List<String> profileNames;
    /** Algorithms to measure; all when empty. */
    @Singular
    List<SearchAlgorithm> algorithms;

    public List<String> effectiveProfileNames() {
        return profileNames.isEmpty() ? List.of(BuiltInProfiles.STANDARD) : profileNames;
    }

    public List<SearchAlgorithm> effectiveAlgorithms() {
        return algorithms.isEmpty() ? Arrays.asList(SearchAlgorithm.values()) : algorithms;
    }

    /**
     * @throws IllegalArgumentException when a count is out of range.
     */
    public void validate() {
        if (pairCount <= 0) {
            throw new IllegalArgumentException("pairCount must be > 0, got " + pairCount);
        }
        if (repetitions <= 0) {
            throw new IllegalArgumentException("repetitions must be > 0, got " + repetitions);
        }
        if (warmupRepetitions < 0) {
            throw new IllegalArgumentException("warmupRepetitions must be >= 0, got " + warmupRepetitions);
        }
        if (maxSamplingAttempts < pairCount) {
            throw new IllegalArgumentException(
                    "maxSamplingAttempts must be >= pairCount, got " + maxSamplingAttempts);
        }
    }
}
