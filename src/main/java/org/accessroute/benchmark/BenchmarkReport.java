package org.accessroute.benchmark;

import org.accessroute.routing.search.SearchAlgorithm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates a benchmark run per profile, algorithm and distance category.
 * <p>
 * Speed-up and explored-node saving are computed pair by pair against the
 * {@link SearchAlgorithm#DIJKSTRA} measurement of the same pair and profile, then averaged:
 * </p>
 * <pre>
 * speedup    = dijkstra.meanMs / algorithm.meanMs
 * nodeSaving = 100 * (1 - algorithm.nodesExplored / dijkstra.nodesExplored)
 * </pre>
 * Only {@link TrialStatus#OK} records contribute. Values without a baseline are {@code NaN}.
 */
public final class BenchmarkReport {
    private static final SearchAlgorithm BASELINE = SearchAlgorithm.DIJKSTRA;

    private final BenchmarkRun run;
    private final List<Summary> summaries;

    /**
     * @param category {@code null} for the summary over all categories.
     */
    public record Summary(
            String profileName,
            SearchAlgorithm algorithm,
            DistanceCategory category,
            int trials,
            double meanMs,
            double medianMs,
            double meanNodesExplored,
            double meanSpeedup,
            double meanNodeSavingPct
    ) {
    }

    private BenchmarkReport(BenchmarkRun run, List<Summary> summaries) {
        this.run = run;
        this.summaries = List.copyOf(summaries);
    }

    public static BenchmarkReport of(BenchmarkRun run) {
        Map<String, BenchmarkRecord> baselines = new HashMap<>();
        for (BenchmarkRecord record : run.getRecords()) {
            if (record.getAlgorithm() == BASELINE && record.isOk()) {
                baselines.put(baselineKey(record), record);
            }
        }

        List<Summary> summaries = new ArrayList<>();
        List<DistanceCategory> scopes = new ArrayList<>();
        scopes.add(null);
        scopes.addAll(Arrays.asList(DistanceCategory.values()));
        for (String profile : run.getConfig().effectiveProfileNames()) {
            for (SearchAlgorithm algorithm : run.getConfig().effectiveAlgorithms()) {
                for (DistanceCategory category : scopes) {
                    Summary summary = summarize(run, baselines, profile, algorithm, category);
                    if (summary != null) {
                        summaries.add(summary);
                    }
                }
            }
        }
        return new BenchmarkReport(run, summaries);
    }

    public List<Summary> summaries() {
        return summaries;
    }

    /**
     * @return matching summary or {@code null} when that combination had no successful trial.
     */
    public Summary summary(String profileName, SearchAlgorithm algorithm, DistanceCategory category) {
        for (Summary summary : summaries) {
            if (summary.profileName().equals(profileName)
                    && summary.algorithm() == algorithm
                    && summary.category() == category) {
                return summary;
            }
        }
        return null;
    }

    /**
     * Renders the report as fixed-width text.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        String rule = "=".repeat(78);
        out.append(rule).append('\n');
        out.append("BENCHMARK REPORT").append('\n');
        out.append(String.format(Locale.ROOT, "seed=%d pairs=%d discarded=%d repetitions=%d warmup=%d%n",
                run.getConfig().getSeed(), run.getTestedPairs(), run.getDiscardedPairs(),
                run.getConfig().getRepetitions(), run.getConfig().getWarmupRepetitions()));
        long failures = run.getRecords().stream().filter(r -> !r.isOk()).count();
        if (failures > 0) {
            out.append(String.format(Locale.ROOT, "non-OK trials: %d%n", failures));
        }
        out.append(rule).append('\n');

        for (String profile : run.getConfig().effectiveProfileNames()) {
            out.append('\n').append("Profile: ").append(profile).append('\n');
            out.append(String.format(Locale.ROOT, "%-24s %-8s %6s %11s %11s %11s %9s %9s%n",
                    "algorithm", "category", "trials", "mean ms", "median ms", "nodes", "speedup", "saving%"));
            out.append("-".repeat(78)).append('\n');
            for (Summary s : summaries) {
                if (!s.profileName().equals(profile)) {
                    continue;
                }
                out.append(String.format(Locale.ROOT, "%-24s %-8s %6d %11.4f %11.4f %11.1f %8.2fx %9.2f%n",
                        s.algorithm(),
                        s.category() == null ? "ALL" : s.category().name(),
                        s.trials(),
                        s.meanMs(),
                        s.medianMs(),
                        s.meanNodesExplored(),
                        s.meanSpeedup(),
                        s.meanNodeSavingPct()));
            }
        }
        out.append(rule).append('\n');
        return out.toString();
    }

    private static Summary summarize(
            BenchmarkRun run,
            Map<String, BenchmarkRecord> baselines,
            String profile,
            SearchAlgorithm algorithm,
            DistanceCategory category
    ) {
        List<Double> means = new ArrayList<>();
        double nodes = 0.0d;
        double speedupSum = 0.0d;
        int speedupCount = 0;
        double savingSum = 0.0d;
        int savingCount = 0;
        for (BenchmarkRecord record : run.getRecords()) {
            if (!record.isOk()
                    || !record.getProfileName().equals(profile)
                    || record.getAlgorithm() != algorithm
                    || (category != null && record.getCategory() != category)) {
                continue;
            }
            means.add(record.getTiming().getMeanMs());
            nodes += record.getNodesExplored();
            BenchmarkRecord baseline = baselines.get(baselineKey(record));
            if (baseline == null) {
                continue;
            }
            if (record.getTiming().getMeanMs() > 0.0d) {
                speedupSum += baseline.getTiming().getMeanMs() / record.getTiming().getMeanMs();
                speedupCount++;
            }
            if (baseline.getNodesExplored() > 0) {
                savingSum += 100.0d * (1.0d - (double) record.getNodesExplored() / baseline.getNodesExplored());
                savingCount++;
            }
        }
        if (means.isEmpty()) {
            return null;
        }
        double[] sorted = means.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        return new Summary(
                profile,
                algorithm,
                category,
                sorted.length,
                Arrays.stream(sorted).average().orElse(0.0d),
                TimingStatistics.median(sorted),
                nodes / sorted.length,
                speedupCount == 0 ? Double.NaN : speedupSum / speedupCount,
                savingCount == 0 ? Double.NaN : savingSum / savingCount
        );
    }

    private static String baselineKey(BenchmarkRecord record) {
        return record.getProfileName() + '#' + record.getPairIndex();
    }
}
