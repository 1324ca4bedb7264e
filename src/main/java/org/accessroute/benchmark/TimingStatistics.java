package org.accessroute.benchmark;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;

/**
 * Summary of repeated timing samples, in milliseconds.
 *
 * <p>Percentiles use the exclusive interpolation method and fall back to the maximum when
 * there are too few samples to resolve them (20 for p95, 100 for p99).</p>
 */
@Value
@Builder
public class TimingStatistics {
    private static final TimingStatistics EMPTY = TimingStatistics.builder().build();

    int samples;
    double meanMs;
    double medianMs;
    double stdDevMs;
    double minMs;
    double maxMs;
    double p95Ms;
    double p99Ms;

    public static TimingStatistics empty() {
        return EMPTY;
    }

    public static TimingStatistics of(double[] samplesMs) {
        if (samplesMs == null || samplesMs.length == 0) {
            return EMPTY;
        }
        double[] sorted = samplesMs.clone();
        Arrays.sort(sorted);
        int n = sorted.length;

        double sum = 0.0d;
        for (double sample : sorted) {
            sum += sample;
        }
        double mean = sum / n;
        double squares = 0.0d;
        for (double sample : sorted) {
            squares += (sample - mean) * (sample - mean);
        }
        double stdDev = n > 1 ? Math.sqrt(squares / (n - 1)) : 0.0d;

        return TimingStatistics.builder()
                .samples(n)
                .meanMs(mean)
                .medianMs(median(sorted))
                .stdDevMs(stdDev)
                .minMs(sorted[0])
                .maxMs(sorted[n - 1])
                .p95Ms(n >= 20 ? quantile(sorted, 0.95d) : sorted[n - 1])
                .p99Ms(n >= 100 ? quantile(sorted, 0.99d) : sorted[n - 1])
                .build();
    }

    static double median(double[] sorted) {
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0d;
    }

    /**
     * Exclusive-method quantile: 1-based position {@code q * (n + 1)}, linearly interpolated.
     */
    static double quantile(double[] sorted, double q) {
        int n = sorted.length;
        double position = q * (n + 1);
        if (position <= 1.0d) {
            return sorted[0];
        }
        if (position >= n) {
            return sorted[n - 1];
        }
        int lower = (int) Math.floor(position);
        double fraction = position - lower;
        return sorted[lower - 1] + fraction * (sorted[lower] - sorted[lower - 1]);
    }
}
