package org.accessroute.benchmark;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timing Statistics Tests")
class TimingStatisticsTest {

    @Test
    @DisplayName("Mean, median, sample standard deviation and extremes")
    void testBasicStatistics() {
        TimingStatistics stats = TimingStatistics.of(new double[]{4.0d, 1.0d, 3.0d, 2.0d});

        assertEquals(4, stats.getSamples());
        assertEquals(2.5d, stats.getMeanMs(), 1e-12);
        assertEquals(2.5d, stats.getMedianMs(), 1e-12);
        assertEquals(Math.sqrt(5.0d / 3.0d), stats.getStdDevMs(), 1e-12);
        assertEquals(1.0d, stats.getMinMs(), 0.0d);
        assertEquals(4.0d, stats.getMaxMs(), 0.0d);
    }

    @Test
    @DisplayName("Percentiles fall back to the maximum for small samples")
    void testSmallSamplePercentiles() {
        TimingStatistics stats = TimingStatistics.of(new double[]{5.0d, 1.0d, 9.0d});

        assertEquals(5.0d, stats.getMedianMs(), 0.0d);
        assertEquals(9.0d, stats.getP95Ms(), 0.0d);
        assertEquals(9.0d, stats.getP99Ms(), 0.0d);
    }

    @Test
    @DisplayName("Exclusive-method percentiles once enough samples exist")
    void testInterpolatedPercentiles() {
        double[] twenty = sequence(20);
        TimingStatistics small = TimingStatistics.of(twenty);
        assertEquals(19.95d, small.getP95Ms(), 1e-9);
        assertEquals(20.0d, small.getP99Ms(), 0.0d);

        TimingStatistics large = TimingStatistics.of(sequence(100));
        assertEquals(95.95d, large.getP95Ms(), 1e-9);
        assertEquals(99.99d, large.getP99Ms(), 1e-9);
        assertEquals(50.5d, large.getMedianMs(), 1e-12);
    }

    @Test
    @DisplayName("Single sample has zero deviation; no samples gives the empty summary")
    void testDegenerateInputs() {
        TimingStatistics single = TimingStatistics.of(new double[]{0.7d});
        assertEquals(0.0d, single.getStdDevMs(), 0.0d);
        assertEquals(0.7d, single.getP99Ms(), 0.0d);

        assertSame(TimingStatistics.empty(), TimingStatistics.of(new double[0]));
        assertSame(TimingStatistics.empty(), TimingStatistics.of(null));
        assertEquals(0, TimingStatistics.empty().getSamples());
    }

    @Test
    @DisplayName("Input array is not reordered")
    void testInputUntouched() {
        double[] samples = {3.0d, 1.0d, 2.0d};
        TimingStatistics.of(samples);
        assertArrayEquals(new double[]{3.0d, 1.0d, 2.0d}, samples);
    }

    @Test
    @DisplayName("Distance categories split at 200 m and 500 m")
    void testDistanceCategory() {
        assertEquals(DistanceCategory.SHORT, DistanceCategory.of(0.0d));
        assertEquals(DistanceCategory.SHORT, DistanceCategory.of(199.99d));
        assertEquals(DistanceCategory.MEDIUM, DistanceCategory.of(200.0d));
        assertEquals(DistanceCategory.MEDIUM, DistanceCategory.of(499.99d));
        assertEquals(DistanceCategory.LONG, DistanceCategory.of(500.0d));
    }

    private static double[] sequence(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i + 1;
        }
        return values;
    }
}
