package org.accessroute.benchmark;

import com.csvreader.CsvWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes one CSV row per {@link BenchmarkRecord}. Fields holding the delimiter, quotes or
 * line breaks are quoted by javacsv.
 */
public final class BenchmarkCsvWriter {
    static final List<String> HEADER = List.of(
            "profile", "pair", "origin", "destination", "geometric_distance_m", "category", "algorithm", "status",
            "mean_ms", "median_ms", "stddev_ms", "min_ms", "max_ms", "p95_ms", "p99_ms",
            "nodes_explored", "route_distance_m", "route_points", "error"
    );

    public void write(BenchmarkRun run, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(run, writer);
        }
    }

    /**
     * Writes the header and all records. The writer is flushed, not closed.
     */
    public void write(BenchmarkRun run, Writer writer) throws IOException {
        CsvWriter csv = new CsvWriter(writer, ',');
        csv.writeRecord(HEADER.toArray(new String[0]));
        for (BenchmarkRecord record : run.getRecords()) {
            TimingStatistics timing = record.getTiming();
            csv.writeRecord(new String[]{
                    record.getProfileName(),
                    Integer.toString(record.getPairIndex()),
                    record.getOrigin(),
                    record.getDestination(),
                    format(record.getGeometricDistanceMeters(), 2),
                    record.getCategory().name(),
                    record.getAlgorithm().name(),
                    record.getStatus().name(),
                    format(timing.getMeanMs(), 4),
                    format(timing.getMedianMs(), 4),
                    format(timing.getStdDevMs(), 4),
                    format(timing.getMinMs(), 4),
                    format(timing.getMaxMs(), 4),
                    format(timing.getP95Ms(), 4),
                    format(timing.getP99Ms(), 4),
                    Integer.toString(record.getNodesExplored()),
                    format(record.getRouteDistanceMeters(), 2),
                    Integer.toString(record.getRoutePointCount()),
                    record.getError() == null ? "" : record.getError()
            });
        }
        csv.flush();
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
