package org.accessroute.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.accessroute.routing.search.SearchAlgorithm;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a benchmark run as one JSON document: {@code metadata} plus {@code records}.
 */
public final class BenchmarkJsonWriter {
    private final ObjectMapper mapper;

    public BenchmarkJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public BenchmarkJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(BenchmarkRun run, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            mapper.writeValue(out, toJson(run));
        }
    }

    public ObjectNode toJson(BenchmarkRun run) {
        ObjectNode root = mapper.createObjectNode();
        BenchmarkConfig config = run.getConfig();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("started_at", run.getStartedAt().toString());
        metadata.put("seed", config.getSeed());
        metadata.put("pair_count", config.getPairCount());
        metadata.put("repetitions", config.getRepetitions());
        metadata.put("warmup_repetitions", config.getWarmupRepetitions());
        metadata.put("tested_pairs", run.getTestedPairs());
        metadata.put("discarded_pairs", run.getDiscardedPairs());
        ArrayNode profiles = metadata.putArray("profiles");
        config.effectiveProfileNames().forEach(profiles::add);
        ArrayNode algorithms = metadata.putArray("algorithms");
        for (SearchAlgorithm algorithm : config.effectiveAlgorithms()) {
            algorithms.add(algorithm.name());
        }

        ArrayNode records = root.putArray("records");
        for (BenchmarkRecord record : run.getRecords()) {
            ObjectNode node = records.addObject();
            node.put("profile", record.getProfileName());
            node.put("pair", record.getPairIndex());
            node.put("origin", record.getOrigin());
            node.put("destination", record.getDestination());
            node.put("geometric_distance_m", record.getGeometricDistanceMeters());
            node.put("category", record.getCategory().name());
            node.put("algorithm", record.getAlgorithm().name());
            node.put("status", record.getStatus().name());
            TimingStatistics timing = record.getTiming();
            ObjectNode timingNode = node.putObject("timing_ms");
            timingNode.put("samples", timing.getSamples());
            timingNode.put("mean", timing.getMeanMs());
            timingNode.put("median", timing.getMedianMs());
            timingNode.put("stddev", timing.getStdDevMs());
            timingNode.put("min", timing.getMinMs());
            timingNode.put("max", timing.getMaxMs());
            timingNode.put("p95", timing.getP95Ms());
            timingNode.put("p99", timing.getP99Ms());
            node.put("nodes_explored", record.getNodesExplored());
            node.put("route_distance_m", record.getRouteDistanceMeters());
            node.put("route_points", record.getRoutePointCount());
            if (record.getError() != null) {
                node.put("error", record.getError());
            } else {
                node.putNull("error");
            }
        }
        return root;
    }
}
