package org.accessroute.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.accessroute.core.id.IDMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects raw nodes and edges and produces an immutable {@link PathGraph}.
 *
 * <p>Data-integrity violations never abort the build: a node with invalid coordinates or a
 * duplicate id is skipped, an edge with a dangling endpoint or a non-positive length is
 * dropped. Both are logged and counted on the resulting graph.</p>
 */
public final class PathGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PathGraphBuilder.class);

    private final List<String> nodeIds = new ArrayList<>();
    private final Object2IntOpenHashMap<String> nodeIndex = new Object2IntOpenHashMap<>();
    private final List<Coordinate> nodeCoordinates = new ArrayList<>();
    private final List<RawEdge> rawEdges = new ArrayList<>();
    private int droppedNodeCount;

    private record RawEdge(
            String fromId,
            String toId,
            Double explicitLengthMeters,
            List<Coordinate> geometry,
            EdgeAttributes attributes
    ) {
    }

    public PathGraphBuilder() {
        nodeIndex.defaultReturnValue(-1);
    }

    /**
     * Adds one node. Invalid coordinates and duplicate ids are skipped with a warning.
     */
    public PathGraphBuilder addNode(String id, double lat, double lon) {
        if (id == null || id.isBlank()) {
            logger.warn("Skipping node with blank id at ({}, {})", lat, lon);
            droppedNodeCount++;
            return this;
        }
        if (!Coordinate.isValid(lat, lon)) {
            logger.warn("Skipping node {}: coordinate ({}, {}) missing or outside WGS-84 bounds", id, lat, lon);
            droppedNodeCount++;
            return this;
        }
        if (nodeIndex.containsKey(id)) {
            logger.warn("Skipping duplicate node id {}", id);
            droppedNodeCount++;
            return this;
        }
        nodeIndex.put(id, nodeIds.size());
        nodeIds.add(id);
        nodeCoordinates.add(new Coordinate(lat, lon));
        return this;
    }

    /**
     * Adds an edge without intermediate geometry or explicit length.
     */
    public PathGraphBuilder addEdge(String fromId, String toId, EdgeAttributes attributes) {
        return addEdge(fromId, toId, null, List.of(), attributes);
    }

    /**
     * Adds an edge with an explicit length and no intermediate geometry.
     */
    public PathGraphBuilder addEdge(String fromId, String toId, double lengthMeters, EdgeAttributes attributes) {
        return addEdge(fromId, toId, lengthMeters, List.of(), attributes);
    }

    /**
     * Adds one undirected edge. Validation is deferred to {@link #build()} so edges may
     * be added before their endpoint nodes.
     *
     * @param explicitLengthMeters source-provided length, {@code null} to derive from geometry.
     * @param geometry intermediate points in from-to order, endpoints excluded.
     * @param attributes parsed attributes, {@code null} for neutral.
     */
    public PathGraphBuilder addEdge(
            String fromId,
            String toId,
            Double explicitLengthMeters,
            List<Coordinate> geometry,
            EdgeAttributes attributes
    ) {
        rawEdges.add(new RawEdge(
                fromId,
                toId,
                explicitLengthMeters,
                geometry == null ? List.of() : List.copyOf(geometry),
                attributes == null ? EdgeAttributes.neutral() : attributes
        ));
        return this;
    }

    /**
     * Validates pending edges and builds the immutable graph.
     */
    public PathGraph build() {
        int nodeCount = nodeIds.size();
        double[] lat = new double[nodeCount];
        double[] lon = new double[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            lat[i] = nodeCoordinates.get(i).lat();
            lon[i] = nodeCoordinates.get(i).lon();
        }

        IntArrayList keptFrom = new IntArrayList(rawEdges.size());
        IntArrayList keptTo = new IntArrayList(rawEdges.size());
        DoubleArrayList keptLength = new DoubleArrayList(rawEdges.size());
        List<RawEdge> kept = new ArrayList<>(rawEdges.size());
        int droppedEdgeCount = 0;

        for (int i = 0; i < rawEdges.size(); i++) {
            RawEdge raw = rawEdges.get(i);
            int from = nodeIndex.getInt(raw.fromId());
            int to = nodeIndex.getInt(raw.toId());
            if (from < 0 || to < 0) {
                logger.warn("Dropping edge #{} {} -> {}: dangling endpoint", i, raw.fromId(), raw.toId());
                droppedEdgeCount++;
                continue;
            }
            if (!allFinite(raw.geometry())) {
                logger.warn("Dropping edge #{} {} -> {}: invalid geometry point", i, raw.fromId(), raw.toId());
                droppedEdgeCount++;
                continue;
            }
            double length = resolveLength(raw, nodeCoordinates.get(from), nodeCoordinates.get(to));
            if (!(length > 0.0d) || !Double.isFinite(length)) {
                logger.warn("Dropping edge #{} {} -> {}: non-positive length {}", i, raw.fromId(), raw.toId(), length);
                droppedEdgeCount++;
                continue;
            }
            keptFrom.add(from);
            keptTo.add(to);
            keptLength.add(length);
            kept.add(raw);
        }

        int edgeCount = kept.size();
        int[] edgeFrom = keptFrom.toIntArray();
        int[] edgeTo = keptTo.toIntArray();
        double[] edgeLength = keptLength.toDoubleArray();
        Coordinate[][] geometry = new Coordinate[edgeCount][];
        EdgeAttributes[] attributes = new EdgeAttributes[edgeCount];
        for (int e = 0; e < edgeCount; e++) {
            geometry[e] = PathGraph.geometryArray(kept.get(e).geometry());
            attributes[e] = kept.get(e).attributes();
        }

        if (droppedEdgeCount > 0 || droppedNodeCount > 0) {
            logger.warn("Path graph built with {} dropped nodes and {} dropped edges", droppedNodeCount, droppedEdgeCount);
        }
        logger.info("Path graph built: {} nodes, {} edges", nodeCount, edgeCount);

        return new PathGraph(
                IDMapper.fromOrderedIds(nodeIds),
                lat,
                lon,
                edgeFrom,
                edgeTo,
                edgeLength,
                geometry,
                attributes,
                droppedNodeCount,
                droppedEdgeCount
        );
    }

    /**
     * Uses the source length when it is at least the endpoint chord, otherwise the polyline
     * length. Edge lengths below the chord would let the great-circle heuristic overestimate.
     */
    private static double resolveLength(RawEdge raw, Coordinate from, Coordinate to) {
        List<Coordinate> polyline = new ArrayList<>(raw.geometry().size() + 2);
        polyline.add(from);
        polyline.addAll(raw.geometry());
        polyline.add(to);
        double polylineLength = GeoDistance.polylineMeters(polyline);

        Double explicit = raw.explicitLengthMeters();
        if (explicit != null && Double.isFinite(explicit) && explicit > 0.0d) {
            double chord = GeoDistance.greatCircleMeters(from, to);
            if (explicit >= chord) {
                return explicit;
            }
            logger.debug("Edge {} -> {}: explicit length {} below chord {}, using geometry",
                    raw.fromId(), raw.toId(), explicit, chord);
        }
        return polylineLength;
    }

    private static boolean allFinite(List<Coordinate> points) {
        for (Coordinate point : points) {
            if (point == null || !point.isValid()) {
                return false;
            }
        }
        return true;
    }
}
