package org.accessroute.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.accessroute.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable campus path network.
 * <p>
 * Each undirected edge {@code e} is exposed to the search layer as two directed arcs:
 * {@code 2e} walks from-to and {@code 2e + 1} walks to-from. Arcs share the edge's length,
 * geometry and attributes; only direction-dependent attributes (incline) differ.
 * <p>
 * Layout:
 * - SoA node and edge arrays indexed by dense internal ids.
 * - CSR adjacency: arcs leaving node {@code n} are
 *   {@code outgoingArcAt(outgoingStart(n)) .. outgoingArcAt(outgoingEnd(n) - 1)}.
 * - Parallel edges between the same node pair are kept as independent edges.
 * <p>
 * Instances are built by {@link PathGraphBuilder} and are safe for concurrent reads.
 */
public final class PathGraph {
    private static final Coordinate[] NO_GEOMETRY = new Coordinate[0];

    // ========================================================================
    // NODE DATA
    // ========================================================================

    private final IDMapper nodeIds;
    private final double[] nodeLat;
    private final double[] nodeLon;

    // ========================================================================
    // EDGE DATA
    // ========================================================================

    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final double[] edgeLength;
    private final Coordinate[][] edgeGeometry;
    private final EdgeAttributes[] edgeAttributes;

    // CSR index: firstArc[node] -> start offset in adjacency
    private final int[] firstArc;
    private final int[] adjacency;

    @Getter
    @Accessors(fluent = true)
    private final int droppedNodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int droppedEdgeCount;

    PathGraph(
            IDMapper nodeIds,
            double[] nodeLat,
            double[] nodeLon,
            int[] edgeFrom,
            int[] edgeTo,
            double[] edgeLength,
            Coordinate[][] edgeGeometry,
            EdgeAttributes[] edgeAttributes,
            int droppedNodeCount,
            int droppedEdgeCount
    ) {
        this.nodeIds = nodeIds;
        this.nodeLat = nodeLat;
        this.nodeLon = nodeLon;
        this.edgeFrom = edgeFrom;
        this.edgeTo = edgeTo;
        this.edgeLength = edgeLength;
        this.edgeGeometry = edgeGeometry;
        this.edgeAttributes = edgeAttributes;
        this.droppedNodeCount = droppedNodeCount;
        this.droppedEdgeCount = droppedEdgeCount;

        int nodeCount = nodeLat.length;
        this.firstArc = new int[nodeCount + 1];
        for (int edge = 0; edge < edgeFrom.length; edge++) {
            firstArc[edgeFrom[edge] + 1]++;
            firstArc[edgeTo[edge] + 1]++;
        }
        for (int node = 0; node < nodeCount; node++) {
            firstArc[node + 1] += firstArc[node];
        }
        this.adjacency = new int[edgeFrom.length * 2];
        int[] cursor = new int[nodeCount];
        for (int edge = 0; edge < edgeFrom.length; edge++) {
            int from = edgeFrom[edge];
            int to = edgeTo[edge];
            adjacency[firstArc[from] + cursor[from]++] = forwardArc(edge);
            adjacency[firstArc[to] + cursor[to]++] = reverseArc(edge);
        }
    }

    // ========================================================================
    // SIZES & IDS
    // ========================================================================

    public int nodeCount() {
        return nodeLat.length;
    }

    public int edgeCount() {
        return edgeFrom.length;
    }

    public int arcCount() {
        return adjacency.length;
    }

    /**
     * @return external node id for an internal index.
     */
    public String nodeId(int node) {
        return nodeIds.toExternal(node);
    }

    /**
     * @return internal index for an external node id, or {@code -1} when unknown.
     */
    public int nodeIndex(String externalId) {
        if (!nodeIds.containsExternal(externalId)) {
            return -1;
        }
        return nodeIds.toInternal(externalId);
    }

    public boolean containsNode(int node) {
        return node >= 0 && node < nodeLat.length;
    }

    // ========================================================================
    // NODE ACCESS
    // ========================================================================

    public double nodeLat(int node) {
        return nodeLat[node];
    }

    public double nodeLon(int node) {
        return nodeLon[node];
    }

    public Coordinate nodeCoordinate(int node) {
        return new Coordinate(nodeLat[node], nodeLon[node]);
    }

    public int degree(int node) {
        return firstArc[node + 1] - firstArc[node];
    }

    // ========================================================================
    // ADJACENCY (allocation free)
    // ========================================================================

    public int outgoingStart(int node) {
        return firstArc[node];
    }

    public int outgoingEnd(int node) {
        return firstArc[node + 1];
    }

    public int outgoingArcAt(int index) {
        return adjacency[index];
    }

    // ========================================================================
    // EDGE & ARC ACCESS
    // ========================================================================

    public int edgeFrom(int edge) {
        return edgeFrom[edge];
    }

    public int edgeTo(int edge) {
        return edgeTo[edge];
    }

    public double edgeLength(int edge) {
        return edgeLength[edge];
    }

    public EdgeAttributes edgeAttributes(int edge) {
        return edgeAttributes[edge];
    }

    /**
     * @return intermediate geometry points in from-to order (endpoints excluded).
     */
    public List<Coordinate> edgeGeometry(int edge) {
        return List.of(edgeGeometry[edge]);
    }

    public static int forwardArc(int edge) {
        return edge << 1;
    }

    public static int reverseArc(int edge) {
        return (edge << 1) | 1;
    }

    public static int arcEdge(int arc) {
        return arc >>> 1;
    }

    public static boolean isReverseArc(int arc) {
        return (arc & 1) == 1;
    }

    /**
     * @return the arc walking the same edge in the opposite direction.
     */
    public static int twinArc(int arc) {
        return arc ^ 1;
    }

    public int arcOrigin(int arc) {
        int edge = arcEdge(arc);
        return isReverseArc(arc) ? edgeTo[edge] : edgeFrom[edge];
    }

    public int arcTarget(int arc) {
        int edge = arcEdge(arc);
        return isReverseArc(arc) ? edgeFrom[edge] : edgeTo[edge];
    }

    /**
     * Returns the full polyline of an arc in walking order, endpoints included.
     */
    public List<Coordinate> arcPolyline(int arc) {
        int edge = arcEdge(arc);
        Coordinate[] intermediate = edgeGeometry[edge];
        List<Coordinate> points = new ArrayList<>(intermediate.length + 2);
        points.add(nodeCoordinate(edgeFrom[edge]));
        Collections.addAll(points, intermediate);
        points.add(nodeCoordinate(edgeTo[edge]));
        if (isReverseArc(arc)) {
            Collections.reverse(points);
        }
        return points;
    }

    static Coordinate[] geometryArray(List<Coordinate> intermediate) {
        if (intermediate == null || intermediate.isEmpty()) {
            return NO_GEOMETRY;
        }
        return intermediate.toArray(NO_GEOMETRY);
    }
}
