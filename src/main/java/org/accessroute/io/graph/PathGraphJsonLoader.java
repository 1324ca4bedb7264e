package org.accessroute.io.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.graph.PathGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link PathGraph} from JSON.
 *
 * <pre>
 * {"nodes": [{"id": "n1", "lat": -3.768, "lon": -38.478}, ...],
 *  "edges": [{"from": "n1", "to": "n2", "length": 42.0,
 *             "geometry": [[lat, lon], ...], "tags": {"highway": "footway", ...}}, ...]}
 * </pre>
 * {@code length}, {@code geometry} and {@code tags} are optional. Node ids may be strings
 * or numbers. Structural problems in single entries are logged and the entry skipped;
 * an unreadable document fails the whole load.
 */
public final class PathGraphJsonLoader {
    private static final Logger logger = LoggerFactory.getLogger(PathGraphJsonLoader.class);

    private final ObjectMapper mapper;

    public PathGraphJsonLoader() {
        this(new ObjectMapper());
    }

    public PathGraphJsonLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws GraphLoadException when the file is missing or not a graph document.
     */
    public PathGraph load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new GraphLoadException("graph file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            PathGraph graph = load(in);
            logger.info("Loaded path graph from {}", path);
            return graph;
        } catch (IOException e) {
            throw new GraphLoadException("cannot read graph file " + path, e);
        }
    }

    public PathGraph load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new GraphLoadException("graph document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("nodes").isArray()) {
            throw new GraphLoadException("graph document must contain a 'nodes' array");
        }

        PathGraphBuilder builder = new PathGraphBuilder();
        for (JsonNode node : root.get("nodes")) {
            JsonNode lat = node.get("lat");
            JsonNode lon = node.get("lon");
            // non-numeric coordinates go through as NaN so the builder drops and counts the node
            builder.addNode(idText(node.get("id")), coordinate(lat), coordinate(lon));
        }

        JsonNode edges = root.path("edges");
        if (edges.isArray()) {
            for (JsonNode edge : edges) {
                addEdge(builder, edge);
            }
        }
        return builder.build();
    }

    private static double coordinate(JsonNode value) {
        return value != null && value.isNumber() ? value.asDouble() : Double.NaN;
    }

    private static void addEdge(PathGraphBuilder builder, JsonNode edge) {
        String from = idText(edge.get("from"));
        String to = idText(edge.get("to"));
        JsonNode length = edge.get("length");
        Double explicitLength = length != null && length.isNumber() ? length.asDouble() : null;

        List<Coordinate> geometry = new ArrayList<>();
        JsonNode points = edge.path("geometry");
        if (points.isArray()) {
            for (JsonNode point : points) {
                if (!point.isArray() || point.size() < 2 || !point.get(0).isNumber() || !point.get(1).isNumber()) {
                    // Dropped by the builder as invalid geometry.
                    geometry.add(new Coordinate(Double.NaN, Double.NaN));
                    continue;
                }
                geometry.add(new Coordinate(point.get(0).asDouble(), point.get(1).asDouble()));
            }
        }
        builder.addEdge(from, to, explicitLength, geometry, EdgeAttributes.fromTags(tags(edge.get("tags"))));
    }

    private static Map<String, String> tags(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, String> tags = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                tags.put(field.getKey(), field.getValue().asText());
            }
        }
        return tags;
    }

    private static String idText(JsonNode id) {
        if (id == null || id.isNull()) {
            return null;
        }
        return id.asText();
    }
}
