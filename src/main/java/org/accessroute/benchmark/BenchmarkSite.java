package org.accessroute.benchmark;

import org.accessroute.io.poi.PoiCatalog;
import org.accessroute.io.poi.PointOfInterest;
import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.graph.PathGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Named location benchmark pairs are sampled from.
 */
public record BenchmarkSite(String name, Coordinate coordinate) {

    public static List<BenchmarkSite> fromCatalog(PoiCatalog catalog) {
        List<BenchmarkSite> sites = new ArrayList<>();
        for (PointOfInterest poi : catalog.all()) {
            sites.add(new BenchmarkSite(poi.name(), poi.coordinate()));
        }
        return sites;
    }

    /**
     * Every graph node as a site, for runs without a POI catalog.
     */
    public static List<BenchmarkSite> fromGraphNodes(PathGraph graph) {
        List<BenchmarkSite> sites = new ArrayList<>(graph.nodeCount());
        for (int node = 0; node < graph.nodeCount(); node++) {
            sites.add(new BenchmarkSite(graph.nodeId(node), graph.nodeCoordinate(node)));
        }
        return sites;
    }
}
