package org.accessroute.io.poi;

import org.accessroute.routing.graph.Coordinate;

/**
 * Named campus location.
 *
 * @param category section the entry was listed under.
 * @param name display name, may contain accented characters.
 * @param coordinate WGS-84 position.
 */
public record PointOfInterest(String category, String name, Coordinate coordinate) {
}
