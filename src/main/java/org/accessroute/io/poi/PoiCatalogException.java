package org.accessroute.io.poi;

import lombok.experimental.StandardException;

/**
 * Thrown when a POI catalog source cannot be read at all.
 */
@StandardException
public class PoiCatalogException extends RuntimeException {
}
