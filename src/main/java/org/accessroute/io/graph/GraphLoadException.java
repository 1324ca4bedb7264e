package org.accessroute.io.graph;

import lombok.experimental.StandardException;

/**
 * Thrown when a path graph source is missing or cannot be parsed as a whole.
 * Individually invalid nodes and edges are dropped by the builder instead.
 */
@StandardException
public class GraphLoadException extends RuntimeException {
}
