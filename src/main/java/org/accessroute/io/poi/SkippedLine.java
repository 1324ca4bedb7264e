package org.accessroute.io.poi;

/**
 * Catalog line the parser could not use.
 *
 * @param lineNumber 1-based line number.
 * @param text raw line content.
 * @param reason human-readable cause.
 */
public record SkippedLine(int lineNumber, String text, String reason) {
}
