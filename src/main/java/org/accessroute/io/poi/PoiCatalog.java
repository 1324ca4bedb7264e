package org.accessroute.io.poi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable POI catalog grouped by category, in file order.
 */
public final class PoiCatalog {
    private static final PoiCatalog EMPTY = new PoiCatalog(Map.of(), List.of());

    private final Map<String, List<PointOfInterest>> byCategory;
    private final List<SkippedLine> skippedLines;

    PoiCatalog(Map<String, List<PointOfInterest>> byCategory, List<SkippedLine> skippedLines) {
        LinkedHashMap<String, List<PointOfInterest>> copy = new LinkedHashMap<>();
        byCategory.forEach((category, entries) -> copy.put(category, List.copyOf(entries)));
        this.byCategory = Collections.unmodifiableMap(copy);
        this.skippedLines = List.copyOf(skippedLines);
    }

    /**
     * Catalog used when the application runs without POIs.
     */
    public static PoiCatalog empty() {
        return EMPTY;
    }

    public Set<String> categories() {
        return byCategory.keySet();
    }

    /**
     * @return entries of one category, empty when the category is unknown.
     */
    public List<PointOfInterest> category(String category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public List<PointOfInterest> all() {
        List<PointOfInterest> all = new ArrayList<>();
        byCategory.values().forEach(all::addAll);
        return all;
    }

    /**
     * Case-insensitive lookup by name; the first entry in file order wins.
     *
     * @return matching entry or {@code null}.
     */
    public PointOfInterest find(String name) {
        if (name == null) {
            return null;
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (List<PointOfInterest> entries : byCategory.values()) {
            for (PointOfInterest poi : entries) {
                if (poi.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return poi;
                }
            }
        }
        return null;
    }

    public List<SkippedLine> skippedLines() {
        return skippedLines;
    }

    public int size() {
        int size = 0;
        for (List<PointOfInterest> entries : byCategory.values()) {
            size += entries.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
