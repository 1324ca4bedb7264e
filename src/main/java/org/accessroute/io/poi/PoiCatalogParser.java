package org.accessroute.io.poi;

import org.accessroute.routing.graph.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the UTF-8 POI catalog text format.
 *
 * <pre>
 * ---Blocks---
 * Block A: -3.7685, -38.4784
 * Block B: -3.7690, -38.4790
 *
 * ---Libraries---
 * Central Library: -3.7679, -38.4771
 * </pre>
 * Malformed lines are skipped and reported; they never abort the load.
 */
public final class PoiCatalogParser {
    private static final Logger logger = LoggerFactory.getLogger(PoiCatalogParser.class);

    private static final String SECTION_MARK = "---";

    /**
     * @throws PoiCatalogException when the file is missing or unreadable.
     */
    public PoiCatalog parse(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PoiCatalogException("POI catalog not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PoiCatalog catalog = parse(reader);
            logger.info("Loaded {} POIs in {} categories from {} ({} lines skipped)",
                    catalog.size(), catalog.categories().size(), path, catalog.skippedLines().size());
            return catalog;
        } catch (IOException e) {
            throw new PoiCatalogException("cannot read POI catalog " + path, e);
        }
    }

    public PoiCatalog parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        Map<String, List<PointOfInterest>> byCategory = new LinkedHashMap<>();
        List<SkippedLine> skipped = new ArrayList<>();
        String category = null;

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = stripBom(line).trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith(SECTION_MARK)) {
                String name = sectionName(trimmed);
                if (name.isEmpty()) {
                    skip(skipped, lineNumber, line, "empty section name");
                    continue;
                }
                category = name;
                byCategory.computeIfAbsent(category, key -> new ArrayList<>());
                continue;
            }
            if (category == null) {
                skip(skipped, lineNumber, line, "entry before any section header");
                continue;
            }
            int colon = trimmed.lastIndexOf(':');
            if (colon <= 0) {
                skip(skipped, lineNumber, line, "missing 'Name: lat, lon' separator");
                continue;
            }
            String name = trimmed.substring(0, colon).trim();
            String[] parts = trimmed.substring(colon + 1).split(",");
            if (name.isEmpty() || parts.length != 2) {
                skip(skipped, lineNumber, line, "expected 'Name: lat, lon'");
                continue;
            }
            Coordinate coordinate;
            try {
                coordinate = new Coordinate(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                skip(skipped, lineNumber, line, "non-numeric coordinate");
                continue;
            }
            if (!coordinate.isValid()) {
                skip(skipped, lineNumber, line, "coordinate out of range");
                continue;
            }
            byCategory.get(category).add(new PointOfInterest(category, name, coordinate));
        }
        return new PoiCatalog(byCategory, skipped);
    }

    private static String sectionName(String header) {
        String name = header.substring(SECTION_MARK.length());
        if (name.endsWith(SECTION_MARK)) {
            name = name.substring(0, name.length() - SECTION_MARK.length());
        }
        return name.trim();
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private static void skip(List<SkippedLine> skipped, int lineNumber, String text, String reason) {
        logger.warn("Skipping POI catalog line {}: {} ({})", lineNumber, text, reason);
        skipped.add(new SkippedLine(lineNumber, text, reason));
    }
}
