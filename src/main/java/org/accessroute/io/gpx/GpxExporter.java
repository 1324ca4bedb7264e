package org.accessroute.io.gpx;

import org.accessroute.routing.graph.Coordinate;
import org.accessroute.routing.route.Route;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

/**
 * Writes routes as GPX 1.1 tracks: one {@code <trk>} with one {@code <trkseg>} holding every
 * route coordinate in walking order.
 */
public final class GpxExporter {
    public static final String DEFAULT_TRACK_NAME = "Campus route";

    private static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    private static final String GPX_SCHEMA = "http://www.topografix.com/GPX/1/1/gpx.xsd";

    private final String creator;

    public GpxExporter() {
        this("access-route");
    }

    public GpxExporter(String creator) {
        this.creator = creator;
    }

    public String toGpx(Route route) {
        return toGpx(route.getCoordinates(), DEFAULT_TRACK_NAME);
    }

    public String toGpx(Route route, String trackName) {
        return toGpx(route.getCoordinates(), trackName);
    }

    /**
     * @param points track points in order.
     * @param trackName track name, XML-escaped on output.
     */
    public String toGpx(List<Coordinate> points, String trackName) {
        // DecimalFormat is not thread-safe; one per export.
        DecimalFormat decimalFormat = new DecimalFormat("#", DecimalFormatSymbols.getInstance(Locale.ROOT));
        decimalFormat.setMinimumFractionDigits(1);
        decimalFormat.setMaximumFractionDigits(7);
        decimalFormat.setMinimumIntegerDigits(1);

        StringBuilder gpx = new StringBuilder(256 + points.size() * 48);
        gpx.append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\" ?>")
                .append("\n<gpx xmlns=\"").append(GPX_NAMESPACE).append('"')
                .append(" xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"")
                .append(" xsi:schemaLocation=\"").append(GPX_NAMESPACE).append(' ').append(GPX_SCHEMA).append('"')
                .append(" creator=\"").append(xmlEscape(creator)).append("\" version=\"1.1\">");
        gpx.append("\n<trk><name>").append(xmlEscape(trackName == null ? DEFAULT_TRACK_NAME : trackName)).append("</name>");
        gpx.append("<trkseg>");
        for (Coordinate point : points) {
            gpx.append("\n<trkpt lat=\"").append(decimalFormat.format(point.lat()))
                    .append("\" lon=\"").append(decimalFormat.format(point.lon())).append("\"></trkpt>");
        }
        gpx.append("\n</trkseg>");
        gpx.append("\n</trk>");
        gpx.append("\n</gpx>\n");
        return gpx.toString();
    }

    public void write(Route route, String trackName, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(toGpx(route, trackName));
        }
    }

    static String xmlEscape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
