package org.accessroute.routing.cost;

import lombok.experimental.UtilityClass;
import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.PathGraph;
import org.accessroute.routing.profile.ExclusionRule;
import org.accessroute.routing.profile.FactorTable;
import org.accessroute.routing.profile.MobilityProfile;
import org.accessroute.routing.profile.SlopeBand;
import org.accessroute.routing.profile.WidthBand;

import java.util.Objects;

/**
 * Profile-specific traversal cost composition.
 * <p>
 * Canonical traversal cost:
 * </p>
 * <pre>
 * cost = +INF                                  if any exclusion rule matches
 * cost = length * f_surface * f_slope(direction) * f_crossing * f_width * f_access * f_steps
 * f_steps = profile.stepsFactor when steps are present without a ramp, else 1.0
 * </pre>
 * <p>
 * Cost units are effort-meters: a traversal with every factor neutral costs its length.
 * </p>
 */
@UtilityClass
public class EdgeWeightCalculator {

    /**
     * Sentinel cost for traversals a profile must never use.
     */
    public static final double IMPASSABLE = Double.POSITIVE_INFINITY;

    /**
     * Weighs one arc of a path graph.
     */
    public static double weigh(PathGraph graph, int arc, MobilityProfile profile) {
        int edge = PathGraph.arcEdge(arc);
        return weigh(graph.edgeLength(edge), graph.edgeAttributes(edge), PathGraph.isReverseArc(arc), profile);
    }

    /**
     * Fast-path scalar cost computation without breakdown allocation.
     *
     * @param lengthMeters physical length, must be finite and {@code > 0}.
     * @param attributes edge attributes.
     * @param reverse true when the edge is walked to-from.
     * @param profile mobility profile.
     * @return positive finite cost or {@link #IMPASSABLE}.
     */
    public static double weigh(double lengthMeters, EdgeAttributes attributes, boolean reverse, MobilityProfile profile) {
        return computeInternal(lengthMeters, attributes, reverse, profile, null);
    }

    /**
     * Explainable cost computation. Intended for debugging and route inspection.
     */
    public static CostBreakdown explain(double lengthMeters, EdgeAttributes attributes, boolean reverse, MobilityProfile profile) {
        CostBreakdown.CostBreakdownBuilder out = CostBreakdown.builder();
        computeInternal(lengthMeters, attributes, reverse, profile, out);
        return out.build();
    }

    /**
     * Explains one arc of a path graph.
     */
    public static CostBreakdown explain(PathGraph graph, int arc, MobilityProfile profile) {
        int edge = PathGraph.arcEdge(arc);
        return explain(graph.edgeLength(edge), graph.edgeAttributes(edge), PathGraph.isReverseArc(arc), profile);
    }

    /**
     * Time multiplier for a traversal: the surface and directed slope effort factors.
     */
    public static double timeFactor(EdgeAttributes attributes, boolean reverse, MobilityProfile profile) {
        return profile.surfaceFactors().factor(attributes.getSurface())
                * profile.slopeFactor(attributes.directedInclinePercent(reverse));
    }

    /**
     * Shared execution path for both scalar and explainable requests.
     */
    private static double computeInternal(
            double lengthMeters,
            EdgeAttributes attributes,
            boolean reverse,
            MobilityProfile profile,
            CostBreakdown.CostBreakdownBuilder out
    ) {
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(profile, "profile");
        if (!Double.isFinite(lengthMeters) || lengthMeters <= 0.0d) {
            throw new IllegalArgumentException("lengthMeters must be finite and > 0, got " + lengthMeters);
        }
        if (out != null) {
            out.lengthMeters(lengthMeters).reverse(reverse).profileName(profile.name());
        }

        ExclusionRule exclusion = profile.matchingExclusion(attributes, reverse);
        if (exclusion != null) {
            if (out != null) {
                out.exclusion(exclusion).cost(IMPASSABLE);
            }
            return IMPASSABLE;
        }

        Double directedIncline = attributes.directedInclinePercent(reverse);
        double surface = profile.surfaceFactors().factor(attributes.getSurface());
        double slope = profile.slopeFactor(directedIncline);
        double crossing = profile.crossingFactors().factor(attributes.getCrossing());
        double width = profile.widthFactors().factor(WidthBand.fromWidth(attributes.getWidthMeters()));
        double access = profile.accessFactors().factor(attributes.getWheelchair());
        double steps = attributes.isSteps() && !attributes.isRamp() ? profile.stepsFactor() : FactorTable.NEUTRAL;

        double cost = lengthMeters * surface * slope * crossing * width * access * steps;
        if (!Double.isFinite(cost)) {
            cost = IMPASSABLE;
        }

        if (out != null) {
            out.slopeBand(SlopeBand.fromIncline(directedIncline))
                    .surfaceFactor(surface)
                    .slopeFactor(slope)
                    .crossingFactor(crossing)
                    .widthFactor(width)
                    .accessFactor(access)
                    .stepsFactor(steps)
                    .cost(cost);
        }
        return cost;
    }

    /**
     * Returns true when the cost denotes a usable traversal.
     */
    public static boolean isPassable(double cost) {
        return cost != IMPASSABLE;
    }
}
