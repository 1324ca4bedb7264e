package org.accessroute.routing.cost;

import lombok.Builder;
import lombok.Value;
import org.accessroute.routing.profile.ExclusionRule;
import org.accessroute.routing.profile.FactorTable;
import org.accessroute.routing.profile.SlopeBand;

/**
 * Immutable explainability payload for one traversal.
 * Factors are neutral when an exclusion rule short-circuits the computation.
 */
@Value
@Builder
public class CostBreakdown {
    String profileName;
    double lengthMeters;
    boolean reverse;
    /** Matching exclusion rule, {@code null} when passable. */
    ExclusionRule exclusion;
    @Builder.Default
    SlopeBand slopeBand = SlopeBand.UNKNOWN;
    @Builder.Default
    double surfaceFactor = FactorTable.NEUTRAL;
    @Builder.Default
    double slopeFactor = FactorTable.NEUTRAL;
    @Builder.Default
    double crossingFactor = FactorTable.NEUTRAL;
    @Builder.Default
    double widthFactor = FactorTable.NEUTRAL;
    @Builder.Default
    double accessFactor = FactorTable.NEUTRAL;
    @Builder.Default
    double stepsFactor = FactorTable.NEUTRAL;
    double cost;

    /**
     * Returns whether an exclusion rule forbids the traversal.
     */
    public boolean isExcluded() {
        return exclusion != null;
    }

    /**
     * Product of all factors; {@code cost == lengthMeters * combinedFactor()} when passable.
     */
    public double combinedFactor() {
        return surfaceFactor * slopeFactor * crossingFactor * widthFactor * accessFactor * stepsFactor;
    }
}
