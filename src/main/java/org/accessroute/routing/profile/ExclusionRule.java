package org.accessroute.routing.profile;

import org.accessroute.routing.graph.EdgeAttributes;
import org.accessroute.routing.graph.SurfaceClass;
import org.accessroute.routing.graph.WheelchairAccess;

/**
 * Closed set of hard exclusion predicates a profile can declare.
 *
 * <p>A matching rule makes the traversal impassable for the profile; exclusions are never
 * softened into penalties. Unknown attribute values never match.</p>
 */
public enum ExclusionRule {
    /** Steps present and no ramp alongside. */
    STEPS_WITHOUT_RAMP {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return attributes.isSteps() && !attributes.isRamp();
        }
    },
    /** Any steps, with or without ramp. */
    ANY_STEPS {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return attributes.isSteps();
        }
    },
    /** Wheelchair tag explicitly {@code no}. */
    WHEELCHAIR_NO {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return attributes.getWheelchair() == WheelchairAccess.NO;
        }
    },
    /** Known width in the {@link WidthBand#NARROW} band. */
    NARROW_PASSAGE {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return WidthBand.fromWidth(attributes.getWidthMeters()) == WidthBand.NARROW;
        }
    },
    /** Known incline in the {@link SlopeBand#STEEP} band, either direction. */
    STEEP_INCLINE {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return SlopeBand.fromIncline(attributes.directedInclinePercent(reverse)) == SlopeBand.STEEP;
        }
    },
    /** Unpaved surface. */
    UNPAVED_SURFACE {
        @Override
        public boolean matches(EdgeAttributes attributes, boolean reverse) {
            return attributes.getSurface() == SurfaceClass.UNPAVED;
        }
    };

    /**
     * @param attributes edge attributes.
     * @param reverse true when the edge is walked to-from.
     * @return true when this rule excludes the traversal.
     */
    public abstract boolean matches(EdgeAttributes attributes, boolean reverse);
}
