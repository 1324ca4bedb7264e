package org.accessroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-query bounds for search work and frontier growth.
 *
 * <p>Non-positive bounds mean unbounded. {@link #defaults()} reads
 * {@code accessroute.search.maxSettledNodes} and {@code accessroute.search.maxFrontierSize};
 * absent or malformed values are unbounded.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_SETTLED_EXCEEDED = "SEARCH_BUDGET_SETTLED_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "SEARCH_BUDGET_FRONTIER_EXCEEDED";

    public static final String PROP_MAX_SETTLED = "accessroute.search.maxSettledNodes";
    public static final String PROP_MAX_FRONTIER = "accessroute.search.maxFrontierSize";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED, UNBOUNDED);

    private final int maxSettledNodes;
    private final int maxFrontierSize;

    private SearchBudget(int maxSettledNodes, int maxFrontierSize) {
        this.maxSettledNodes = normalizeBound(maxSettledNodes);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    public static SearchBudget of(int maxSettledNodes, int maxFrontierSize) {
        return new SearchBudget(maxSettledNodes, maxFrontierSize);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_SETTLED), readBound(PROP_MAX_FRONTIER));
    }

    void checkSettledNodes(int settledNodes) {
        if (settledNodes > maxSettledNodes) {
            throw new BudgetExceededException(
                    REASON_SETTLED_EXCEEDED,
                    "settled-node budget exceeded: " + settledNodes + " > " + maxSettledNodes
            );
        }
    }

    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxSettledNodes=" + maxSettledNodes + ", maxFrontierSize=" + maxFrontierSize + "}";
    }

    /**
     * Raised inside a strategy when a bound is hit; converted to
     * {@link SearchOutcome#BOUND_EXCEEDED} before it reaches callers.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
