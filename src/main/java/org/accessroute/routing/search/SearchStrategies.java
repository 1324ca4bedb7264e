package org.accessroute.routing.search;

import lombok.experimental.UtilityClass;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps {@link SearchAlgorithm} values to strategy instances.
 */
@UtilityClass
public class SearchStrategies {

    /**
     * Creates a strategy with budgets read from system properties.
     */
    public static SearchStrategy create(SearchAlgorithm algorithm) {
        return create(algorithm, SearchBudget.defaults());
    }

    public static SearchStrategy create(SearchAlgorithm algorithm, SearchBudget budget) {
        Objects.requireNonNull(algorithm, "algorithm");
        return switch (algorithm) {
            case DIJKSTRA -> new DijkstraStrategy(budget);
            case BIDIRECTIONAL_DIJKSTRA -> new BidirectionalDijkstraStrategy(budget);
            case A_STAR -> new AStarStrategy(budget);
        };
    }

    /**
     * @return one strategy per algorithm, in declaration order.
     */
    public static Map<SearchAlgorithm, SearchStrategy> all(SearchBudget budget) {
        EnumMap<SearchAlgorithm, SearchStrategy> strategies = new EnumMap<>(SearchAlgorithm.class);
        for (SearchAlgorithm algorithm : SearchAlgorithm.values()) {
            strategies.put(algorithm, create(algorithm, budget));
        }
        return strategies;
    }
}
