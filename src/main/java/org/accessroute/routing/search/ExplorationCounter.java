package org.accessroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Counts distinct nodes finalized by a search.
 *
 * <p>Strategies report a node exactly when its least cost becomes final. A node finalized
 * twice (both lanes of a bidirectional search) counts once. Not thread-safe: use one
 * counter per query.</p>
 */
public final class ExplorationCounter {
    private final IntOpenHashSet finalized = new IntOpenHashSet();

    /**
     * @return true when the node had not been recorded yet.
     */
    public boolean markFinalized(int node) {
        return finalized.add(node);
    }

    public boolean isFinalized(int node) {
        return finalized.contains(node);
    }

    public int count() {
        return finalized.size();
    }

    public void reset() {
        finalized.clear();
    }
}
