package org.accessroute.routing.search;

/**
 * Priority-queue entry. Ties on priority are broken by insertion sequence.
 */
record FrontierEntry(
        int node,
        double cost,
        double priority,
        long sequence
) implements Comparable<FrontierEntry> {
    @Override
    public int compareTo(FrontierEntry other) {
        int byPriority = Double.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
