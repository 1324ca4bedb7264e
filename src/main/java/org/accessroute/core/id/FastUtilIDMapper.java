package org.accessroute.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * fastutil-backed {@link IDMapper}.
 *
 * <p>Internal indices follow the order of the id list given at construction, so the
 * path graph can keep node arrays and the mapper aligned without a second pass.
 * Immutable and safe for concurrent reads.</p>
 */
public final class FastUtilIDMapper implements IDMapper {
    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * @param orderedExternalIds distinct, non-blank ids; index {@code i} maps to internal id {@code i}.
     */
    public FastUtilIDMapper(List<String> orderedExternalIds) {
        if (orderedExternalIds == null) {
            throw new IllegalArgumentException("orderedExternalIds cannot be null");
        }
        int size = orderedExternalIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String externalId = orderedExternalIds.get(i);
            if (externalId == null || externalId.isBlank()) {
                throw new IllegalArgumentException("external id at position " + i + " must be non-blank");
            }
            int previous = forward.put(externalId, i);
            if (previous != MISSING) {
                throw new IllegalArgumentException(
                        "duplicate external id '" + externalId + "' at positions " + previous + " and " + i
                );
            }
            reverse[i] = externalId;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
