package org.accessroute.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping contract between external node ids (as found in the source
 * geodata) and dense internal node indices used by the search layer.
 */
public interface IDMapper {

    /**
     * Converts an external id to its internal index.
     *
     * @param externalId client-facing id.
     * @return internal index in {@code [0, size)}.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external id.
     *
     * @param internalId internal index.
     * @return client-facing id.
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * @param externalId external id to test.
     * @return true when the id has an internal index.
     */
    boolean containsExternal(String externalId);

    /**
     * @param internalId internal index to test.
     * @return true when the index is within mapper bounds.
     */
    boolean containsInternal(int internalId);

    /**
     * @return number of mapped ids.
     */
    int size();

    /**
     * Thrown when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates an immutable mapper that assigns internal indices in list order.
     *
     * @param orderedExternalIds distinct, non-blank external ids.
     * @return immutable mapper where {@code toInternal(orderedExternalIds.get(i)) == i}.
     */
    static IDMapper fromOrderedIds(List<String> orderedExternalIds) {
        return new FastUtilIDMapper(orderedExternalIds);
    }
}
