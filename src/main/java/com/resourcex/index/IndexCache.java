package com.resourcex.index;

/**
 * Scratch storage for built coordinate indexes, keyed by
 * {@link IndexCacheKeys}. Losing entries only costs rebuild time, so no
 * operation here throws.
 */
public interface IndexCache {

    CacheLookup load(String key);

    /**
     * @return true if the index was persisted
     */
    boolean store(String key, CoordinateIndex index);

    void invalidate(String key);
}
