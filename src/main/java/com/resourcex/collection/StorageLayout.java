package com.resourcex.collection;

import com.resourcex.store.MultiFileResourceStore;
import com.resourcex.store.MultiYearResourceStore;
import com.resourcex.store.ResourceStore;

/**
 * How a collection is laid out on disk.
 */
public enum StorageLayout {
    /** One file holds every site and time step. */
    SINGLE_FILE,
    /** Several files over the same time axis, each holding a block of sites. */
    MULTI_FILE,
    /** One file per year over the same sites. */
    MULTI_YEAR;

    public static StorageLayout of(ResourceStore store) {
        if (store instanceof MultiYearResourceStore) {
            return MULTI_YEAR;
        }
        if (store instanceof MultiFileResourceStore) {
            return MULTI_FILE;
        }
        return SINGLE_FILE;
    }
}
