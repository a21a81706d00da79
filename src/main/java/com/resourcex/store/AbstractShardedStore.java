package com.resourcex.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Common plumbing for stores stitched together from several shards.
 */
public abstract class AbstractShardedStore implements ResourceStore {

    private static final Logger logger = LoggerFactory.getLogger(AbstractShardedStore.class);

    protected final List<ResourceStore> shards;
    private final String sourceName;
    private final Set<String> datasets;
    private boolean closed;

    protected AbstractShardedStore(List<ResourceStore> shards) {
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("At least one shard is required");
        }
        this.shards = Collections.unmodifiableList(new ArrayList<>(shards));
        this.sourceName = shards.get(0).getSourceName();

        // only datasets every shard can serve
        Set<String> common = new LinkedHashSet<>(shards.get(0).getDatasets());
        for (ResourceStore shard : shards.subList(1, shards.size())) {
            common.retainAll(shard.getDatasets());
        }
        this.datasets = Collections.unmodifiableSet(common);
    }

    /**
     * The first shard's name; shards following the naming convention share
     * their cache key prefix.
     */
    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public Set<String> getDatasets() {
        ensureOpen();
        return datasets;
    }

    public List<ResourceStore> getShards() {
        return shards;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeAll(shards);
    }

    protected void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed: " + sourceName);
        }
    }

    /**
     * Close every store, attempting all of them even if some fail. The first
     * failure is rethrown with the others attached as suppressed.
     */
    public static void closeAll(List<? extends ResourceStore> stores) {
        RuntimeException failure = null;
        for (ResourceStore store : stores) {
            try {
                store.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close store {}: {}", store.getSourceName(), e.getMessage());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
