package com.resourcex.collection;

import com.resourcex.exception.InvalidInputException;
import com.resourcex.index.CoordinateIndexLoader;
import com.resourcex.index.IndexCache;
import com.resourcex.store.AbstractShardedStore;
import com.resourcex.store.MultiFileResourceStore;
import com.resourcex.store.MultiYearResourceStore;
import com.resourcex.store.ResourceStore;
import com.resourcex.store.ResourceStoreReader;
import com.resourcex.store.ShardPaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Opens resource paths as {@link ResourceCollection}s: picks the store
 * layout, opens every shard and hands the collection the shared index cache.
 */
public class CollectionComposer {

    private static final Logger logger = LoggerFactory.getLogger(CollectionComposer.class);

    private final IndexCache indexCache;
    private final List<ResourceStoreReader> readers;
    private final boolean validateShards;
    private final BundleExporter exporter = new BundleExporter();

    /**
     * @param indexCache     cache shared by every collection this composer opens
     * @param readers        file readers, tried in order
     * @param validateShards check that shards agree on their shared axis
     */
    public CollectionComposer(IndexCache indexCache, List<ResourceStoreReader> readers, boolean validateShards) {
        this.indexCache = indexCache;
        this.readers = List.copyOf(readers);
        this.validateShards = validateShards;
    }

    public ResourceCollection open(CollectionRequest request) throws IOException {
        if (request.getResourcePath() == null) {
            throw new InvalidInputException("resourcePath is required");
        }
        List<Path> files = ShardPaths.resolve(request.getResourcePath());
        String name = request.getName() != null ? request.getName() : request.getResourcePath();
        logger.info("Opening {} collection '{}' as {} from {} file(s)",
                request.getDomain(), name, request.getLayout(), files.size());

        List<ResourceStore> opened = new ArrayList<>();
        try {
            ResourceStore store;
            switch (request.getLayout()) {
                case SINGLE_FILE:
                    if (files.size() != 1) {
                        throw new InvalidInputException(request.getResourcePath()
                                + " matches " + files.size() + " files, a single-file collection needs one");
                    }
                    store = openFile(files.get(0), opened);
                    break;
                case MULTI_FILE:
                    for (Path file : files) {
                        openFile(file, opened);
                    }
                    store = new MultiFileResourceStore(opened, validateShards);
                    break;
                case MULTI_YEAR:
                    store = new MultiYearResourceStore(openYears(files, request.getYears(), opened), validateShards);
                    break;
                default:
                    throw new InvalidInputException("Unsupported layout: " + request.getLayout());
            }
            return compose(name, request.getDomain(), store);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to open collection '{}': {}", name, e.getMessage());
            try {
                AbstractShardedStore.closeAll(opened);
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Wrap an already opened store. The collection takes ownership of it.
     */
    public ResourceCollection compose(String name, ResourceDomain domain, ResourceStore store) {
        return new ResourceCollection(name, domain, store, new CoordinateIndexLoader(indexCache), exporter);
    }

    private SortedMap<Integer, ResourceStore> openYears(List<Path> files, List<Integer> years,
                                                        List<ResourceStore> opened) throws IOException {
        SortedMap<Integer, Path> byYear = new TreeMap<>();
        for (Path file : files) {
            OptionalInt year = ShardPaths.parseYear(file.getFileName().toString());
            if (year.isEmpty()) {
                throw new InvalidInputException("Cannot parse a year from " + file.getFileName());
            }
            Path previous = byYear.put(year.getAsInt(), file);
            if (previous != null) {
                throw new InvalidInputException("Two files for year " + year.getAsInt() + ": " + previous + ", " + file);
            }
        }

        if (years != null && !years.isEmpty()) {
            SortedMap<Integer, Path> selected = new TreeMap<>();
            for (Integer year : years) {
                Path file = byYear.get(year);
                if (file == null) {
                    throw new InvalidInputException("No file for year " + year + ", found " + byYear.keySet());
                }
                selected.put(year, file);
            }
            byYear = selected;
        }

        SortedMap<Integer, ResourceStore> stores = new TreeMap<>();
        for (var entry : byYear.entrySet()) {
            stores.put(entry.getKey(), openFile(entry.getValue(), opened));
        }
        return stores;
    }

    private ResourceStore openFile(Path file, List<ResourceStore> opened) throws IOException {
        ResourceStoreReader reader = readers.stream()
                .filter(r -> r.supports(file))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException("No reader for resource file: " + file));
        ResourceStore store = reader.open(file);
        opened.add(store);
        return store;
    }
}
