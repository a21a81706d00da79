package com.resourcex.service.impl;

import com.resourcex.aspect.Timed;
import com.resourcex.collection.CollectionComposer;
import com.resourcex.collection.ResourceCollection;
import com.resourcex.config.ResourceXProperties;
import com.resourcex.exception.CollectionNotFoundException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.model.SeriesTable;
import com.resourcex.model.SiteRecord;
import com.resourcex.model.SpatialMap;
import com.resourcex.model.TimeSeries;
import com.resourcex.model.param.ExportBundleParam;
import com.resourcex.model.param.OpenCollectionParam;
import com.resourcex.model.result.CollectionResult;
import com.resourcex.service.ResourceService;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps open collections by name. A collection is not thread-safe, so every
 * query holds the collection's monitor while it runs.
 */
@Service
public class ResourceServiceImpl implements ResourceService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceServiceImpl.class);

    private final Map<String, ResourceCollection> collections = new ConcurrentHashMap<>();

    @Autowired
    private CollectionComposer composer;

    @Autowired
    private ResourceXProperties properties;

    @Override
    @Timed(value = "open collection", logLevel = Timed.LogLevel.INFO, slowMillis = 10_000)
    public CollectionResult open(OpenCollectionParam param) {
        if (collections.containsKey(param.getName())) {
            throw new InvalidInputException("Collection already open: " + param.getName());
        }
        ResourceCollection collection;
        try {
            collection = composer.open(param.toRequest());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open " + param.getResourcePath(), e);
        }
        ResourceCollection previous = collections.putIfAbsent(param.getName(), collection);
        if (previous != null) {
            collection.close();
            throw new InvalidInputException("Collection already open: " + param.getName());
        }
        logger.info("Opened collection '{}' from {}", param.getName(), param.getResourcePath());
        return withCollection(param.getName(), CollectionResult::of);
    }

    @Override
    public List<CollectionResult> list() {
        List<String> names = new ArrayList<>(collections.keySet());
        Collections.sort(names);
        List<CollectionResult> results = new ArrayList<>(names.size());
        for (String name : names) {
            ResourceCollection collection = collections.get(name);
            if (collection != null) {
                synchronized (collection) {
                    if (!collection.isClosed()) {
                        results.add(CollectionResult.of(collection));
                    }
                }
            }
        }
        return results;
    }

    @Override
    public CollectionResult describe(String name) {
        return withCollection(name, CollectionResult::of);
    }

    @Override
    @Timed("close collection")
    public boolean close(String name) {
        ResourceCollection collection = collections.remove(name);
        if (collection == null) {
            return false;
        }
        synchronized (collection) {
            collection.close();
        }
        return true;
    }

    @Override
    @Timed("nearest site")
    public SiteRecord nearestSite(String name, double lat, double lon) {
        return withCollection(name, c -> c.getSiteTable().record(c.nearestSite(lat, lon)));
    }

    @Override
    @Timed("nearest sites")
    public List<SiteRecord> nearestSites(String name, double[][] coordinates) {
        return withCollection(name, c -> Arrays.stream(c.nearestSites(coordinates))
                .mapToObj(gid -> c.getSiteTable().record(gid))
                .collect(Collectors.toList()));
    }

    @Override
    @Timed("region sites")
    public int[] regionSites(String name, String region, String regionColumn) {
        return withCollection(name, c -> c.sitesInRegion(region, regionColumn(regionColumn)));
    }

    @Override
    public List<String> regions(String name, String regionColumn) {
        return withCollection(name, c -> c.availableRegions(regionColumn(regionColumn))
                .orElse(Collections.emptyList()));
    }

    @Override
    @Timed("series")
    public TimeSeries series(String name, String dataset, int gid) {
        return withCollection(name, c -> c.series(dataset, gid));
    }

    @Override
    @Timed("series at coordinate")
    public TimeSeries seriesAt(String name, String dataset, double lat, double lon) {
        return withCollection(name, c -> c.seriesAt(dataset, lat, lon));
    }

    @Override
    @Timed("region series")
    public SeriesTable regionSeries(String name, String dataset, String region, String regionColumn) {
        return withCollection(name, c -> c.regionSeries(dataset, region, regionColumn(regionColumn)));
    }

    @Override
    @Timed("snapshot")
    public SpatialMap snapshot(String name, String dataset, String timestep, String region, String regionColumn) {
        return withCollection(name, c -> c.snapshot(dataset, timestep, region, regionColumn(regionColumn)));
    }

    @Override
    @Timed(value = "mean map", slowMillis = 5_000)
    public SpatialMap meanMap(String name, String dataset, List<Integer> years, String region, String regionColumn) {
        return withCollection(name, c -> c.meanMap(dataset, years, region, regionColumn(regionColumn)));
    }

    @Override
    @Timed(value = "bundle export", logLevel = Timed.LogLevel.INFO, slowMillis = 5_000)
    public List<Path> exportBundles(String name, ExportBundleParam param) {
        Path destination = Paths.get(param.getDestination());
        int[] gids = param.gidArray();
        return withCollection(name, c -> {
            try {
                if (param.getHubHeight() != null) {
                    return c.exportHubHeightBundles(param.getHubHeight(), gids, param.hubHeightOptions(), destination);
                }
                return c.exportBundles(gids, destination);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not export bundles to " + destination, e);
            }
        });
    }

    private String regionColumn(String regionColumn) {
        return regionColumn == null || regionColumn.isBlank() ? properties.getDefaultRegionColumn() : regionColumn;
    }

    private <T> T withCollection(String name, Function<ResourceCollection, T> query) {
        ResourceCollection collection = collections.get(name);
        if (collection == null) {
            throw new CollectionNotFoundException(name);
        }
        synchronized (collection) {
            if (collection.isClosed()) {
                throw new CollectionNotFoundException(name);
            }
            return query.apply(collection);
        }
    }

    @PreDestroy
    public void closeAll() {
        for (String name : new ArrayList<>(collections.keySet())) {
            close(name);
        }
    }
}
