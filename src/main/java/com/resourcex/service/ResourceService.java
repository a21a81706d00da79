package com.resourcex.service;

import com.resourcex.model.SeriesTable;
import com.resourcex.model.SiteRecord;
import com.resourcex.model.SpatialMap;
import com.resourcex.model.TimeSeries;
import com.resourcex.model.param.ExportBundleParam;
import com.resourcex.model.param.OpenCollectionParam;
import com.resourcex.model.result.CollectionResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Registry of open resource collections and the queries run against them
 */
public interface ResourceService {

    /**
     * Open a collection and register it under its name
     */
    CollectionResult open(OpenCollectionParam param);

    /**
     * Summaries of all open collections, ordered by name
     */
    List<CollectionResult> list();

    CollectionResult describe(String name);

    /**
     * Close and unregister a collection
     *
     * @return false when no collection had that name
     */
    boolean close(String name);

    /**
     * Nearest site to a coordinate
     */
    SiteRecord nearestSite(String name, double lat, double lon);

    /**
     * Nearest site of each coordinate, in input order
     */
    List<SiteRecord> nearestSites(String name, double[][] coordinates);

    /**
     * Site ids whose region column equals the region value
     *
     * @param regionColumn column to match, or null for the configured default
     */
    int[] regionSites(String name, String region, String regionColumn);

    /**
     * Distinct values of a region column, empty when the column does not exist
     */
    List<String> regions(String name, String regionColumn);

    TimeSeries series(String name, String dataset, int gid);

    TimeSeries seriesAt(String name, String dataset, double lat, double lon);

    SeriesTable regionSeries(String name, String dataset, String region, String regionColumn);

    SpatialMap snapshot(String name, String dataset, String timestep, String region, String regionColumn);

    SpatialMap meanMap(String name, String dataset, List<Integer> years, String region, String regionColumn);

    /**
     * Export one SAM bundle file per site
     */
    List<Path> exportBundles(String name, ExportBundleParam param);
}
