package com.resourcex.collection;

import com.resourcex.exception.DatasetNotFoundException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.index.CoordinateIndex;
import com.resourcex.index.CoordinateIndexLoader;
import com.resourcex.index.IndexCacheKeys;
import com.resourcex.locator.SiteLocator;
import com.resourcex.locator.TemporalLocator;
import com.resourcex.model.MapPoint;
import com.resourcex.model.SeriesTable;
import com.resourcex.model.SiteBundle;
import com.resourcex.model.SiteTable;
import com.resourcex.model.SpatialMap;
import com.resourcex.model.TimeAxis;
import com.resourcex.model.TimeSeries;
import com.resourcex.store.MultiYearResourceStore;
import com.resourcex.store.ResourceStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Query surface over one storage backend. The same operations work for
 * single-file, spatially sharded and yearly sharded stores; the domain only
 * decides what goes into a SAM bundle.
 * <p>
 * The collection owns its store. The coordinate index and site coordinates
 * are computed on first use and dropped, together with the store, by
 * {@link #close()}. Not thread-safe.
 */
public class ResourceCollection implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ResourceCollection.class);

    private final String name;
    private final ResourceDomain domain;
    private final StorageLayout layout;
    private final ResourceStore store;
    private final CoordinateIndexLoader indexLoader;
    private final BundleExporter exporter;
    private final String cacheKey;

    private SiteTable siteTable;
    private TimeAxis timeAxis;
    private SiteLocator siteLocator;
    private TemporalLocator temporalLocator;

    // null until the first spatial query
    private double[][] latLon;
    private CoordinateIndex coordinateIndex;

    private boolean closed;

    public ResourceCollection(String name, ResourceDomain domain, ResourceStore store,
                              CoordinateIndexLoader indexLoader, BundleExporter exporter) {
        this.name = name;
        this.domain = domain;
        this.layout = StorageLayout.of(store);
        this.store = store;
        this.indexLoader = indexLoader;
        this.exporter = exporter;
        this.cacheKey = IndexCacheKeys.forSource(store.getSourceName());
        this.siteTable = store.getSiteTable();
        this.timeAxis = store.getTimeAxis();
        this.siteLocator = new SiteLocator(siteTable, this::coordinateIndex);
        this.temporalLocator = new TemporalLocator(timeAxis);
    }

    public String getName() {
        return name;
    }

    public ResourceDomain getDomain() {
        return domain;
    }

    public StorageLayout getLayout() {
        return layout;
    }

    public String getSourceName() {
        return store.getSourceName();
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public SiteTable getSiteTable() {
        ensureOpen();
        return siteTable;
    }

    public TimeAxis getTimeAxis() {
        ensureOpen();
        return timeAxis;
    }

    public Set<String> getDatasets() {
        ensureOpen();
        return store.getDatasets();
    }

    /**
     * Years covered by the time axis; for yearly sharded collections these
     * are the shard years.
     */
    public SortedSet<Integer> getYears() {
        ensureOpen();
        if (store instanceof MultiYearResourceStore) {
            return ((MultiYearResourceStore) store).getYears();
        }
        return timeAxis.years();
    }

    // ------------------------------------------------------------------
    // Site and time lookup
    // ------------------------------------------------------------------

    /**
     * (latitude, longitude) of every site, from the store's coordinates
     * field when it has one, else from the site table's lat/lon columns.
     */
    public double[][] latLon() {
        double[][] coordinates = siteCoordinates();
        double[][] copy = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            copy[i] = coordinates[i].clone();
        }
        return copy;
    }

    // shared with the index and the map builders, never handed out
    private double[][] siteCoordinates() {
        ensureOpen();
        if (latLon == null) {
            latLon = store.getCoordinates().orElseGet(siteTable::latLon);
        }
        return latLon;
    }

    public CoordinateIndex coordinateIndex() {
        ensureOpen();
        if (coordinateIndex == null) {
            coordinateIndex = indexLoader.getOrBuild(siteCoordinates(), cacheKey);
        }
        return coordinateIndex;
    }

    public SiteLocator sites() {
        ensureOpen();
        return siteLocator;
    }

    public int nearestSite(double lat, double lon) {
        return sites().nearestSite(lat, lon);
    }

    public int[] nearestSites(double[][] coordinates) {
        return sites().nearestSites(coordinates);
    }

    public int[] sitesInRegion(String region, String regionColumn) {
        return sites().sitesInRegion(region, regionColumn);
    }

    public Optional<List<String>> availableRegions(String regionColumn) {
        return sites().availableRegions(regionColumn);
    }

    public int positionOf(String timestep) {
        ensureOpen();
        return temporalLocator.positionOf(timestep);
    }

    // ------------------------------------------------------------------
    // Series, maps
    // ------------------------------------------------------------------

    public TimeSeries series(String dataset, int gid) {
        ensureOpen();
        double[][] block = read(dataset, TimeAxis.allPositions(timeAxis.size()), new int[] {gid});
        double[] values = new double[block.length];
        for (int t = 0; t < block.length; t++) {
            values[t] = block[t][0];
        }
        return TimeSeries.builder()
                .dataset(dataset)
                .gid(gid)
                .timeIndex(timeAxis.getInstants())
                .values(values)
                .build();
    }

    public SeriesTable series(String dataset, int[] gids) {
        ensureOpen();
        double[][] block = read(dataset, TimeAxis.allPositions(timeAxis.size()), gids);
        return SeriesTable.builder()
                .dataset(dataset)
                .timeIndex(timeAxis.getInstants())
                .gids(gids.clone())
                .values(block)
                .build();
    }

    public TimeSeries seriesAt(String dataset, double lat, double lon) {
        return series(dataset, nearestSite(lat, lon));
    }

    public SeriesTable seriesAt(String dataset, double[][] coordinates) {
        return series(dataset, nearestSites(coordinates));
    }

    public SeriesTable regionSeries(String dataset, String region, String regionColumn) {
        return series(dataset, sitesInRegion(region, regionColumn));
    }

    /**
     * Values of a dataset at one timestep, for every site or for one region.
     *
     * @param region region value, or null for all sites
     */
    public SpatialMap snapshot(String dataset, String timestep, String region, String regionColumn) {
        ensureOpen();
        checkDataset(dataset);
        int position = temporalLocator.positionOf(timestep);
        int[] gids = selectSites(region, regionColumn);
        double[][] block = read(dataset, new int[] {position}, gids);

        return toMap(dataset, timeAxis.get(position).toString(), gids, block[0]);
    }

    /**
     * Per-site mean of a dataset over the selected years. Only yearly
     * sharded collections support this.
     *
     * @param region region value, or null for all sites
     */
    public SpatialMap meanMap(String dataset, Collection<Integer> years, String region, String regionColumn) {
        ensureOpen();
        if (!(store instanceof MultiYearResourceStore)) {
            throw new UnsupportedOperationException("Mean maps need a multi-year collection, " + name + " is " + layout);
        }
        if (years == null || years.isEmpty()) {
            throw new InvalidInputException("At least one year is required");
        }
        checkDataset(dataset);
        int[] gids = selectSites(region, regionColumn);

        SortedSet<Integer> selected = new TreeSet<>(years);
        double[][] block = ((MultiYearResourceStore) store).readYears(dataset, selected, gids);
        double[] means = new double[gids.length];
        for (int c = 0; c < gids.length; c++) {
            double sum = 0;
            for (double[] row : block) {
                sum += row[c];
            }
            means[c] = block.length == 0 ? Double.NaN : sum / block.length;
        }
        return toMap(dataset, "mean " + selected, gids, means);
    }

    private int[] selectSites(String region, String regionColumn) {
        if (region == null) {
            return IntStream.range(0, siteTable.size()).toArray();
        }
        return sitesInRegion(region, regionColumn);
    }

    private SpatialMap toMap(String dataset, String label, int[] gids, double[] values) {
        double[][] coordinates = siteCoordinates();
        List<MapPoint> points = new ArrayList<>(gids.length);
        for (int c = 0; c < gids.length; c++) {
            points.add(MapPoint.builder()
                    .gid(gids[c])
                    .longitude(coordinates[gids[c]][1])
                    .latitude(coordinates[gids[c]][0])
                    .value(values[c])
                    .build());
        }
        return SpatialMap.builder()
                .dataset(dataset)
                .label(label)
                .points(points)
                .build();
    }

    // ------------------------------------------------------------------
    // SAM bundles
    // ------------------------------------------------------------------

    /**
     * Bundle of the domain's SAM variables for one site.
     */
    public SiteBundle bundle(int gid) {
        ensureOpen();
        return bundle(gid, domain.bundleVariables(store.getDatasets()));
    }

    public SiteBundle bundle(int gid, List<String> variables) {
        return buildBundle(ResourceDomain.BUNDLE_DATASET, gid, variables);
    }

    public List<SiteBundle> bundles(int[] gids) {
        List<SiteBundle> bundles = new ArrayList<>(gids.length);
        for (int gid : gids) {
            bundles.add(bundle(gid));
        }
        return bundles;
    }

    public SiteBundle bundleAt(double lat, double lon) {
        return bundle(nearestSite(lat, lon));
    }

    /**
     * Wind bundle at a hub height, e.g. 100 for {@code windspeed_100m}.
     */
    public SiteBundle hubHeightBundle(int hubHeight, int gid, HubHeightOptions options) {
        ensureOpen();
        if (!domain.supportsHubHeight()) {
            throw new UnsupportedOperationException("Hub height bundles need a wind collection, " + name + " is " + domain);
        }
        List<String> variables = ResourceDomain.hubHeightVariables(
                hubHeight, options, store.getDatasets(), store.getSourceName());
        return buildBundle(ResourceDomain.hubHeightDataset(hubHeight), gid, variables);
    }

    public List<SiteBundle> hubHeightBundles(int hubHeight, int[] gids, HubHeightOptions options) {
        List<SiteBundle> bundles = new ArrayList<>(gids.length);
        for (int gid : gids) {
            bundles.add(hubHeightBundle(hubHeight, gid, options));
        }
        return bundles;
    }

    public SiteBundle hubHeightBundleAt(int hubHeight, double lat, double lon, HubHeightOptions options) {
        return hubHeightBundle(hubHeight, nearestSite(lat, lon), options);
    }

    private SiteBundle buildBundle(String bundleDataset, int gid, List<String> variables) {
        ensureOpen();
        siteTable.checkGid(gid);
        if (variables.isEmpty()) {
            throw new InvalidInputException("A bundle needs at least one variable");
        }

        int[] positions = TimeAxis.allPositions(timeAxis.size());
        Map<String, double[]> values = new LinkedHashMap<>();
        for (String variable : variables) {
            double[][] block = read(variable, positions, new int[] {gid});
            double[] series = new double[block.length];
            for (int t = 0; t < block.length; t++) {
                series[t] = block[t][0];
            }
            values.put(variable, series);
        }

        return SiteBundle.builder()
                .name(bundleDataset + "-" + gid)
                .gid(gid)
                .timeIndex(timeAxis.getInstants())
                .variables(values)
                .site(siteTable.record(gid))
                .build();
    }

    public Path export(SiteBundle bundle, Path destination) throws IOException {
        ensureOpen();
        return exporter.export(bundle, destination);
    }

    /**
     * Build and export the domain bundle of each site, in order.
     */
    public List<Path> exportBundles(int[] gids, Path destination) throws IOException {
        List<Path> files = new ArrayList<>(gids.length);
        for (int gid : gids) {
            files.add(export(bundle(gid), destination));
        }
        return files;
    }

    public List<Path> exportHubHeightBundles(int hubHeight, int[] gids, HubHeightOptions options,
                                             Path destination) throws IOException {
        List<Path> files = new ArrayList<>(gids.length);
        for (int gid : gids) {
            files.add(export(hubHeightBundle(hubHeight, gid, options), destination));
        }
        return files;
    }

    // ------------------------------------------------------------------

    private double[][] read(String dataset, int[] positions, int[] gids) {
        ensureOpen();
        checkDataset(dataset);
        for (int gid : gids) {
            siteTable.checkGid(gid);
        }
        return store.read(dataset, positions, gids);
    }

    private void checkDataset(String dataset) {
        if (!store.hasDataset(dataset)) {
            throw new DatasetNotFoundException(dataset, store.getSourceName());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Collection is closed: " + name);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the store and drop the site table, time axis and coordinate index.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        latLon = null;
        coordinateIndex = null;
        siteLocator = null;
        temporalLocator = null;
        siteTable = null;
        timeAxis = null;
        store.close();
        logger.info("Closed collection '{}'", name);
    }

    @Override
    public String toString() {
        return "ResourceCollection(" + name + ", " + domain + ", " + layout + ", " + store.getSourceName() + ")";
    }
}
