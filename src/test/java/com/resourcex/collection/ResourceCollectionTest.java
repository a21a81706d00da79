package com.resourcex.collection;

import com.resourcex.ResourceFixtures;
import com.resourcex.exception.DatasetNotFoundException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.exception.SiteNotFoundException;
import com.resourcex.exception.TimestepNotFoundException;
import com.resourcex.index.CoordinateIndexLoader;
import com.resourcex.index.FileIndexCache;
import com.resourcex.model.MapPoint;
import com.resourcex.model.SeriesTable;
import com.resourcex.model.SiteBundle;
import com.resourcex.model.SpatialMap;
import com.resourcex.model.TimeSeries;
import com.resourcex.store.InMemoryResourceStore;
import com.resourcex.store.MultiYearResourceStore;
import com.resourcex.store.ResourceStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCollectionTest {

    @TempDir
    Path tempDir;

    private FileIndexCache cache;
    private ResourceCollection collection;

    @BeforeEach
    void setUp() {
        cache = FileIndexCache.inDirectory(tempDir.resolve("trees"));
        collection = open("nsrdb", ResourceDomain.SOLAR, ResourceFixtures.solarStore("nsrdb_2012.json", 2012));
    }

    private ResourceCollection open(String name, ResourceDomain domain, ResourceStore store) {
        return new ResourceCollection(name, domain, store, new CoordinateIndexLoader(cache), new BundleExporter());
    }

    @Test
    void testDescribe() {
        assertEquals(StorageLayout.SINGLE_FILE, collection.getLayout());
        assertEquals("nsrdb_tree.ser", collection.getCacheKey());
        assertEquals(List.of(2012), List.copyOf(collection.getYears()));
        assertEquals(3, collection.getSiteTable().size());
        assertEquals(1, collection.positionOf("2012-01-01 01:00"));
    }

    @Test
    void testSeries() {
        TimeSeries series = collection.series("ghi", 1);

        assertEquals(1, series.getGid());
        assertEquals(ResourceFixtures.timeAxis(2012).getInstants(), series.getTimeIndex());
        assertArrayEquals(new double[] {
                ResourceFixtures.value("ghi", 2012, 0, 1),
                ResourceFixtures.value("ghi", 2012, 1, 1),
                ResourceFixtures.value("ghi", 2012, 2, 1)}, series.getValues());

        SeriesTable table = collection.series("dni", new int[] {2, 0});
        assertArrayEquals(new int[] {2, 0}, table.getGids());
        assertEquals(ResourceFixtures.value("dni", 2012, 2, 0), table.column(0)[2]);
        assertEquals(ResourceFixtures.value("dni", 2012, 1, 2), table.getValues()[1][0]);
    }

    @Test
    void testSeriesAtCoordinate() {
        assertEquals(0, collection.seriesAt("ghi", 40.1, -105.0).getGid());
        assertArrayEquals(new int[] {1, 2},
                collection.seriesAt("ghi", new double[][] {{41.0, -105.5}, {39.1, -104.8}}).getGids());
        // the index is written through to the cache
        assertTrue(Files.exists(tempDir.resolve("trees").resolve("nsrdb_tree.ser")));
    }

    @Test
    void testRegionSeries() {
        SeriesTable colorado = collection.regionSeries("ghi", "CO", "state");
        assertArrayEquals(new int[] {0, 2}, colorado.getGids());
        assertEquals(ResourceFixtures.value("ghi", 2012, 2, 2), colorado.column(2)[2]);

        SeriesTable california = collection.regionSeries("ghi", "CA", "state");
        assertEquals(0, california.getGids().length);
    }

    @Test
    void testSnapshot() {
        SpatialMap all = collection.snapshot("ghi", "2012-01-01 01:00", null, "state");
        assertEquals(3, all.size());
        assertEquals("2012-01-01T01:00:00Z", all.getLabel());
        for (MapPoint point : all.getPoints()) {
            assertEquals(ResourceFixtures.value("ghi", 2012, 1, point.getGid()), point.getValue());
        }

        SpatialMap wyoming = collection.snapshot("ghi", "2012-01-01T02:00:00Z", "WY", "state");
        MapPoint point = wyoming.getPoints().get(0);
        assertEquals(1, wyoming.size());
        assertEquals(1, point.getGid());
        assertEquals(41.0, point.getLatitude());
        assertEquals(-105.5, point.getLongitude());
        assertEquals(ResourceFixtures.value("ghi", 2012, 2, 1), point.getValue());
    }

    @Test
    void testLatLonCopyDoesNotLeakIntoQueries() {
        double[][] coordinates = collection.latLon();
        coordinates[1][0] = 0.0;
        coordinates[1][1] = 0.0;

        assertEquals(41.0, collection.latLon()[1][0]);
        MapPoint point = collection.snapshot("ghi", "2012-01-01T00:00:00Z", "WY", "state").getPoints().get(0);
        assertEquals(41.0, point.getLatitude());
        assertEquals(-105.5, point.getLongitude());
        assertEquals(1, collection.nearestSite(41.0, -105.5));
    }

    @Test
    void testQueryErrors() {
        assertThrows(DatasetNotFoundException.class, () -> collection.series("cloud_type", 0));
        assertThrows(SiteNotFoundException.class, () -> collection.series("ghi", 3));
        assertThrows(SiteNotFoundException.class, () -> collection.series("ghi", new int[] {0, -1}));
        assertThrows(TimestepNotFoundException.class,
                () -> collection.snapshot("ghi", "2012-01-01 00:30", null, "state"));
        assertThrows(InvalidInputException.class, () -> collection.nearestSite(Double.NaN, 0));
        assertThrows(UnsupportedOperationException.class,
                () -> collection.meanMap("ghi", List.of(2012), null, "state"));
    }

    @Test
    void testMeanMapOverYears() {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        shards.put(2012, ResourceFixtures.solarStore("nsrdb_2012.json", 2012));
        shards.put(2013, ResourceFixtures.solarStore("nsrdb_2013.json", 2013));
        ResourceCollection multiYear = open("nsrdb", ResourceDomain.NSRDB, new MultiYearResourceStore(shards, true));

        SpatialMap both = multiYear.meanMap("ghi", List.of(2013, 2012), null, "state");
        assertEquals(StorageLayout.MULTI_YEAR, multiYear.getLayout());
        assertEquals(3, both.size());
        // mean of steps 0..2 over both years
        assertEquals(1060.0, both.getPoints().get(0).getValue(), 1e-9);
        assertEquals(1062.0, both.getPoints().get(2).getValue(), 1e-9);

        SpatialMap colorado2013 = multiYear.meanMap("ghi", List.of(2013), "CO", "state");
        assertEquals(List.of(0, 2), colorado2013.getPoints().stream().map(MapPoint::getGid).collect(Collectors.toList()));
        assertEquals(1110.0, colorado2013.getPoints().get(0).getValue(), 1e-9);
        assertEquals(1112.0, colorado2013.getPoints().get(1).getValue(), 1e-9);

        assertThrows(InvalidInputException.class, () -> multiYear.meanMap("ghi", List.of(2015), null, "state"));
        assertThrows(InvalidInputException.class, () -> multiYear.meanMap("ghi", List.of(), null, "state"));
        multiYear.close();
    }

    @Test
    void testSolarBundle() {
        SiteBundle bundle = collection.bundle(1);

        assertEquals("SAM-1", bundle.getName());
        assertEquals(List.of("dhi", "dni", "ghi", "wind_speed", "air_temperature"),
                List.copyOf(bundle.getVariables().keySet()));
        assertEquals(ResourceFixtures.value("wind_speed", 2012, 2, 1), bundle.getVariables().get("wind_speed")[2]);
        assertEquals("WY", bundle.getSite().get("state"));
        assertEquals(0, collection.bundleAt(40.1, -105.0).getGid());
        assertEquals(2, collection.bundles(new int[] {0, 2}).size());

        assertThrows(UnsupportedOperationException.class,
                () -> collection.hubHeightBundle(100, 0, HubHeightOptions.defaults()));
    }

    @Test
    void testGenericBundleTakesEveryDataset() {
        ResourceCollection generic = open("generic", ResourceDomain.GENERIC,
                ResourceFixtures.solarStore("sites.json", 2012));

        assertEquals(ResourceFixtures.SOLAR_DATASETS, List.copyOf(generic.bundle(0).getVariables().keySet()));
        assertEquals(List.of("ghi"), List.copyOf(generic.bundle(0, List.of("ghi")).getVariables().keySet()));
        assertThrows(InvalidInputException.class, () -> generic.bundle(0, List.of()));
    }

    @Test
    void testHubHeightBundles() {
        ResourceCollection wind = open("wtk", ResourceDomain.WIND, windStore(true));

        SiteBundle bundle = wind.hubHeightBundle(100, 2, HubHeightOptions.defaults());
        assertEquals("SAM_100m-2", bundle.getName());
        assertEquals(List.of("pressure_100m", "temperature_100m", "windspeed_100m", "winddirection_100m"),
                List.copyOf(bundle.getVariables().keySet()));

        SiteBundle icing = wind.hubHeightBundle(100, 2, HubHeightOptions.builder().icing(true).build());
        assertTrue(icing.getVariables().containsKey("relativehumidity_2m"));

        assertThrows(UnsupportedOperationException.class, () -> wind.bundle(0));
    }

    @Test
    void testWindDirectionIsOptionalUnlessRequired() {
        ResourceCollection wind = open("wtk", ResourceDomain.WIND, windStore(false));

        assertEquals(3, wind.hubHeightBundle(100, 0, HubHeightOptions.defaults()).getVariables().size());
        assertThrows(DatasetNotFoundException.class, () -> wind.hubHeightBundle(100, 0,
                HubHeightOptions.builder().requireWindDirection(true).build()));
        assertThrows(DatasetNotFoundException.class, () -> wind.hubHeightBundle(80, 0, HubHeightOptions.defaults()));
    }

    @Test
    void testExportBundles() throws IOException {
        List<Path> files = collection.exportBundles(new int[] {0, 2}, tempDir);

        assertEquals(List.of(tempDir.resolve("SAM-0.csv"), tempDir.resolve("SAM-2.csv")), files);
        assertEquals(2 + 1 + 3, Files.readAllLines(files.get(1)).size());

        ResourceCollection wind = open("wtk", ResourceDomain.WIND, windStore(true));
        List<Path> windFiles = wind.exportHubHeightBundles(100, new int[] {1}, HubHeightOptions.defaults(), tempDir);
        assertEquals(List.of(tempDir.resolve("SAM_100m-1.csv")), windFiles);
    }

    @Test
    void testClose() {
        collection.nearestSite(40.0, -105.0);

        collection.close();
        collection.close();

        assertTrue(collection.isClosed());
        assertThrows(IllegalStateException.class, () -> collection.series("ghi", 0));
        assertThrows(IllegalStateException.class, () -> collection.series("ghi", new int[] {0}));
        assertThrows(IllegalStateException.class, () -> collection.nearestSite(40.0, -105.0));
        assertThrows(IllegalStateException.class, () -> collection.getSiteTable());
        assertThrows(IllegalStateException.class, () -> collection.bundle(0));
    }

    private static ResourceStore windStore(boolean withDirection) {
        InMemoryResourceStore.Builder builder = InMemoryResourceStore.builder()
                .sourceName("wtk_conus_2012.json")
                .siteTable(ResourceFixtures.siteTable())
                .timeAxis(ResourceFixtures.timeAxis(2012))
                .dataset("pressure_100m", new double[3][3])
                .dataset("temperature_100m", new double[3][3])
                .dataset("windspeed_100m", new double[3][3])
                .dataset("relativehumidity_2m", new double[3][3]);
        if (withDirection) {
            builder.dataset("winddirection_100m", new double[3][3]);
        }
        return builder.build();
    }
}
