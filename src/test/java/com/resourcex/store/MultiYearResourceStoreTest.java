package com.resourcex.store;

import com.resourcex.ResourceFixtures;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.exception.ShardInconsistencyException;
import com.resourcex.model.SiteTable;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class MultiYearResourceStoreTest {

    private static SortedMap<Integer, ResourceStore> years(int... years) {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        for (int year : years) {
            shards.put(year, ResourceFixtures.solarStore("nsrdb_" + year + ".json", year));
        }
        return shards;
    }

    @Test
    void testTimeAxesAreConcatenatedInYearOrder() {
        MultiYearResourceStore store = new MultiYearResourceStore(years(2013, 2012), true);

        assertEquals(List.of(2012, 2013), List.copyOf(store.getYears()));
        assertEquals(6, store.getTimeAxis().size());
        assertEquals(3, store.getSiteTable().size());
        assertEquals("nsrdb_2012.json", store.getSourceName());

        double[][] block = store.read("ghi", new int[] {4, 0, 1}, new int[] {2});
        assertEquals(ResourceFixtures.value("ghi", 2013, 1, 2), block[0][0]);
        assertEquals(ResourceFixtures.value("ghi", 2012, 0, 2), block[1][0]);
        assertEquals(ResourceFixtures.value("ghi", 2012, 1, 2), block[2][0]);
    }

    @Test
    void testReadYears() {
        MultiYearResourceStore store = new MultiYearResourceStore(years(2012, 2013, 2014), true);

        double[][] block = store.readYears("ghi", List.of(2014), new int[] {0});

        assertEquals(3, block.length);
        assertEquals(ResourceFixtures.value("ghi", 2014, 2, 0), block[2][0]);
        assertThrows(InvalidInputException.class, () -> store.readYears("ghi", List.of(2015), new int[] {0}));
    }

    @Test
    void testPositionOutsideAxisIsRejected() {
        MultiYearResourceStore store = new MultiYearResourceStore(years(2012, 2013), true);

        assertThrows(InvalidInputException.class, () -> store.read("ghi", new int[] {6}, new int[] {0}));
    }

    @Test
    void testDifferentSiteCoordinatesAreRejected() {
        SortedMap<Integer, ResourceStore> shards = years(2012);
        List<Map<String, Object>> moved = List.of(site(40.0, -105.0), site(41.0, -105.5), site(39.5, -104.8));
        shards.put(2013, InMemoryResourceStore.builder()
                .sourceName("nsrdb_2013.json")
                .siteTable(SiteTable.fromRecords(moved))
                .timeAxis(ResourceFixtures.timeAxis(2013))
                .dataset("ghi", ResourceFixtures.dataset("ghi", 2013, 3))
                .build());

        assertThrows(ShardInconsistencyException.class, () -> new MultiYearResourceStore(shards, true));
        // the same shards are accepted when validation is off
        assertEquals(6, new MultiYearResourceStore(shards, false).getTimeAxis().size());
    }

    @Test
    void testOverlappingYearsAreRejected() {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        shards.put(2012, ResourceFixtures.solarStore("nsrdb_2012.json", 2012));
        shards.put(2013, ResourceFixtures.solarStore("nsrdb_2013.json", 2012));

        assertThrows(ShardInconsistencyException.class, () -> new MultiYearResourceStore(shards, true));
    }

    @Test
    void testOnlyCommonDatasetsAreExposed() {
        SortedMap<Integer, ResourceStore> shards = years(2012);
        shards.put(2013, InMemoryResourceStore.builder()
                .sourceName("nsrdb_2013.json")
                .siteTable(ResourceFixtures.siteTable())
                .timeAxis(ResourceFixtures.timeAxis(2013))
                .dataset("ghi", ResourceFixtures.dataset("ghi", 2013, 3))
                .build());

        assertEquals(List.of("ghi"), List.copyOf(new MultiYearResourceStore(shards, true).getDatasets()));
    }

    @Test
    void testCoordinatesFieldIsUsedWhenSiteTableHasNoLatLon() {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        double[][] coordinates = {{40.0, -105.0}, {41.0, -104.0}};
        shards.put(2012, stateOnlyStore(2012, coordinates));
        shards.put(2013, stateOnlyStore(2013, new double[][] {{40.0, -105.0}, {41.0, -104.0}}));

        MultiYearResourceStore store = new MultiYearResourceStore(shards, true);

        assertEquals(6, store.getTimeAxis().size());
        assertArrayEquals(coordinates, store.getCoordinates().orElseThrow());
    }

    @Test
    void testDifferentCoordinatesFieldIsRejected() {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        shards.put(2012, stateOnlyStore(2012, new double[][] {{40.0, -105.0}, {41.0, -104.0}}));
        shards.put(2013, stateOnlyStore(2013, new double[][] {{40.0, -105.0}, {41.5, -104.0}}));

        assertThrows(ShardInconsistencyException.class, () -> new MultiYearResourceStore(shards, true));
    }

    @Test
    void testShardsWithoutAnyCoordinatesFailTyped() {
        SortedMap<Integer, ResourceStore> shards = new TreeMap<>();
        shards.put(2012, stateOnlyStore(2012, null));
        shards.put(2013, stateOnlyStore(2013, null));

        assertThrows(ShardInconsistencyException.class, () -> new MultiYearResourceStore(shards, true));
    }

    private static ResourceStore stateOnlyStore(int year, double[][] coordinates) {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("state", "CO");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("state", "WY");
        return InMemoryResourceStore.builder()
                .sourceName("wtk_" + year + ".json")
                .siteTable(SiteTable.fromRecords(List.of(first, second)))
                .timeAxis(ResourceFixtures.timeAxis(year))
                .dataset("ghi", ResourceFixtures.dataset("ghi", year, 2))
                .coordinates(coordinates)
                .build();
    }

    private static Map<String, Object> site(double lat, double lon) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("latitude", lat);
        record.put("longitude", lon);
        return record;
    }
}
