package com.resourcex.store;

import com.resourcex.ResourceFixtures;
import com.resourcex.exception.ShardInconsistencyException;
import com.resourcex.exception.SiteNotFoundException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiFileResourceStoreTest {

    @Test
    void testSitesAreConcatenatedInShardOrder() {
        MultiFileResourceStore store = new MultiFileResourceStore(List.of(
                ResourceFixtures.solarStore("wtk_east.json", 2012),
                ResourceFixtures.solarStore("wtk_west.json", 2012)), true);

        assertEquals(6, store.getSiteTable().size());
        assertEquals(3, store.getTimeAxis().size());
        assertEquals("wtk_east.json", store.getSourceName());
        assertEquals("WY", store.getSiteTable().value(4, "state"));

        // gid 4 is the second shard's gid 1
        double[][] block = store.read("dni", new int[] {0, 2}, new int[] {4, 1, 5});
        assertEquals(ResourceFixtures.value("dni", 2012, 0, 1), block[0][0]);
        assertEquals(ResourceFixtures.value("dni", 2012, 0, 1), block[0][1]);
        assertEquals(ResourceFixtures.value("dni", 2012, 2, 2), block[1][2]);

        assertThrows(SiteNotFoundException.class, () -> store.read("dni", new int[] {0}, new int[] {6}));
    }

    @Test
    void testDifferentTimeAxesAreRejected() {
        assertThrows(ShardInconsistencyException.class, () -> new MultiFileResourceStore(List.of(
                ResourceFixtures.solarStore("wtk_east.json", 2012),
                ResourceFixtures.solarStore("wtk_west.json", 2013)), true));
    }

    @Test
    void testUnvalidatedShardsOnlyNeedEqualLength() {
        MultiFileResourceStore store = new MultiFileResourceStore(List.of(
                ResourceFixtures.solarStore("wtk_east.json", 2012),
                ResourceFixtures.solarStore("wtk_west.json", 2013)), false);

        assertEquals(ResourceFixtures.timeAxis(2012).getInstants(), store.getTimeAxis().getInstants());
    }

    @Test
    void testCloseClosesEveryShard() {
        InMemoryResourceStore east = ResourceFixtures.solarStore("wtk_east.json", 2012);
        InMemoryResourceStore west = ResourceFixtures.solarStore("wtk_west.json", 2012);
        MultiFileResourceStore store = new MultiFileResourceStore(List.of(east, west), true);

        store.close();

        assertThrows(IllegalStateException.class, store::getSiteTable);
        assertThrows(IllegalStateException.class, east::getSiteTable);
        assertThrows(IllegalStateException.class, west::getSiteTable);
    }
}
