package com.resourcex.index;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoordinateIndexLoaderTest {

    private static final String KEY = "nsrdb_tree.ser";
    private static final double[][] SITES = {{40.0, -105.0}, {41.0, -105.5}, {39.0, -104.8}};

    @Mock
    private IndexCache cache;

    @InjectMocks
    private CoordinateIndexLoader loader;

    @Test
    void testMatchingCachedIndexIsReused() {
        CoordinateIndex cached = CoordinateIndex.build(SITES);
        when(cache.load(KEY)).thenReturn(CacheLookup.hit(KEY, cached));

        CoordinateIndex index = loader.getOrBuild(SITES, KEY);

        assertSame(cached, index);
        verify(cache, never()).store(anyString(), any());
    }

    @Test
    void testIndexForOtherSitesIsRebuilt() {
        CoordinateIndex stale = CoordinateIndex.build(new double[][] {{10.0, 10.0}});
        when(cache.load(KEY)).thenReturn(CacheLookup.hit(KEY, stale));
        when(cache.store(eq(KEY), any())).thenReturn(true);

        CoordinateIndex index = loader.getOrBuild(SITES, KEY);

        assertNotSame(stale, index);
        assertEquals(3, index.size());
        assertEquals(CoordinateIndex.fingerprint(SITES), index.getFingerprint());
        verify(cache).store(KEY, index);
    }

    @Test
    void testMissBuildsAndWritesThrough() {
        when(cache.load(KEY)).thenReturn(CacheLookup.miss(KEY));
        when(cache.store(eq(KEY), any())).thenReturn(true);

        CoordinateIndex index = loader.getOrBuild(SITES, KEY);

        assertEquals(1, index.nearest(41.0, -105.5));
        verify(cache).store(KEY, index);
    }

    @Test
    void testDegradedCacheStillYieldsAnIndex() {
        when(cache.load(KEY)).thenReturn(CacheLookup.degraded(KEY, "java.io.StreamCorruptedException"));
        when(cache.store(eq(KEY), any())).thenReturn(false);

        CoordinateIndex index = loader.getOrBuild(SITES, KEY);

        assertEquals(3, index.size());
        verify(cache).store(KEY, index);
    }
}
