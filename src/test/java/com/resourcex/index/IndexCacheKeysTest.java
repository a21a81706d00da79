package com.resourcex.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndexCacheKeysTest {

    @Test
    void testYearlyFilesShareTheirPrefixKey() {
        assertEquals("nsrdb_tree.ser", IndexCacheKeys.forSource("nsrdb_2012.json"));
        assertEquals("nsrdb_tree.ser", IndexCacheKeys.forSource("/data/nsrdb/nsrdb_2013.json"));
        assertEquals("ri_wave_tree.ser", IndexCacheKeys.forSource("ri_wave_1999.h5"));
    }

    @Test
    void testNamesWithoutYearSwapTheirExtension() {
        assertEquals("wtk_conus_tree.ser", IndexCacheKeys.forSource("wtk_conus.json"));
        assertEquals("sites_tree.ser", IndexCacheKeys.forSource("/tmp/sites"));
    }

    @Test
    void testLongerDigitRunsAreNotYears() {
        assertEquals("grid_20121_tree.ser", IndexCacheKeys.forSource("grid_20121.json"));
        assertEquals("v12012_tree.ser", IndexCacheKeys.forSource("v12012.json"));
        assertEquals("run_2150_tree.ser", IndexCacheKeys.forSource("run_2150.json"));
    }
}
