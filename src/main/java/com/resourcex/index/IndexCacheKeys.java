package com.resourcex.index;

import com.resourcex.store.ShardPaths;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Derives the cache key of a collection's coordinate index from its source
 * name. Names carrying a year share a key with the other years of the same
 * prefix: {@code nsrdb_2012.json} and {@code nsrdb_2013.json} both map to
 * {@code nsrdb_tree.ser}. Other names swap their extension:
 * {@code wtk_conus.json} maps to {@code wtk_conus_tree.ser}.
 */
public final class IndexCacheKeys {

    public static final String SUFFIX = "tree.ser";

    private IndexCacheKeys() {
    }

    public static String forSource(String sourceName) {
        Path fileName = Paths.get(sourceName).getFileName();
        String name = fileName == null ? sourceName : fileName.toString();

        int year = ShardPaths.yearIndex(name);
        if (year >= 0) {
            return name.substring(0, year) + SUFFIX;
        }

        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + "_" + SUFFIX;
    }
}
