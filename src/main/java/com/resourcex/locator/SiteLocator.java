package com.resourcex.locator;

import com.resourcex.index.CoordinateIndex;
import com.resourcex.model.SiteTable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Turns coordinates and region names into site ids.
 */
public class SiteLocator {

    public static final String DEFAULT_REGION_COLUMN = "state";

    private final SiteTable siteTable;
    private final Supplier<CoordinateIndex> index;

    /**
     * @param index supplier of the collection's memoized index; only called
     *              by coordinate lookups
     */
    public SiteLocator(SiteTable siteTable, Supplier<CoordinateIndex> index) {
        this.siteTable = siteTable;
        this.index = index;
    }

    public int nearestSite(double lat, double lon) {
        return index.get().nearest(lat, lon);
    }

    public int[] nearestSites(double[][] latLon) {
        return index.get().nearest(latLon);
    }

    /**
     * Sites whose {@code column} attribute equals {@code region}, ascending.
     * Attribute values are compared in their string form. A missing column
     * or no match yields an empty array.
     */
    public int[] sitesInRegion(String region, String column) {
        Optional<List<Object>> values = siteTable.column(column);
        if (values.isEmpty() || region == null) {
            return new int[0];
        }
        List<Object> v = values.get();
        return IntStream.range(0, v.size())
                .filter(gid -> v.get(gid) != null && region.equals(String.valueOf(v.get(gid))))
                .toArray();
    }

    public int[] sitesInRegion(String region) {
        return sitesInRegion(region, DEFAULT_REGION_COLUMN);
    }

    /**
     * Distinct values of a region column in first-seen order, or empty if
     * the column does not exist.
     */
    public Optional<List<String>> availableRegions(String column) {
        return siteTable.column(column).map(values -> {
            Set<String> distinct = new LinkedHashSet<>();
            values.stream().filter(Objects::nonNull).map(String::valueOf).forEach(distinct::add);
            return new ArrayList<>(distinct);
        });
    }

    public Optional<List<String>> countries() {
        return availableRegions("country");
    }

    public Optional<List<String>> states() {
        return availableRegions("state");
    }

    public Optional<List<String>> counties() {
        return availableRegions("county");
    }
}
