package com.resourcex.store;

import com.resourcex.exception.DatasetNotFoundException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.exception.ShardInconsistencyException;
import com.resourcex.model.SiteTable;
import com.resourcex.model.TimeAxis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Temporally sharded collection: one shard per year over the same sites. The
 * time axes are concatenated in year order and the site table is taken from
 * the first year.
 */
public class MultiYearResourceStore extends AbstractShardedStore {

    private static final Logger logger = LoggerFactory.getLogger(MultiYearResourceStore.class);

    private final SortedSet<Integer> years;
    private final SiteTable siteTable;
    private final TimeAxis timeAxis;

    // offsets[i] = first global time position of shard i, offsets[n] = total steps
    private final int[] offsets;

    /**
     * @param shardsByYear shards keyed by year
     * @param validate compare every year's site coordinates with the first year's
     */
    public MultiYearResourceStore(SortedMap<Integer, ResourceStore> shardsByYear, boolean validate) {
        super(new ArrayList<>(shardsByYear.values()));
        this.years = Collections.unmodifiableSortedSet(new TreeSet<>(shardsByYear.keySet()));
        this.siteTable = shards.get(0).getSiteTable();

        if (validate) {
            validateSites(shardsByYear);
        } else {
            logger.debug("Skipping site table validation across {} yearly shards", shards.size());
        }

        List<TimeAxis> axes = new ArrayList<>();
        this.offsets = new int[shards.size() + 1];
        for (int i = 0; i < shards.size(); i++) {
            TimeAxis axis = shards.get(i).getTimeAxis();
            axes.add(axis);
            offsets[i + 1] = offsets[i] + axis.size();
        }
        try {
            this.timeAxis = TimeAxis.concat(axes);
        } catch (IllegalArgumentException e) {
            throw new ShardInconsistencyException("Yearly time axes overlap: " + e.getMessage());
        }
    }

    private void validateSites(SortedMap<Integer, ResourceStore> shardsByYear) {
        double[][] reference = coordinatesOf(years.first(), shards.get(0));
        for (Map.Entry<Integer, ResourceStore> entry : shardsByYear.entrySet()) {
            SiteTable other = entry.getValue().getSiteTable();
            if (other.size() != siteTable.size()) {
                throw new ShardInconsistencyException(String.format("Year %d has %d sites, year %d has %d",
                        entry.getKey(), other.size(), years.first(), siteTable.size()));
            }
            if (!Arrays.deepEquals(reference, coordinatesOf(entry.getKey(), entry.getValue()))) {
                throw new ShardInconsistencyException(String.format(
                        "Year %d site coordinates differ from year %d", entry.getKey(), years.first()));
            }
        }
    }

    // same source the coordinate index is built from
    private static double[][] coordinatesOf(int year, ResourceStore shard) {
        try {
            return shard.getCoordinates().orElseGet(shard.getSiteTable()::latLon);
        } catch (IllegalStateException e) {
            throw new ShardInconsistencyException(String.format(
                    "Year %d has no site coordinates to compare: %s", year, e.getMessage()));
        }
    }

    public SortedSet<Integer> getYears() {
        return years;
    }

    @Override
    public SiteTable getSiteTable() {
        ensureOpen();
        return siteTable;
    }

    @Override
    public TimeAxis getTimeAxis() {
        ensureOpen();
        return timeAxis;
    }

    @Override
    public double[][] read(String dataset, int[] timePositions, int[] gids) {
        ensureOpen();
        if (!getDatasets().contains(dataset)) {
            throw new DatasetNotFoundException(dataset, getSourceName());
        }

        double[][] block = new double[timePositions.length][];
        int r = 0;
        while (r < timePositions.length) {
            int shard = shardOf(timePositions[r]);
            // run of consecutive output rows served by the same shard
            int end = r;
            while (end < timePositions.length && shardOf(timePositions[end]) == shard) {
                end++;
            }
            int[] local = new int[end - r];
            for (int k = 0; k < local.length; k++) {
                local[k] = timePositions[r + k] - offsets[shard];
            }
            double[][] part = shards.get(shard).read(dataset, local, gids);
            System.arraycopy(part, 0, block, r, part.length);
            r = end;
        }
        return block;
    }

    /**
     * Read the given years in full.
     */
    public double[][] readYears(String dataset, Iterable<Integer> selected, int[] gids) {
        List<double[]> rows = new ArrayList<>();
        List<Integer> yearList = new ArrayList<>(years);
        for (Integer year : selected) {
            int shard = yearList.indexOf(year);
            if (shard < 0) {
                throw new InvalidInputException("Year " + year + " is not available, years are " + years);
            }
            int[] local = TimeAxis.allPositions(offsets[shard + 1] - offsets[shard]);
            rows.addAll(List.of(shards.get(shard).read(dataset, local, gids)));
        }
        return rows.toArray(new double[0][]);
    }

    private int shardOf(int position) {
        if (position < 0 || position >= offsets[offsets.length - 1]) {
            throw new InvalidInputException("Time position " + position
                    + " is outside [0, " + offsets[offsets.length - 1] + ")");
        }
        int shard = 0;
        while (position >= offsets[shard + 1]) {
            shard++;
        }
        return shard;
    }

    @Override
    public Optional<double[][]> getCoordinates() {
        ensureOpen();
        return shards.get(0).getCoordinates();
    }

    @Override
    public String toString() {
        return "MultiYearResourceStore(years=" + years + ", " + siteTable + ", " + timeAxis + ")";
    }
}
