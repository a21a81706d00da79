package com.resourcex.store;

import com.resourcex.exception.DatasetNotFoundException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.model.SiteTable;
import com.resourcex.model.TimeAxis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Store holding every dataset in memory. Backs single-file collections read
 * by {@link JsonResourceStoreReader} and doubles as the shard type of the
 * composite stores.
 */
public class InMemoryResourceStore implements ResourceStore {

    private final String sourceName;
    private final SiteTable siteTable;
    private final TimeAxis timeAxis;
    private final Map<String, double[][]> datasets;
    private final double[][] coordinates;
    private boolean closed;

    private InMemoryResourceStore(Builder builder) {
        this.sourceName = builder.sourceName;
        this.siteTable = builder.siteTable;
        this.timeAxis = builder.timeAxis;
        this.datasets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.datasets));
        this.coordinates = builder.coordinates;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getSourceName() {
        return sourceName;
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
    public Set<String> getDatasets() {
        ensureOpen();
        return datasets.keySet();
    }

    @Override
    public double[][] read(String dataset, int[] timePositions, int[] gids) {
        ensureOpen();
        double[][] data = datasets.get(dataset);
        if (data == null) {
            throw new DatasetNotFoundException(dataset, sourceName);
        }
        for (int gid : gids) {
            siteTable.checkGid(gid);
        }

        double[][] block = new double[timePositions.length][gids.length];
        for (int r = 0; r < timePositions.length; r++) {
            int t = timePositions[r];
            if (t < 0 || t >= data.length) {
                throw new InvalidInputException("Time position " + t + " is outside [0, " + data.length + ")");
            }
            double[] row = data[t];
            for (int c = 0; c < gids.length; c++) {
                block[r][c] = row[gids[c]];
            }
        }
        return block;
    }

    @Override
    public Optional<double[][]> getCoordinates() {
        ensureOpen();
        return Optional.ofNullable(coordinates);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed: " + sourceName);
        }
    }

    @Override
    public String toString() {
        return "InMemoryResourceStore(" + sourceName + ", " + siteTable + ", " + timeAxis + ")";
    }

    public static class Builder {
        private String sourceName;
        private SiteTable siteTable;
        private TimeAxis timeAxis;
        private final Map<String, double[][]> datasets = new LinkedHashMap<>();
        private double[][] coordinates;

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder siteTable(SiteTable siteTable) {
            this.siteTable = siteTable;
            return this;
        }

        public Builder timeAxis(TimeAxis timeAxis) {
            this.timeAxis = timeAxis;
            return this;
        }

        /**
         * @param values [time][site], matching the time axis and site table sizes
         */
        public Builder dataset(String name, double[][] values) {
            datasets.put(name, values);
            return this;
        }

        public Builder coordinates(double[][] coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public InMemoryResourceStore build() {
            if (sourceName == null || siteTable == null || timeAxis == null) {
                throw new IllegalArgumentException("sourceName, siteTable and timeAxis are required");
            }
            for (Map.Entry<String, double[][]> entry : datasets.entrySet()) {
                double[][] values = entry.getValue();
                if (values.length != timeAxis.size()) {
                    throw new IllegalArgumentException(String.format("Dataset '%s' has %d time steps, time axis has %d",
                            entry.getKey(), values.length, timeAxis.size()));
                }
                for (double[] row : values) {
                    if (row.length != siteTable.size()) {
                        throw new IllegalArgumentException(String.format("Dataset '%s' has %d sites, site table has %d",
                                entry.getKey(), row.length, siteTable.size()));
                    }
                }
            }
            if (coordinates != null && coordinates.length != siteTable.size()) {
                throw new IllegalArgumentException("coordinates has " + coordinates.length
                        + " rows, site table has " + siteTable.size());
            }
            if (coordinates != null) {
                for (int i = 0; i < coordinates.length; i++) {
                    if (coordinates[i] == null || coordinates[i].length != 2) {
                        throw new IllegalArgumentException("coordinates row " + i + " is not a (lat, lon) pair");
                    }
                }
            }
            return new InMemoryResourceStore(this);
        }
    }
}
