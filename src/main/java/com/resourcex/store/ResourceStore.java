package com.resourcex.store;

import com.resourcex.model.SiteTable;
import com.resourcex.model.TimeAxis;

import java.io.Closeable;
import java.util.Optional;
import java.util.Set;

/**
 * Storage backend of a resource collection: a site table, a time axis and
 * datasets shaped [time][site].
 */
public interface ResourceStore extends Closeable {

    /**
     * Identifier of the underlying source, typically its file name. Used to
     * derive the coordinate index cache key.
     */
    String getSourceName();

    SiteTable getSiteTable();

    TimeAxis getTimeAxis();

    Set<String> getDatasets();

    default boolean hasDataset(String dataset) {
        return getDatasets().contains(dataset);
    }

    /**
     * Read a block of a dataset.
     *
     * @param dataset dataset name
     * @param timePositions positions on the time axis, in output row order
     * @param gids site ids, in output column order
     * @return values indexed [row][column]
     */
    double[][] read(String dataset, int[] timePositions, int[] gids);

    /**
     * Dedicated (latitude, longitude) field, when the source carries one.
     */
    default Optional<double[][]> getCoordinates() {
        return Optional.empty();
    }

    @Override
    void close();
}
