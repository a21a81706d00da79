package com.resourcex.store;

import com.resourcex.exception.DatasetNotFoundException;
import com.resourcex.exception.ShardInconsistencyException;
import com.resourcex.model.SiteTable;
import com.resourcex.model.TimeAxis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Spatially sharded collection: every shard covers the same time axis and a
 * disjoint block of sites. Global gids run through the shards in order.
 */
public class MultiFileResourceStore extends AbstractShardedStore {

    private final SiteTable siteTable;
    private final TimeAxis timeAxis;

    // offsets[i] = first global gid of shard i, offsets[n] = total sites
    private final int[] offsets;

    public MultiFileResourceStore(List<ResourceStore> shards, boolean validate) {
        super(shards);
        this.timeAxis = shards.get(0).getTimeAxis();
        for (ResourceStore shard : shards.subList(1, shards.size())) {
            TimeAxis other = shard.getTimeAxis();
            boolean consistent = validate
                    ? other.getInstants().equals(timeAxis.getInstants())
                    : other.size() == timeAxis.size();
            if (!consistent) {
                throw new ShardInconsistencyException(String.format(
                        "Shard %s has time axis %s, expected %s", shard.getSourceName(), other, timeAxis));
            }
        }

        List<SiteTable> tables = new ArrayList<>();
        this.offsets = new int[shards.size() + 1];
        for (int i = 0; i < shards.size(); i++) {
            SiteTable table = shards.get(i).getSiteTable();
            tables.add(table);
            offsets[i + 1] = offsets[i] + table.size();
        }
        try {
            this.siteTable = SiteTable.concat(tables);
        } catch (IllegalArgumentException e) {
            throw new ShardInconsistencyException(e.getMessage());
        }
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
        for (int gid : gids) {
            siteTable.checkGid(gid);
        }

        double[][] block = new double[timePositions.length][gids.length];
        for (int s = 0; s < shards.size(); s++) {
            // columns of the output served by this shard
            List<Integer> columns = new ArrayList<>();
            for (int c = 0; c < gids.length; c++) {
                if (gids[c] >= offsets[s] && gids[c] < offsets[s + 1]) {
                    columns.add(c);
                }
            }
            if (columns.isEmpty()) {
                continue;
            }

            int[] local = new int[columns.size()];
            for (int k = 0; k < local.length; k++) {
                local[k] = gids[columns.get(k)] - offsets[s];
            }
            double[][] part = shards.get(s).read(dataset, timePositions, local);
            for (int r = 0; r < timePositions.length; r++) {
                for (int k = 0; k < local.length; k++) {
                    block[r][columns.get(k)] = part[r][k];
                }
            }
        }
        return block;
    }

    @Override
    public Optional<double[][]> getCoordinates() {
        ensureOpen();
        List<double[]> all = new ArrayList<>();
        for (ResourceStore shard : shards) {
            Optional<double[][]> coordinates = shard.getCoordinates();
            if (coordinates.isEmpty()) {
                return Optional.empty();
            }
            all.addAll(List.of(coordinates.get()));
        }
        return Optional.of(all.toArray(new double[0][]));
    }

    @Override
    public String toString() {
        return "MultiFileResourceStore(shards=" + shards.size() + ", " + siteTable + ", " + timeAxis + ")";
    }
}
