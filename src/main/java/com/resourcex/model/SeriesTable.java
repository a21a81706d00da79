package com.resourcex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One dataset for several sites: rows follow the time index, one column per gid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeriesTable {
    private String dataset;
    private List<Instant> timeIndex;
    private int[] gids;

    // [time][column]
    private double[][] values;

    public double[] column(int gid) {
        for (int c = 0; c < gids.length; c++) {
            if (gids[c] == gid) {
                double[] column = new double[values.length];
                for (int t = 0; t < values.length; t++) {
                    column[t] = values[t][c];
                }
                return column;
            }
        }
        throw new IllegalArgumentException("gid " + gid + " is not a column of this table");
    }
}
