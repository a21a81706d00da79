package com.resourcex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One value per site with the site's coordinates: a snapshot at a timestep
 * or a mean over years.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpatialMap {
    private String dataset;
    private String label;
    private List<MapPoint> points;

    public int size() {
        return points.size();
    }
}
