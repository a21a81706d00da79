package com.resourcex.index;

import java.io.Serializable;

/**
 * Leaf item of the coordinate index.
 */
final class IndexedSite implements Serializable {

    private static final long serialVersionUID = 1L;

    final int gid;
    final double lat;
    final double lon;

    IndexedSite(int gid, double lat, double lon) {
        this.gid = gid;
        this.lat = lat;
        this.lon = lon;
    }

    /**
     * Planar distance in (lat, lon) degrees.
     */
    double distance(double otherLat, double otherLon) {
        double dLat = lat - otherLat;
        double dLon = lon - otherLon;
        return Math.sqrt(dLat * dLat + dLon * dLon);
    }
}
