package com.resourcex.index;

import com.resourcex.exception.InvalidInputException;
import com.resourcex.exception.SiteNotFoundException;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.ItemBoundable;
import org.locationtech.jts.index.strtree.ItemDistance;
import org.locationtech.jts.index.strtree.STRtree;

import java.io.Serializable;
import java.util.List;

/**
 * Nearest-neighbour index over site coordinates using a JTS STRtree.
 * Points are stored as x = longitude, y = latitude and compared with planar
 * Euclidean distance, so results are distorted at high latitudes and over
 * wide longitude spans. Ties resolve to the lowest gid.
 */
public final class CoordinateIndex implements Serializable {

    private static final long serialVersionUID = 1L;

    // Optimized node capacity for large site tables
    private static final int STRTREE_NODE_CAPACITY = 25;

    private static final ItemDistance SITE_DISTANCE = new SiteDistance();

    private final STRtree tree;
    private final int size;
    private final long fingerprint;

    private CoordinateIndex(STRtree tree, int size, long fingerprint) {
        this.tree = tree;
        this.size = size;
        this.fingerprint = fingerprint;
    }

    /**
     * Build an index over (latitude, longitude) pairs; the row position is the gid.
     */
    public static CoordinateIndex build(double[][] latLon) {
        STRtree tree = new STRtree(STRTREE_NODE_CAPACITY);
        for (int gid = 0; gid < latLon.length; gid++) {
            double lat = latLon[gid][0];
            double lon = latLon[gid][1];
            tree.insert(new Envelope(lon, lon, lat, lat), new IndexedSite(gid, lat, lon));
        }
        // Build the tree now so it is immutable and serializable
        tree.build();
        return new CoordinateIndex(tree, latLon.length, fingerprint(latLon));
    }

    /**
     * Identity of a coordinate set, used to detect a cached index built for
     * different sites under the same cache key.
     */
    public static long fingerprint(double[][] latLon) {
        long hash = 1125899906842597L;
        for (double[] pair : latLon) {
            for (double v : pair) {
                long bits = Double.doubleToLongBits(v);
                hash = 31 * hash + (bits ^ (bits >>> 32));
            }
        }
        return 31 * hash + latLon.length;
    }

    public int size() {
        return size;
    }

    public long getFingerprint() {
        return fingerprint;
    }

    public int nearest(double lat, double lon) {
        checkCoordinate(lat, lon);
        if (size == 0) {
            throw new SiteNotFoundException("Cannot search an empty site table");
        }

        IndexedSite probe = new IndexedSite(-1, lat, lon);
        IndexedSite best = (IndexedSite) tree.nearestNeighbour(
                new Envelope(lon, lon, lat, lat), probe, SITE_DISTANCE);
        double d = best.distance(lat, lon);

        // any other site at the same distance lies inside this envelope
        @SuppressWarnings("unchecked")
        List<IndexedSite> candidates = tree.query(new Envelope(lon - d, lon + d, lat - d, lat + d));
        int gid = best.gid;
        for (IndexedSite candidate : candidates) {
            if (candidate.gid < gid && candidate.distance(lat, lon) <= d) {
                gid = candidate.gid;
            }
        }
        return gid;
    }

    /**
     * @param latLon ordered (latitude, longitude) pairs
     * @return nearest gid for each pair, in input order
     */
    public int[] nearest(double[][] latLon) {
        if (latLon == null) {
            throw new InvalidInputException("Coordinates must not be null");
        }
        int[] gids = new int[latLon.length];
        for (int i = 0; i < latLon.length; i++) {
            double[] pair = latLon[i];
            if (pair == null || pair.length != 2) {
                throw new InvalidInputException("Coordinate " + i + " is not a (lat, lon) pair");
            }
            gids[i] = nearest(pair[0], pair[1]);
        }
        return gids;
    }

    private static void checkCoordinate(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            throw new InvalidInputException("Coordinate must be finite: (" + lat + ", " + lon + ")");
        }
    }

    private static final class SiteDistance implements ItemDistance, Serializable {

        private static final long serialVersionUID = 1L;

        @Override
        public double distance(ItemBoundable item1, ItemBoundable item2) {
            IndexedSite a = (IndexedSite) item1.getItem();
            IndexedSite b = (IndexedSite) item2.getItem();
            return a.distance(b.lat, b.lon);
        }
    }
}
