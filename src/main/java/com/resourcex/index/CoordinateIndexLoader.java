package com.resourcex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Returns a cached coordinate index when one exists for the same coordinate
 * set, otherwise builds one and writes it through to the cache. Cache
 * problems only cost a rebuild.
 */
public class CoordinateIndexLoader {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateIndexLoader.class);

    private final IndexCache cache;

    public CoordinateIndexLoader(IndexCache cache) {
        this.cache = cache;
    }

    public CoordinateIndex getOrBuild(double[][] latLon, String cacheKey) {
        long fingerprint = CoordinateIndex.fingerprint(latLon);

        CacheLookup lookup = cache.load(cacheKey);
        if (lookup.isHit()) {
            CoordinateIndex cached = lookup.getIndex();
            if (cached.getFingerprint() == fingerprint && cached.size() == latLon.length) {
                logger.debug("Reusing cached coordinate index '{}' ({} sites)", cacheKey, cached.size());
                return cached;
            }
            logger.info("Cached coordinate index '{}' was built for other sites, rebuilding", cacheKey);
        } else if (lookup.getStatus() == CacheLookup.Status.DEGRADED) {
            logger.warn("Coordinate index cache '{}' unusable ({}), rebuilding", cacheKey, lookup.getReason());
        }

        long startTime = System.currentTimeMillis();
        CoordinateIndex index = CoordinateIndex.build(latLon);
        logger.info("Built coordinate index '{}' over {} sites in {}ms",
                cacheKey, index.size(), System.currentTimeMillis() - startTime);

        cache.store(cacheKey, index);
        return index;
    }
}
