package com.resourcex.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code resourcex} prefix
 */
@Data
@ConfigurationProperties(prefix = "resourcex")
public class ResourceXProperties {

    /**
     * Directory for cached coordinate indexes. A temporary directory that
     * lives as long as the application is used when unset.
     */
    private String cacheDir;

    /**
     * Check that the shards of multi-file and multi-year collections agree
     * on their shared axis when a collection is opened.
     */
    private boolean validateShards = true;

    /**
     * Site table column used for region queries when the caller names none.
     */
    private String defaultRegionColumn = "state";
}
