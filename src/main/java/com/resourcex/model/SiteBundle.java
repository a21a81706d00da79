package com.resourcex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Variables for one site on a shared time index, plus the site's metadata
 * record. Built for export and not kept afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteBundle {

    /** File stem used when exporting into a directory, e.g. {@code SAM-12}. */
    private String name;
    private int gid;
    private List<Instant> timeIndex;

    /** Variable name to values, in export column order. */
    private Map<String, double[]> variables;
    private SiteRecord site;
}
