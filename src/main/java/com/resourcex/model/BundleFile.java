package com.resourcex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Contents of an exported bundle file read back from disk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundleFile {

    /** Site header line names to values, in file order. */
    private Map<String, String> site;

    /** Data column header, time columns included. */
    private List<String> columns;
    private List<Instant> timeIndex;
    private Map<String, double[]> variables;
}
