package com.resourcex.model;

import com.resourcex.exception.SiteNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable site metadata table. A site's gid is its row position and is the
 * join key into the site axis of every dataset.
 */
public final class SiteTable {

    private final List<String> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> columnIndex;

    private SiteTable(List<String> columns, List<List<Object>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.columnIndex = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (columnIndex.put(columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate site table column: " + columns.get(i));
            }
        }

        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Site table row %d has %d values, expected %d", r, row.size(), columns.size()));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static SiteTable of(List<String> columns, List<List<Object>> rows) {
        return new SiteTable(columns, rows);
    }

    /**
     * Build a table from per-site attribute maps. Columns are the union of
     * all keys in first-seen order; absent attributes are null.
     */
    public static SiteTable fromRecords(List<? extends Map<String, ?>> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            columns.addAll(record.keySet());
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(record.get(column));
            }
            rows.add(row);
        }
        return new SiteTable(new ArrayList<>(columns), rows);
    }

    /**
     * Concatenate tables along the site axis. All parts must share the same columns.
     */
    public static SiteTable concat(List<SiteTable> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        List<String> columns = parts.get(0).getColumns();
        List<List<Object>> rows = new ArrayList<>();
        for (SiteTable part : parts) {
            if (!part.getColumns().equals(columns)) {
                throw new IllegalArgumentException("Site table columns differ: " + columns + " vs " + part.getColumns());
            }
            rows.addAll(part.rows);
        }
        return new SiteTable(columns, rows);
    }

    public int size() {
        return rows.size();
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public void checkGid(int gid) {
        if (gid < 0 || gid >= rows.size()) {
            throw new SiteNotFoundException(gid, rows.size());
        }
    }

    public Object value(int gid, String column) {
        checkGid(gid);
        Integer c = columnIndex.get(column);
        if (c == null) {
            throw new IllegalArgumentException("No such site table column: " + column);
        }
        return rows.get(gid).get(c);
    }

    /**
     * All values of one column in gid order, or empty if the column does not exist.
     */
    public Optional<List<Object>> column(String column) {
        Integer c = columnIndex.get(column);
        if (c == null) {
            return Optional.empty();
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(c));
        }
        return Optional.of(values);
    }

    public SiteRecord record(int gid) {
        checkGid(gid);
        Map<String, Object> attributes = new LinkedHashMap<>();
        List<Object> row = rows.get(gid);
        for (int c = 0; c < columns.size(); c++) {
            attributes.put(columns.get(c), row.get(c));
        }
        return new SiteRecord(gid, attributes);
    }

    /**
     * First column whose name starts with the given prefix, ignoring case.
     */
    public Optional<String> findColumn(String prefix) {
        String p = prefix.toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.toLowerCase(Locale.ROOT).startsWith(p))
                .findFirst();
    }

    /**
     * (latitude, longitude) per site, from the first "lat*" and "lon*" columns.
     */
    public double[][] latLon() {
        String latColumn = findColumn("lat").orElseThrow(
                () -> new IllegalStateException("Site table has no latitude column: " + columns));
        String lonColumn = findColumn("lon").orElseThrow(
                () -> new IllegalStateException("Site table has no longitude column: " + columns));
        int latIdx = columnIndex.get(latColumn);
        int lonIdx = columnIndex.get(lonColumn);

        double[][] latLon = new double[rows.size()][];
        for (int gid = 0; gid < rows.size(); gid++) {
            List<Object> row = rows.get(gid);
            latLon[gid] = new double[] {toDouble(row.get(latIdx)), toDouble(row.get(lonIdx))};
        }
        return latLon;
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            return Double.NaN;
        }
        return Double.parseDouble(value.toString());
    }

    @Override
    public String toString() {
        return "SiteTable(sites=" + rows.size() + ", columns=" + columns + ")";
    }
}
