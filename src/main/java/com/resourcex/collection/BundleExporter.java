package com.resourcex.collection;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.model.BundleFile;
import com.resourcex.model.SiteBundle;
import com.resourcex.model.SiteRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes site bundles as SAM resource files:
 * <pre>
 * Location ID,Latitude,Longitude,State,Time Zone      site header
 * 12,40.0,-105.0,CO,-7                                site values
 * Year,Month,Day,Hour,Minute,ghi,temperature          data header
 * 2012,1,1,0,0,0.0,-3.5                               one row per time step
 * </pre>
 */
public class BundleExporter {

    private static final Logger logger = LoggerFactory.getLogger(BundleExporter.class);

    public static final String EXTENSION = ".csv";
    public static final String GID_COLUMN = "gid";
    public static final List<String> TIME_COLUMNS = List.of("Year", "Month", "Day", "Hour", "Minute");

    /**
     * Export a bundle. A destination not ending in {@code .csv} is taken as
     * an existing directory and the file is named after the bundle.
     *
     * @return the file written
     */
    public Path export(SiteBundle bundle, Path destination) throws IOException {
        Path out = resolveTarget(bundle, destination);

        try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            writeData(bundle, writer);
        }
        prependSiteHeader(out, bundle.getSite());

        logger.info("Exported bundle {} ({} time steps, variables {}) to {}",
                bundle.getName(), bundle.getTimeIndex().size(), bundle.getVariables().keySet(), out);
        return out;
    }

    Path resolveTarget(SiteBundle bundle, Path destination) {
        if (destination == null) {
            throw new InvalidInputException("Export destination must not be null");
        }
        if (destination.getFileName() != null
                && destination.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                throw new InvalidInputException("Export directory does not exist: " + parent);
            }
            return destination;
        }
        if (!Files.isDirectory(destination)) {
            throw new InvalidInputException("Export destination is not a directory: " + destination);
        }
        return destination.resolve(bundle.getName() + EXTENSION);
    }

    private static void writeData(SiteBundle bundle, Writer writer) throws IOException {
        CSVWriter csv = new CSVWriter(writer);
        List<String> header = new ArrayList<>(TIME_COLUMNS);
        header.addAll(bundle.getVariables().keySet());
        csv.writeNext(header.toArray(new String[0]), false);

        List<double[]> columns = new ArrayList<>(bundle.getVariables().values());
        List<Instant> timeIndex = bundle.getTimeIndex();
        for (int t = 0; t < timeIndex.size(); t++) {
            ZonedDateTime time = timeIndex.get(t).atZone(ZoneOffset.UTC);
            String[] row = new String[TIME_COLUMNS.size() + columns.size()];
            row[0] = String.valueOf(time.getYear());
            row[1] = String.valueOf(time.getMonthValue());
            row[2] = String.valueOf(time.getDayOfMonth());
            row[3] = String.valueOf(time.getHour());
            row[4] = String.valueOf(time.getMinute());
            for (int c = 0; c < columns.size(); c++) {
                row[TIME_COLUMNS.size() + c] = String.valueOf(columns.get(c)[t]);
            }
            csv.writeNext(row, false);
        }
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("Failed writing bundle " + bundle.getName());
        }
    }

    /**
     * Rewrite the file with the two site header lines in front of the data.
     */
    private static void prependSiteHeader(Path file, SiteRecord site) throws IOException {
        Map<String, String> header = siteHeader(site);
        StringWriter lines = new StringWriter();
        CSVWriter csv = new CSVWriter(lines);
        csv.writeNext(header.keySet().toArray(new String[0]), false);
        csv.writeNext(header.values().toArray(new String[0]), false);
        csv.flush();

        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, lines + content, StandardCharsets.UTF_8);
    }

    /**
     * Site attributes renamed for the SAM header. The gid leads as
     * "Location ID" unless the table carries its own gid column.
     */
    public static Map<String, String> siteHeader(SiteRecord site) {
        Map<String, String> header = new LinkedHashMap<>();
        if (!site.getAttributes().containsKey(GID_COLUMN)) {
            header.put(headerName(GID_COLUMN), String.valueOf(site.getGid()));
        }
        for (Map.Entry<String, Object> entry : site.getAttributes().entrySet()) {
            Object value = entry.getValue();
            header.put(headerName(entry.getKey()), value == null ? "" : String.valueOf(value));
        }
        return header;
    }

    static String headerName(String column) {
        if ("timezone".equals(column)) {
            return "Time Zone";
        }
        if (GID_COLUMN.equals(column)) {
            return "Location ID";
        }
        if (column.isEmpty()) {
            return column;
        }
        return column.substring(0, 1).toUpperCase(Locale.ROOT) + column.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Read an exported bundle file back.
     */
    public BundleFile read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            String[] names = csv.readNext();
            String[] values = csv.readNext();
            String[] columns = csv.readNext();
            if (names == null || values == null || columns == null) {
                throw new IOException("Bundle file is missing header lines: " + file);
            }

            Map<String, String> site = new LinkedHashMap<>();
            for (int i = 0; i < names.length; i++) {
                site.put(names[i], i < values.length ? values[i] : "");
            }

            List<String[]> rows = new ArrayList<>();
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length != columns.length) {
                    throw new IOException(String.format("Bundle file %s row %d has %d fields, expected %d",
                            file, rows.size() + 4, row.length, columns.length));
                }
                rows.add(row);
            }

            List<Instant> timeIndex = new ArrayList<>(rows.size());
            for (String[] r : rows) {
                timeIndex.add(LocalDateTime.of(Integer.parseInt(r[0]), Integer.parseInt(r[1]),
                        Integer.parseInt(r[2]), Integer.parseInt(r[3]), Integer.parseInt(r[4]))
                        .toInstant(ZoneOffset.UTC));
            }

            Map<String, double[]> variables = new LinkedHashMap<>();
            for (int c = TIME_COLUMNS.size(); c < columns.length; c++) {
                double[] series = new double[rows.size()];
                for (int t = 0; t < rows.size(); t++) {
                    series[t] = Double.parseDouble(rows.get(t)[c]);
                }
                variables.put(columns[c], series);
            }

            return BundleFile.builder()
                    .site(site)
                    .columns(List.of(columns))
                    .timeIndex(timeIndex)
                    .variables(variables)
                    .build();
        } catch (CsvValidationException | NumberFormatException e) {
            throw new IOException("Malformed bundle file " + file + ": " + e.getMessage(), e);
        }
    }
}
