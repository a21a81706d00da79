package com.resourcex.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resourcex.exception.InvalidInputException;
import com.resourcex.locator.TimestampParser;
import com.resourcex.model.SiteTable;
import com.resourcex.model.TimeAxis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a resource file laid out as
 * <pre>
 * {
 *   "meta":        [ {"latitude": 40.0, "longitude": -105.0, "state": "CO"}, ... ],
 *   "time_index":  [ "2012-01-01T00:00:00Z", ... ],
 *   "coordinates": [ [40.0, -105.0], ... ],          (optional)
 *   "datasets":    { "ghi": [ [t0s0, t0s1, ...], ... ] }
 * }
 * </pre>
 */
public class JsonResourceStoreReader implements ResourceStoreReader {

    private static final Logger logger = LoggerFactory.getLogger(JsonResourceStoreReader.class);

    private final ObjectMapper objectMapper;

    public JsonResourceStoreReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    @Override
    public ResourceStore open(Path file) throws IOException {
        logger.debug("Opening resource file {}", file);
        long startTime = System.currentTimeMillis();

        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Not a resource file (expected a JSON object): " + file);
        }

        SiteTable siteTable;
        TimeAxis timeAxis;
        try {
            siteTable = readMeta(require(root, "meta", file), file);
            timeAxis = readTimeIndex(require(root, "time_index", file));
        } catch (IllegalArgumentException | InvalidInputException e) {
            throw new IOException("Malformed resource file " + file + ": " + e.getMessage(), e);
        }

        InMemoryResourceStore.Builder builder = InMemoryResourceStore.builder()
                .sourceName(file.getFileName().toString())
                .siteTable(siteTable)
                .timeAxis(timeAxis);

        if (root.hasNonNull("coordinates")) {
            builder.coordinates(readMatrix(root.get("coordinates"), "coordinates", file));
        }

        JsonNode datasets = root.path("datasets");
        var fieldsIterator = datasets.fields();
        while (fieldsIterator.hasNext()) {
            var entry = fieldsIterator.next();
            builder.dataset(entry.getKey(), readMatrix(entry.getValue(), entry.getKey(), file));
        }

        InMemoryResourceStore store;
        try {
            store = builder.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Inconsistent resource file " + file + ": " + e.getMessage(), e);
        }

        logger.info("Opened {} with {} sites, {} time steps, datasets {} in {}ms",
                file.getFileName(), siteTable.size(), timeAxis.size(), store.getDatasets(),
                System.currentTimeMillis() - startTime);
        return store;
    }

    private static JsonNode require(JsonNode root, String field, Path file) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new IOException("Resource file " + file + " has no '" + field + "' array");
        }
        return node;
    }

    private static SiteTable readMeta(JsonNode meta, Path file) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        for (JsonNode site : meta) {
            if (!site.isObject()) {
                throw new IOException("Site records in " + file + " must be JSON objects");
            }
            Map<String, Object> record = new LinkedHashMap<>();
            site.fields().forEachRemaining(entry -> record.put(entry.getKey(), toValue(entry.getValue())));
            records.add(record);
        }
        return SiteTable.fromRecords(records);
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        return node.asText();
    }

    private static TimeAxis readTimeIndex(JsonNode timeIndex) {
        List<Instant> instants = new ArrayList<>(timeIndex.size());
        for (JsonNode node : timeIndex) {
            instants.add(TimestampParser.parse(node.asText()));
        }
        return TimeAxis.of(instants);
    }

    private static double[][] readMatrix(JsonNode node, String name, Path file) throws IOException {
        if (!node.isArray()) {
            throw new IOException("'" + name + "' in " + file + " must be a 2-d array");
        }
        double[][] matrix = new double[node.size()][];
        for (int r = 0; r < node.size(); r++) {
            JsonNode row = node.get(r);
            if (!row.isArray()) {
                throw new IOException("'" + name + "' in " + file + " must be a 2-d array");
            }
            matrix[r] = new double[row.size()];
            for (int c = 0; c < row.size(); c++) {
                JsonNode value = row.get(c);
                matrix[r][c] = value.isNull() ? Double.NaN : value.asDouble();
            }
        }
        return matrix;
    }
}
