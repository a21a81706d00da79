package com.resourcex.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resourcex.ResourceFixtures;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonResourceStoreReaderTest {

    private final JsonResourceStoreReader reader = new JsonResourceStoreReader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void testOpenResourceFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("nsrdb_2012.json"), ResourceFixtures.solarJson(2012, 0));

        try (ResourceStore store = reader.open(file)) {
            assertEquals("nsrdb_2012.json", store.getSourceName());
            assertEquals(3, store.getSiteTable().size());
            assertEquals(3, store.getTimeAxis().size());
            assertEquals(Instant.parse("2012-01-01T01:00:00Z"), store.getTimeAxis().get(1));
            assertEquals(ResourceFixtures.SOLAR_DATASETS, List.copyOf(store.getDatasets()));

            assertEquals("WY", store.getSiteTable().value(1, "state"));
            assertEquals(-7L, store.getSiteTable().value(1, "timezone"));
            assertEquals(41.0, store.getSiteTable().value(1, "latitude"));

            double[][] block = store.read("air_temperature", new int[] {1}, new int[] {2});
            assertEquals(ResourceFixtures.value("air_temperature", 2012, 1, 2), block[0][0]);
            assertTrue(store.getCoordinates().isEmpty());
        }
    }

    @Test
    void testCoordinatesField() throws IOException {
        String json = "{\"meta\":[{\"site\":\"a\"},{\"site\":\"b\"}],"
                + "\"time_index\":[\"2012-01-01 00:00\"],"
                + "\"coordinates\":[[40.0,-105.0],[41.0,-105.5]],"
                + "\"datasets\":{\"ghi\":[[1.5,null]]}}";
        Path file = Files.writeString(tempDir.resolve("sites.json"), json);

        try (ResourceStore store = reader.open(file)) {
            assertArrayEquals(new double[] {41.0, -105.5}, store.getCoordinates().orElseThrow()[1]);
            double[][] block = store.read("ghi", new int[] {0}, new int[] {0, 1});
            assertEquals(1.5, block[0][0]);
            assertTrue(Double.isNaN(block[0][1]));
        }
    }

    @Test
    void testMalformedFilesAreIOExceptions() throws IOException {
        Path noMeta = Files.writeString(tempDir.resolve("no_meta.json"), "{\"time_index\":[]}");
        Path notObject = Files.writeString(tempDir.resolve("array.json"), "[1, 2]");
        Path badShape = Files.writeString(tempDir.resolve("shape.json"),
                "{\"meta\":[{\"latitude\":1,\"longitude\":2}],\"time_index\":[\"2012-01-01\"],"
                        + "\"datasets\":{\"ghi\":[[1.0,2.0]]}}");

        assertThrows(IOException.class, () -> reader.open(noMeta));
        assertThrows(IOException.class, () -> reader.open(notObject));
        assertThrows(IOException.class, () -> reader.open(badShape));
    }

    @Test
    void testBadTimeIndexIsIOException() throws IOException {
        Path backwards = Files.writeString(tempDir.resolve("backwards.json"),
                "{\"meta\":[{\"latitude\":1,\"longitude\":2}],"
                        + "\"time_index\":[\"2012-01-01 01:00\",\"2012-01-01 00:00\"],"
                        + "\"datasets\":{\"ghi\":[[1.0],[2.0]]}}");
        Path unparseable = Files.writeString(tempDir.resolve("garbled.json"),
                "{\"meta\":[{\"latitude\":1,\"longitude\":2}],"
                        + "\"time_index\":[\"yesterday\"],"
                        + "\"datasets\":{\"ghi\":[[1.0]]}}");

        assertThrows(IOException.class, () -> reader.open(backwards));
        assertThrows(IOException.class, () -> reader.open(unparseable));
    }

    @Test
    void testCoordinateRowsMustBePairs() throws IOException {
        Path file = Files.writeString(tempDir.resolve("short_row.json"),
                "{\"meta\":[{\"site\":\"a\"},{\"site\":\"b\"}],"
                        + "\"time_index\":[\"2012-01-01 00:00\"],"
                        + "\"coordinates\":[[40.0,-105.0],[41.0]],"
                        + "\"datasets\":{\"ghi\":[[1.0,2.0]]}}");

        assertThrows(IOException.class, () -> reader.open(file));
    }

    @Test
    void testSupportsJsonFilesOnly() {
        assertTrue(reader.supports(Path.of("nsrdb_2012.json")));
        assertTrue(reader.supports(Path.of("NSRDB_2012.JSON")));
        assertFalse(reader.supports(Path.of("nsrdb_2012.h5")));
    }
}
