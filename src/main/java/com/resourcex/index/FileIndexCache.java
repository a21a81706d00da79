package com.resourcex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Keeps one serialized {@link CoordinateIndex} per key in a directory.
 * Entries are written to a temp file and moved into place, so a concurrent
 * reader sees a complete file or none. Read and write failures are logged
 * and reported as cache misses.
 */
public class FileIndexCache implements IndexCache, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(FileIndexCache.class);

    private static final ObjectInputFilter INDEX_CLASSES = ObjectInputFilter.Config.createFilter(
            "maxdepth=200;com.resourcex.index.*;org.locationtech.jts.**;java.**;!*");

    private final Path directory;
    private final boolean ownsDirectory;

    private FileIndexCache(Path directory, boolean ownsDirectory) {
        this.directory = directory;
        this.ownsDirectory = ownsDirectory;
    }

    /**
     * Cache in an existing or creatable directory that outlives this instance.
     */
    public static FileIndexCache inDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create index cache directory " + directory, e);
        }
        logger.info("Coordinate index cache at {}", directory);
        return new FileIndexCache(directory, false);
    }

    /**
     * Cache in a fresh temp directory, removed again by {@link #close()}.
     */
    public static FileIndexCache temporary() {
        try {
            Path directory = Files.createTempDirectory("resourcex-trees");
            logger.info("Coordinate index cache at temporary {}", directory);
            return new FileIndexCache(directory, true);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temporary index cache directory", e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathOf(String key) {
        return directory.resolve(key);
    }

    @Override
    public CacheLookup load(String key) {
        Path file = pathOf(key);
        if (!Files.isRegularFile(file)) {
            return CacheLookup.miss(key);
        }

        try (InputStream raw = Files.newInputStream(file);
             ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(raw))) {
            in.setObjectInputFilter(INDEX_CLASSES);
            Object value = in.readObject();
            if (!(value instanceof CoordinateIndex)) {
                String type = value == null ? "null" : value.getClass().getName();
                logger.warn("Could not extract tree from {}: unexpected content {}", file, type);
                return CacheLookup.degraded(key, "unexpected content " + type);
            }
            logger.debug("Loaded coordinate index from {}", file);
            return CacheLookup.hit(key, (CoordinateIndex) value);
        } catch (NoSuchFileException e) {
            // removed between the existence check and the open
            return CacheLookup.miss(key);
        } catch (IOException | ClassNotFoundException | RuntimeException e) {
            logger.warn("Could not extract tree from {}: {}", file, e.toString());
            return CacheLookup.degraded(key, e.toString());
        }
    }

    @Override
    public boolean store(String key, CoordinateIndex index) {
        Path target = pathOf(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, key, ".tmp");
            try (OutputStream raw = Files.newOutputStream(temp);
                 ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(raw))) {
                out.writeObject(index);
            }
            move(temp, target);
            logger.debug("Saved coordinate index to {}", target);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not save tree to {}: {}", target, e.toString());
            deleteQuietly(temp);
            return false;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void invalidate(String key) {
        deleteQuietly(pathOf(key));
    }

    /**
     * Removes the directory when it was created by {@link #temporary()}.
     */
    @Override
    public void close() {
        if (!ownsDirectory || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(FileIndexCache::deleteQuietly);
        } catch (IOException e) {
            logger.warn("Could not remove index cache directory {}: {}", directory, e.toString());
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}: {}", path, e.toString());
        }
    }
}
