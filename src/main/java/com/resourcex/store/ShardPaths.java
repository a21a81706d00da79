package com.resourcex.store;

import com.resourcex.exception.InvalidInputException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves resource paths to shard files and pulls years out of file names.
 * Supported forms: {@code /dir/file.json}, {@code /dir/} and
 * {@code /dir/prefix*suffix}.
 */
public final class ShardPaths {

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

    private ShardPaths() {
    }

    /**
     * @return matching files sorted by name, never empty
     */
    public static List<Path> resolve(String resourcePath) {
        if (resourcePath == null || resourcePath.isBlank()) {
            throw new InvalidInputException("Resource path must not be empty");
        }

        Path path = Paths.get(resourcePath);
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        List<Path> files = new ArrayList<>();
        try {
            if (fileName.contains("*")) {
                Path dir = path.getParent() == null ? Paths.get(".") : path.getParent();
                if (!Files.isDirectory(dir)) {
                    throw new InvalidInputException("No such directory: " + dir);
                }
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, fileName)) {
                    stream.forEach(p -> {
                        if (Files.isRegularFile(p)) {
                            files.add(p);
                        }
                    });
                }
            } else if (Files.isDirectory(path)) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
                    stream.forEach(p -> {
                        if (Files.isRegularFile(p) && !p.getFileName().toString().startsWith(".")) {
                            files.add(p);
                        }
                    });
                }
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + resourcePath, e);
        }

        if (files.isEmpty()) {
            throw new InvalidInputException("No resource files match " + resourcePath);
        }
        Collections.sort(files);
        return files;
    }

    /**
     * First 4-digit year token (19xx or 20xx) in the name that is not part
     * of a longer digit run.
     */
    public static OptionalInt parseYear(String name) {
        Matcher m = YEAR.matcher(name);
        return m.find() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
    }

    /**
     * Start index of the year token, or -1.
     */
    public static int yearIndex(String name) {
        Matcher m = YEAR.matcher(name);
        return m.find() ? m.start(1) : -1;
    }
}
