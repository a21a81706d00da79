package com.resourcex.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens one storage file as a {@link ResourceStore}.
 */
public interface ResourceStoreReader {

    /**
     * Check if this reader understands the given file
     */
    boolean supports(Path file);

    ResourceStore open(Path file) throws IOException;
}
