package com.resourcex.exception;

/**
 * Base class for failures raised while querying a resource collection.
 * Index cache problems never surface as a ResourceException; they are
 * recovered by rebuilding the index.
 */
public class ResourceException extends RuntimeException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
