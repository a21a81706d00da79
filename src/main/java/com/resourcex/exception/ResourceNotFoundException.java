package com.resourcex.exception;

/**
 * A key handed to a collection (dataset, site, timestep, collection name)
 * does not exist. An empty region is not a not-found condition.
 */
public class ResourceNotFoundException extends ResourceException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
