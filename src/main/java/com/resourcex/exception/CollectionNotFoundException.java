package com.resourcex.exception;

public class CollectionNotFoundException extends ResourceNotFoundException {

    public CollectionNotFoundException(String name) {
        super("Collection not open: " + name);
    }
}
