package com.resourcex.exception;

import lombok.Getter;

@Getter
public class DatasetNotFoundException extends ResourceNotFoundException {

    private final String dataset;

    public DatasetNotFoundException(String dataset, String source) {
        super("Dataset '" + dataset + "' not found in " + source);
        this.dataset = dataset;
    }
}
