package com.resourcex.exception;

/**
 * Shards of one logical collection disagree on a shared axis: temporal
 * shards with different site tables, or spatial shards with different
 * time axes.
 */
public class ShardInconsistencyException extends ResourceException {

    public ShardInconsistencyException(String message) {
        super(message);
    }
}
