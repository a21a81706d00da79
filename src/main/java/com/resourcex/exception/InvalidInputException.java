package com.resourcex.exception;

/**
 * Malformed caller input: bad coordinate shapes, unparseable timestamps,
 * missing export destinations. Never retried.
 */
public class InvalidInputException extends ResourceException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
