package com.jreinhal.quarry.exception;

/**
 * Raised for an empty question or an unrecognized tag, before the chunk store is queried.
 */
public class InvalidQueryException extends RuntimeException {
    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
