package com.cellbroker.exception;

/**
 * The tenant exists but its decouple queue has no topic yet.
 */
public class IncompleteConfigException extends RuntimeException {

    public IncompleteConfigException(String message) {
        super(message);
    }
}
