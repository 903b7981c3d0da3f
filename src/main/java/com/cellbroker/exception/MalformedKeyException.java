package com.cellbroker.exception;

/**
 * A tenant or target key string could not be parsed.
 */
public class MalformedKeyException extends IllegalArgumentException {

    public MalformedKeyException(String message) {
        super(message);
    }

    public MalformedKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
