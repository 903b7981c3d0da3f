package com.cellbroker.exception;

/**
 * Bytes or headers could not be turned into an event.
 */
public class EventFormatException extends Exception {

    public EventFormatException(String message) {
        super(message);
    }

    public EventFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
