package com.cellbroker.exception;

/**
 * Processing of an event failed. Thrown out of a processor chain, it makes the
 * handler nack the message so the queue service redelivers it.
 */
public class ProcessingException extends Exception {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
