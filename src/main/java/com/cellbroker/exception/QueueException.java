package com.cellbroker.exception;

/**
 * A queue subscription or publisher failed to talk to the queue service.
 */
public class QueueException extends Exception {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
