package com.cellbroker.exception;

/**
 * An HTTP delivery was not acknowledged: transport error, timeout or non-2xx status.
 */
public class DeliveryException extends Exception {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
