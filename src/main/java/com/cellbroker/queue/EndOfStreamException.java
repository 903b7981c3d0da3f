package com.cellbroker.queue;

import com.cellbroker.exception.QueueException;

/**
 * The subscription was closed; no further messages will arrive.
 */
public class EndOfStreamException extends QueueException {

    public EndOfStreamException(String message) {
        super(message);
    }
}
