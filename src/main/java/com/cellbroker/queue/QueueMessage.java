package com.cellbroker.queue;

import com.cellbroker.exception.QueueException;

/**
 * One message pulled from a {@link QueueSubscription}.
 *
 * finish(null)  → ack: the queue service will not deliver it again
 * finish(error) → nack: the queue service redelivers it according to its own policy
 * never finished → the queue service redelivers it once its ack deadline passes
 */
public interface QueueMessage {

    String getId();

    byte[] getPayload();

    void finish(Throwable error) throws QueueException;
}
