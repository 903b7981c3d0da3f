package com.cellbroker.queue;

import com.cellbroker.exception.QueueException;
import com.cellbroker.model.Queue;

/**
 * Creates subscriptions on the queue service.
 */
public interface QueueClient {

    /**
     * @throws QueueException if the queue is incomplete or the subscription cannot be created
     */
    QueueSubscription subscribe(Queue queue) throws QueueException;
}
