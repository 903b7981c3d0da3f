package com.cellbroker.queue;

import com.cellbroker.exception.QueueException;

/**
 * At-least-once pull subscription on one queue.
 *
 * open() runs the inbound side (fetching from the queue service) on the calling
 * thread and only returns once the subscription is closed or breaks; any number
 * of threads may call receive() meanwhile.
 */
public interface QueueSubscription extends AutoCloseable {

    /**
     * Blocks until the subscription is closed. Returns normally on close() and
     * throws when the inbound side fails.
     */
    void open() throws QueueException;

    /**
     * Blocks until the next message is available.
     *
     * @throws EndOfStreamException once the subscription is closed
     */
    QueueMessage receive() throws QueueException, InterruptedException;

    boolean isOpen();

    @Override
    void close();
}
