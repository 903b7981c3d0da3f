package com.cellbroker.queue;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.PublishException;

/**
 * Publishes events to queue topics. Calls block until the queue service has
 * accepted the event or the publish has failed.
 */
public interface QueuePublisher {

    void publish(String topic, BrokerEvent event, PublishSettings settings) throws PublishException;
}
