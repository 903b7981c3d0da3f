package com.cellbroker.queue;

import com.cellbroker.config.BrokerProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Caller-supplied flow control for a publish.
 *
 *   bufferedByteLimit → largest encoded event the publisher will buffer
 *   timeout           → how long a publish call waits for the queue service
 *
 * Batching (cellbroker.ingress.publish.byte-threshold and delay-threshold) is a
 * property of the shared Kafka producer and is set once in KafkaQueueConfig.
 */
@Value
@Builder(toBuilder = true)
public class PublishSettings {

    public static final PublishSettings DEFAULT = PublishSettings.from(new BrokerProperties.Publish());

    int bufferedByteLimit;
    Duration timeout;

    public static PublishSettings from(BrokerProperties.Publish publish) {
        return PublishSettings.builder()
                .bufferedByteLimit(publish.getBufferedByteLimit())
                .timeout(publish.getTimeout())
                .build();
    }
}
