package com.cellbroker.queue;

import com.cellbroker.config.BrokerProperties;
import com.cellbroker.exception.QueueException;
import com.cellbroker.model.Queue;
import lombok.RequiredArgsConstructor;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Maps a {@link Queue} onto Kafka: the topic is the Kafka topic and the
 * subscription is the consumer group. Records a subscription gives up on go to
 * the topic's dead-letter topic through {@code deadLetterTemplate}.
 */
@RequiredArgsConstructor
public class KafkaQueueClient implements QueueClient {

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final KafkaTemplate<String, byte[]> deadLetterTemplate;
    private final BrokerProperties.QueueSettings settings;

    @Override
    public QueueSubscription subscribe(Queue queue) throws QueueException {
        if (queue == null || !queue.hasTopic()) {
            throw new QueueException("queue has no topic");
        }
        if (queue.getSubscription() == null || queue.getSubscription().isBlank()) {
            throw new QueueException("queue on topic " + queue.getTopic() + " has no subscription");
        }
        return new KafkaQueueSubscription(consumerFactory, deadLetterTemplate,
                queue.getTopic(), queue.getSubscription(), settings);
    }
}
