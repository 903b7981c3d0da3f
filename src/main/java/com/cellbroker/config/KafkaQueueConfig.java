package com.cellbroker.config;

import com.cellbroker.event.EventCodec;
import com.cellbroker.queue.KafkaQueueClient;
import com.cellbroker.queue.KafkaQueuePublisher;
import com.cellbroker.queue.QueueClient;
import com.cellbroker.queue.QueuePublisher;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.Map;

/**
 * Wires the queue service (Kafka) for the data plane.
 *
 * Connection settings come from the standard spring.kafka.* properties; this class
 * only pins what the broker relies on:
 *   - raw byte[] values (events are encoded by EventCodec)
 *   - manual offset commits (KafkaQueueSubscription acks per message)
 *   - producer batching from cellbroker.ingress.publish
 */
@Configuration
public class KafkaQueueConfig {

    @Bean
    public ProducerFactory<String, byte[]> eventProducerFactory(KafkaProperties kafkaProperties,
                                                                BrokerProperties properties) {
        Map<String, Object> props = kafkaProperties.buildProducerProperties(null);
        BrokerProperties.Publish publish = properties.getIngress().getPublish();
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, publish.getByteThreshold());
        props.put(ProducerConfig.LINGER_MS_CONFIG, (int) publish.getDelayThreshold().toMillis());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, byte[]> eventKafkaTemplate(ProducerFactory<String, byte[]> eventProducerFactory) {
        return new KafkaTemplate<>(eventProducerFactory);
    }

    @Bean
    public ConsumerFactory<String, byte[]> eventConsumerFactory(KafkaProperties kafkaProperties) {
        Map<String, Object> props = kafkaProperties.buildConsumerProperties(null);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.putIfAbsent(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public QueueClient queueClient(ConsumerFactory<String, byte[]> eventConsumerFactory,
                                   KafkaTemplate<String, byte[]> eventKafkaTemplate,
                                   BrokerProperties properties) {
        return new KafkaQueueClient(eventConsumerFactory, eventKafkaTemplate, properties.getQueue());
    }

    @Bean
    public QueuePublisher queuePublisher(KafkaTemplate<String, byte[]> eventKafkaTemplate, EventCodec eventCodec) {
        return new KafkaQueuePublisher(eventKafkaTemplate, eventCodec);
    }
}
