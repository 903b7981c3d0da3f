package com.cellbroker.queue;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.EventCodec;
import com.cellbroker.exception.EventFormatException;
import com.cellbroker.exception.PublishException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes events to Kafka topics as JSON, keyed by event id.
 *
 * FLOW:
 *   encode event → check buffered byte limit → KafkaTemplate.send()
 *                → wait for the broker ack (bounded by the settings' timeout)
 *
 * Every failure is surfaced to the caller as a PublishException.
 */
@RequiredArgsConstructor
@Slf4j
public class KafkaQueuePublisher implements QueuePublisher {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final EventCodec eventCodec;

    @Override
    public void publish(String topic, BrokerEvent event, PublishSettings settings) throws PublishException {
        byte[] payload;
        try {
            payload = eventCodec.encode(event);
        } catch (EventFormatException e) {
            throw new PublishException(e.getMessage(), e);
        }
        if (payload.length > settings.getBufferedByteLimit()) {
            throw new PublishException(String.format(
                    "publisher reached buffered byte limit: event %s is %d bytes, limit is %d",
                    event.getId(), payload.length, settings.getBufferedByteLimit()));
        }

        try {
            kafkaTemplate.send(topic, event.getId(), payload)
                    .get(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published event to topic={}: eventId={}", topic, event.getId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new PublishException("failed to publish to " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new PublishException("timed out publishing to " + topic + " after " + settings.getTimeout(), e);
        } catch (RuntimeException e) {
            throw new PublishException("failed to publish to " + topic + ": " + e.getMessage(), e);
        }
    }
}
