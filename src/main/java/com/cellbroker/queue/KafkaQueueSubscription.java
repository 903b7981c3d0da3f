package com.cellbroker.queue;

import com.cellbroker.config.BrokerProperties;
import com.cellbroker.exception.QueueException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka-backed pull subscription with per-message ack/nack.
 *
 * Kafka only tracks one committed offset per partition, so this class keeps the
 * bookkeeping that turns it into an at-least-once queue:
 *
 *   - One poll thread (the caller of open()) owns the KafkaConsumer and fills a
 *     bounded buffer; workers take messages from the buffer with receive().
 *   - Every fetched offset stays "in flight" until its message is finished.
 *     The committed offset of a partition never passes the lowest in-flight offset.
 *   - A nack pauses the partition and seeks it back to the nacked offset (after
 *     the configured redelivery delay), so the message and everything after it
 *     is fetched again.
 *   - A received message holds a lease of ack-deadline. When the lease runs out
 *     before the message is finished, the same record is delivered again in place.
 *     After max-delivery-attempts deliveries the record is copied to the
 *     dead-letter topic (topic + dead-letter-suffix) and stops holding back commits.
 *   - A full buffer pauses the whole assignment until workers catch up.
 *
 * Duplicates are possible (at-least-once); losses are not.
 */
@Slf4j
public class KafkaQueueSubscription implements QueueSubscription {

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final KafkaTemplate<String, byte[]> deadLetterTemplate;
    private final String topic;
    private final String groupId;
    private final BrokerProperties.QueueSettings settings;

    private final BlockingQueue<KafkaMessage> buffer = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Guarded by itself.
    private final Map<TopicPartition, PartitionState> partitions = new HashMap<>();

    private volatile Consumer<String, byte[]> consumer;
    private boolean backpressured;

    public KafkaQueueSubscription(ConsumerFactory<String, byte[]> consumerFactory,
                                  KafkaTemplate<String, byte[]> deadLetterTemplate,
                                  String topic,
                                  String groupId,
                                  BrokerProperties.QueueSettings settings) {
        this.consumerFactory = consumerFactory;
        this.deadLetterTemplate = deadLetterTemplate;
        this.topic = topic;
        this.groupId = groupId;
        this.settings = settings;
    }

    @Override
    public void open() throws QueueException {
        if (!started.compareAndSet(false, true)) {
            throw new QueueException("subscription " + groupId + " on " + topic + " was already opened");
        }
        if (closed.get()) {
            return;
        }
        try (Consumer<String, byte[]> c = consumerFactory.createConsumer(groupId, null)) {
            consumer = c;
            if (closed.get()) {
                return;
            }
            c.subscribe(List.of(topic), new RebalanceListener());
            log.info("Subscribed: topic={} group={}", topic, groupId);

            while (!closed.get()) {
                applyPendingActions(c);
                ConsumerRecords<String, byte[]> records = c.poll(settings.getPollTimeout());
                for (ConsumerRecord<String, byte[]> record : records) {
                    enqueue(record);
                }
                if (!backpressured && buffer.size() >= settings.getMaxBufferedRecords()) {
                    c.pause(c.assignment());
                    backpressured = true;
                }
            }
        } catch (WakeupException e) {
            if (!closed.get()) {
                throw new QueueException("subscription " + groupId + " on " + topic + " was woken up unexpectedly", e);
            }
        } catch (KafkaException e) {
            throw new QueueException("subscription " + groupId + " on " + topic + " failed: " + e.getMessage(), e);
        } finally {
            closed.set(true);
            consumer = null;
            buffer.clear();
            synchronized (partitions) {
                partitions.clear();
            }
            log.info("Subscription closed: topic={} group={}", topic, groupId);
        }
    }

    @Override
    public QueueMessage receive() throws QueueException, InterruptedException {
        long pollMillis = Math.max(1, settings.getPollTimeout().toMillis());
        while (true) {
            if (closed.get()) {
                throw new EndOfStreamException("subscription " + groupId + " on " + topic + " is closed");
            }
            KafkaMessage message = buffer.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (message != null) {
                message.lease(Instant.now().plus(settings.getAckDeadline()));
                return message;
            }
        }
    }

    @Override
    public boolean isOpen() {
        return started.get() && !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            Consumer<String, byte[]> c = consumer;
            if (c != null) {
                c.wakeup();
            }
        }
    }

    private void enqueue(ConsumerRecord<String, byte[]> record) {
        TopicPartition tp = new TopicPartition(record.topic(), record.partition());
        KafkaMessage message;
        synchronized (partitions) {
            PartitionState state = partitions.computeIfAbsent(tp, k -> new PartitionState());
            if (state.pendingSeek != null && record.offset() >= state.pendingSeek) {
                // Will be fetched again once the seek is applied.
                return;
            }
            message = new KafkaMessage(tp, state, record.offset(), record.key(), record.value(), 1);
            // A fetch after a seek supersedes any older delivery of the same offset.
            state.inFlight.put(record.offset(), message);
            state.nextOffset = record.offset() + 1;
        }
        buffer.add(message);
    }

    private void finished(KafkaMessage message, Throwable error) {
        synchronized (partitions) {
            PartitionState state = partitions.get(message.tp);
            if (state == null || state != message.state) {
                // Partition was revoked since the message was fetched.
                return;
            }
            KafkaMessage current = state.inFlight.get(message.offset);
            if (current == null) {
                // Already settled by another delivery or by the dead-letter topic.
                return;
            }
            if (error == null) {
                state.inFlight.remove(message.offset);
                return;
            }
            if (current != message) {
                // A newer delivery of the offset is still out and decides.
                return;
            }
            state.inFlight.remove(message.offset);
            if (state.pendingSeek == null || message.offset < state.pendingSeek) {
                state.pendingSeek = message.offset;
            }
            state.seekNotBefore = Instant.now().plus(settings.getRedeliveryDelay());
        }
    }

    private void applyPendingActions(Consumer<String, byte[]> c) {
        Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
        List<TopicPartition> toPause = new ArrayList<>();
        Map<TopicPartition, Long> toSeek = new HashMap<>();
        List<KafkaMessage> redeliveries = new ArrayList<>();
        List<KafkaMessage> deadLetters = new ArrayList<>();
        Instant now = Instant.now();

        synchronized (partitions) {
            for (Map.Entry<TopicPartition, PartitionState> entry : partitions.entrySet()) {
                TopicPartition tp = entry.getKey();
                PartitionState state = entry.getValue();
                if (state.pendingSeek != null) {
                    if (!state.paused) {
                        toPause.add(tp);
                        state.paused = true;
                    }
                    if (!now.isBefore(state.seekNotBefore)) {
                        long seek = state.pendingSeek;
                        dropBuffered(tp, seek, state);
                        state.nextOffset = Math.min(state.nextOffset, seek);
                        state.pendingSeek = null;
                        state.paused = false;
                        toSeek.put(tp, seek);
                    }
                } else {
                    expireLeases(state, now, redeliveries, deadLetters);
                }
                long commitPoint = state.commitPoint();
                if (commitPoint > state.committed) {
                    commits.put(tp, new OffsetAndMetadata(commitPoint));
                    state.committed = commitPoint;
                }
            }
        }

        buffer.addAll(redeliveries);
        deadLetters.forEach(this::deadLetter);
        if (!toPause.isEmpty()) {
            c.pause(toPause);
        }
        toSeek.forEach((tp, offset) -> {
            c.seek(tp, offset);
            if (!backpressured) {
                c.resume(List.of(tp));
            }
            log.debug("Seeking {} back to offset {} for redelivery", tp, offset);
        });
        if (backpressured && buffer.size() <= settings.getMaxBufferedRecords() / 2) {
            List<TopicPartition> resumable = new ArrayList<>();
            synchronized (partitions) {
                for (TopicPartition tp : c.assignment()) {
                    PartitionState state = partitions.get(tp);
                    if (state == null || !state.paused) {
                        resumable.add(tp);
                    }
                }
            }
            c.resume(resumable);
            backpressured = false;
        }
        if (!commits.isEmpty()) {
            c.commitAsync(commits, (offsets, e) -> {
                if (e != null) {
                    log.warn("Offset commit failed for group={}: {}", groupId, e.toString());
                }
            });
        }
    }

    // Caller holds the partitions lock.
    private void expireLeases(PartitionState state, Instant now,
                              List<KafkaMessage> redeliveries, List<KafkaMessage> deadLetters) {
        List<KafkaMessage> expired = new ArrayList<>();
        for (KafkaMessage message : state.inFlight.values()) {
            if (message.leaseExpired(now)) {
                expired.add(message);
            }
        }
        for (KafkaMessage message : expired) {
            message.lease(null);
            if (message.attempt >= settings.getMaxDeliveryAttempts()) {
                deadLetters.add(message);
                continue;
            }
            KafkaMessage again = new KafkaMessage(message.tp, state, message.offset,
                    message.key, message.payload, message.attempt + 1);
            state.inFlight.put(message.offset, again);
            redeliveries.add(again);
            log.warn("Ack deadline passed, delivering again: id={}, attempt={}", again.getId(), again.attempt);
        }
    }

    private void deadLetter(KafkaMessage message) {
        String deadLetterTopic = topic + settings.getDeadLetterSuffix();
        log.error("Message was not finished after {} deliveries, moving it to {}: id={}",
                message.attempt, deadLetterTopic, message.getId());
        try {
            deadLetterTemplate.send(deadLetterTopic, message.key, message.payload)
                    .whenComplete((result, e) -> {
                        if (e == null) {
                            settle(message);
                        } else {
                            deadLetterFailed(message, deadLetterTopic, e);
                        }
                    });
        } catch (RuntimeException e) {
            deadLetterFailed(message, deadLetterTopic, e);
        }
    }

    private void deadLetterFailed(KafkaMessage message, String deadLetterTopic, Throwable error) {
        // Stays in flight; the next expired lease tries the dead-letter topic again.
        message.lease(Instant.now().plus(settings.getAckDeadline()));
        log.error("Failed to move message to {}: id={}, error={}", deadLetterTopic, message.getId(), error.toString());
    }

    private void settle(KafkaMessage message) {
        synchronized (partitions) {
            if (partitions.get(message.tp) == message.state) {
                message.state.inFlight.remove(message.offset, message);
            }
        }
    }

    // Caller holds the partitions lock.
    private void dropBuffered(TopicPartition tp, long fromOffset, PartitionState state) {
        List<KafkaMessage> dropped = new ArrayList<>();
        buffer.removeIf(m -> {
            if (m.tp.equals(tp) && m.offset >= fromOffset) {
                dropped.add(m);
                return true;
            }
            return false;
        });
        for (KafkaMessage m : dropped) {
            state.inFlight.remove(m.offset, m);
        }
    }

    private final class RebalanceListener implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> revoked) {
            Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
            synchronized (partitions) {
                for (TopicPartition tp : revoked) {
                    PartitionState state = partitions.remove(tp);
                    if (state == null) {
                        continue;
                    }
                    long commitPoint = state.commitPoint();
                    if (commitPoint > state.committed) {
                        commits.put(tp, new OffsetAndMetadata(commitPoint));
                    }
                }
                buffer.removeIf(m -> revoked.contains(m.tp));
            }
            Consumer<String, byte[]> c = consumer;
            if (c != null && !commits.isEmpty()) {
                try {
                    c.commitSync(commits);
                } catch (KafkaException e) {
                    log.warn("Offset commit on revoke failed for group={}: {}", groupId, e.toString());
                }
            }
            log.info("Partitions revoked: group={} partitions={}", groupId, revoked);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> assigned) {
            log.info("Partitions assigned: group={} partitions={}", groupId, assigned);
        }
    }

    private static final class PartitionState {
        // Offset → latest delivery of it.
        final TreeMap<Long, KafkaMessage> inFlight = new TreeMap<>();
        long nextOffset = -1;
        long committed = -1;
        Long pendingSeek;
        Instant seekNotBefore = Instant.EPOCH;
        boolean paused;

        long commitPoint() {
            if (nextOffset < 0) {
                return -1;
            }
            long point = inFlight.isEmpty() ? nextOffset : Math.min(inFlight.firstKey(), nextOffset);
            return pendingSeek == null ? point : Math.min(point, pendingSeek);
        }
    }

    private final class KafkaMessage implements QueueMessage {

        private final TopicPartition tp;
        private final PartitionState state;
        private final long offset;
        private final String key;
        private final byte[] payload;
        private final int attempt;
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private volatile Instant leaseExpiry;

        private KafkaMessage(TopicPartition tp, PartitionState state, long offset,
                             String key, byte[] payload, int attempt) {
            this.tp = tp;
            this.state = state;
            this.offset = offset;
            this.key = key;
            this.payload = payload;
            this.attempt = attempt;
        }

        void lease(Instant expiry) {
            leaseExpiry = expiry;
        }

        boolean leaseExpired(Instant now) {
            Instant expiry = leaseExpiry;
            return expiry != null && !now.isBefore(expiry);
        }

        @Override
        public String getId() {
            return tp + "@" + offset;
        }

        @Override
        public byte[] getPayload() {
            return payload;
        }

        @Override
        public void finish(Throwable error) throws QueueException {
            if (!finished.compareAndSet(false, true)) {
                throw new QueueException("message " + getId() + " was already finished");
            }
            finished(this, error);
        }
    }
}
