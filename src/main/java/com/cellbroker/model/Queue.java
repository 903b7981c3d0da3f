package com.cellbroker.model;

import lombok.*;

/**
 * One durable topic/subscription pair owned by the queue service.
 *
 *   topic        → where events are published
 *   subscription → the consumer identity that pulls them (a Kafka consumer group)
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@EqualsAndHashCode @ToString
public class Queue {

    private String topic;
    private String subscription;

    @Builder.Default
    private State state = State.UNKNOWN;

    public boolean hasTopic() {
        return topic != null && !topic.isEmpty();
    }
}
