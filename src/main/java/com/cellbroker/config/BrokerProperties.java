package com.cellbroker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Centralizes data-plane configuration.
 *
 * Bound from application.yml under the "cellbroker" prefix:
 *   cellbroker:
 *     targets-file: /var/run/cellbroker/targets.json
 *     reload-interval: PT2S        # ISO-8601, also read by the reload schedule
 *     handler:
 *       concurrency: 0              # 0 → one worker per CPU
 *       max-concurrency-per-event: 1
 *       timeout-per-event: 10m
 *       deliver-timeout: 1m
 *     fanout:
 *       enabled: true
 *     retry:
 *       enabled: true
 *     ingress:
 *       filtering-enabled: false
 *       publish:
 *         buffered-byte-limit: 104857600
 *     queue:
 *       poll-timeout: 250ms
 *       max-buffered-records: 500
 *       ack-deadline: 15m
 *       max-delivery-attempts: 5
 *       dead-letter-suffix: .dead-letter
 *
 * Redelivery timing after a nack belongs to the queue service; queue.redelivery-delay
 * only tells the subscription how long to hold a nacked partition before seeking back.
 */
@ConfigurationProperties(prefix = "cellbroker")
@Validated
@Getter
@Setter
public class BrokerProperties {

    /** Mounted snapshot file written by the control plane. Empty → no file watching. */
    private String targetsFile = "";

    @NotNull
    private Duration reloadInterval = Duration.ofSeconds(2);

    @Valid
    private Handler handler = new Handler();

    @Valid
    private PoolToggle fanout = new PoolToggle();

    @Valid
    private PoolToggle retry = new PoolToggle();

    @Valid
    private Ingress ingress = new Ingress();

    @Valid
    private QueueSettings queue = new QueueSettings();

    @Getter
    @Setter
    public static class Handler {
        /** Worker threads per handler; zero or negative means the number of CPUs. */
        private int concurrency = 0;
        @Min(1)
        private int maxConcurrencyPerEvent = 1;
        @NotNull
        private Duration timeoutPerEvent = Duration.ofMinutes(10);
        @NotNull
        private Duration deliverTimeout = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class PoolToggle {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Ingress {
        private boolean filteringEnabled = false;
        @Valid
        private Publish publish = new Publish();
    }

    @Getter
    @Setter
    public static class Publish {
        @Min(1)
        private int bufferedByteLimit = 100 * 1024 * 1024;
        @Min(1)
        private int byteThreshold = 1024 * 1024;
        @NotNull
        private Duration delayThreshold = Duration.ofMillis(10);
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class QueueSettings {
        @NotNull
        private Duration pollTimeout = Duration.ofMillis(250);
        @Min(1)
        private int maxBufferedRecords = 500;
        @NotNull
        private Duration redeliveryDelay = Duration.ZERO;
        /** How long a received message may stay unfinished before it is delivered again. */
        @NotNull
        private Duration ackDeadline = Duration.ofMinutes(15);
        /** Deliveries of an unfinished message before it goes to the dead-letter topic. */
        @Min(1)
        private int maxDeliveryAttempts = 5;
        @NotNull
        private String deadLetterSuffix = ".dead-letter";
    }
}
