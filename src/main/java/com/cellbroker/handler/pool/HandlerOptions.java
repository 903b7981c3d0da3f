package com.cellbroker.handler.pool;

import com.cellbroker.config.BrokerProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings applied to every handler a pool creates.
 */
@Value
@Builder(toBuilder = true)
public class HandlerOptions {

    /** Workers per handler; zero or negative means the number of CPUs. */
    int concurrency;
    int maxConcurrencyPerEvent;
    Duration timeoutPerEvent;
    Duration deliverTimeout;

    public static HandlerOptions from(BrokerProperties.Handler handler) {
        return HandlerOptions.builder()
                .concurrency(handler.getConcurrency())
                .maxConcurrencyPerEvent(handler.getMaxConcurrencyPerEvent())
                .timeoutPerEvent(handler.getTimeoutPerEvent())
                .deliverTimeout(handler.getDeliverTimeout())
                .build();
    }
}
