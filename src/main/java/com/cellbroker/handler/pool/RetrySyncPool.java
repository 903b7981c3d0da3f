package com.cellbroker.handler.pool;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.event.EventCodec;
import com.cellbroker.handler.Handler;
import com.cellbroker.handler.processor.DeliverProcessor;
import com.cellbroker.handler.processor.EventContext;
import com.cellbroker.model.Queue;
import com.cellbroker.model.TargetKey;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueueClient;
import com.cellbroker.queue.QueuePublisher;
import com.cellbroker.queue.QueueSubscription;
import com.cellbroker.service.EventDeliveryClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One handler per target, consuming the target's retry queue and delivering
 * straight to the target. Failures nack the message; there is no further
 * retry queue to fall back to.
 */
public class RetrySyncPool extends SyncPool<TargetKey> {

    private final TargetsCache targets;
    private final EventCodec eventCodec;
    private final EventDeliveryClient deliveryClient;
    private final QueuePublisher publisher;
    private final HandlerOptions options;

    public RetrySyncPool(TargetsCache targets,
                         QueueClient queueClient,
                         EventCodec eventCodec,
                         EventDeliveryClient deliveryClient,
                         QueuePublisher publisher,
                         HandlerOptions options) {
        super("retry", queueClient);
        this.targets = targets;
        this.eventCodec = eventCodec;
        this.deliveryClient = deliveryClient;
        this.publisher = publisher;
        this.options = options;
    }

    @Override
    protected Map<TargetKey, Queue> collect() {
        Map<TargetKey, Queue> wanted = new LinkedHashMap<>();
        targets.forEachTarget(target -> {
            if (target.getRetryQueue() != null && target.getRetryQueue().hasTopic()) {
                wanted.put(target.key(), target.getRetryQueue());
            }
            return true;
        });
        return wanted;
    }

    @Override
    protected Handler createHandler(TargetKey key, QueueSubscription subscription) {
        return new Handler(
                "retry-" + key.persistenceString(),
                subscription,
                new DeliverProcessor(targets, deliveryClient, publisher, PublishSettings.DEFAULT, false),
                eventCodec,
                EventContext.forTarget(key),
                options.getTimeoutPerEvent(),
                options.getConcurrency());
    }
}
