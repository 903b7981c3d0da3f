package com.cellbroker.handler.pool;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.event.EventCodec;
import com.cellbroker.handler.Handler;
import com.cellbroker.handler.processor.DeliverProcessor;
import com.cellbroker.handler.processor.EventContext;
import com.cellbroker.handler.processor.FanoutProcessor;
import com.cellbroker.handler.processor.FilterProcessor;
import com.cellbroker.handler.processor.Processors;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.Queue;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueueClient;
import com.cellbroker.queue.QueuePublisher;
import com.cellbroker.queue.QueueSubscription;
import com.cellbroker.service.EventDeliveryClient;
import com.cellbroker.service.EventFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * One handler per cell tenant, consuming the tenant's decouple queue.
 *
 * Chain: FanoutProcessor → FilterProcessor → DeliverProcessor (failed deliveries
 * go to the target's retry queue).
 */
@Slf4j
public class FanoutSyncPool extends SyncPool<CellTenantKey> {

    private final TargetsCache targets;
    private final EventCodec eventCodec;
    private final EventFilter eventFilter;
    private final EventDeliveryClient deliveryClient;
    private final QueuePublisher retryPublisher;
    private final PublishSettings retryPublishSettings;
    private final ExecutorService fanoutExecutor;
    private final HandlerOptions options;

    public FanoutSyncPool(TargetsCache targets,
                          QueueClient queueClient,
                          EventCodec eventCodec,
                          EventFilter eventFilter,
                          EventDeliveryClient deliveryClient,
                          QueuePublisher retryPublisher,
                          PublishSettings retryPublishSettings,
                          ExecutorService fanoutExecutor,
                          HandlerOptions options) {
        super("fanout", queueClient);
        this.targets = targets;
        this.eventCodec = eventCodec;
        this.eventFilter = eventFilter;
        this.deliveryClient = deliveryClient;
        this.retryPublisher = retryPublisher;
        this.retryPublishSettings = retryPublishSettings;
        this.fanoutExecutor = fanoutExecutor;
        this.options = options;
    }

    @Override
    protected Map<CellTenantKey, Queue> collect() {
        Map<CellTenantKey, Queue> wanted = new LinkedHashMap<>();
        targets.forEachCellTenant(tenant -> {
            if (tenant.isUsable()) {
                wanted.put(tenant.key(), tenant.getDecoupleQueue());
            } else {
                log.debug("Cell tenant has no decouple queue yet: tenant={}", tenant.key());
            }
            return true;
        });
        return wanted;
    }

    @Override
    protected Handler createHandler(CellTenantKey key, QueueSubscription subscription) {
        return new Handler(
                "fanout-" + key.persistenceString(),
                subscription,
                Processors.chain(
                        new FanoutProcessor(targets, options.getMaxConcurrencyPerEvent(), fanoutExecutor),
                        new FilterProcessor(targets, eventFilter),
                        new DeliverProcessor(targets, deliveryClient, retryPublisher, retryPublishSettings, true)),
                eventCodec,
                EventContext.forTenant(key),
                options.getTimeoutPerEvent(),
                options.getConcurrency());
    }
}
