package com.cellbroker.service;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.IncompleteConfigException;
import com.cellbroker.exception.PublishException;
import com.cellbroker.exception.TenantNotFoundException;
import com.cellbroker.model.CellTenant;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.Queue;
import com.cellbroker.model.State;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueuePublisher;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes an ingress event onto its tenant's decouple queue.
 *
 * FLOW:
 *   tenant not in snapshot        → TenantNotFoundException
 *   decouple queue / topic missing → IncompleteConfigException
 *   decouple queue not READY      → TenantNotFoundException
 *   filtering on, no target wants → dropped
 *   otherwise                     → published to the decouple topic
 *
 * The first three are transient: the tenant's config has not fully propagated yet.
 */
@Slf4j
public class DecoupleRouter {

    private final TargetsCache targets;
    private final QueuePublisher publisher;
    private final EventFilter eventFilter;
    private final PublishSettings publishSettings;
    private final boolean filteringEnabled;

    public DecoupleRouter(TargetsCache targets,
                          QueuePublisher publisher,
                          EventFilter eventFilter,
                          PublishSettings publishSettings,
                          boolean filteringEnabled) {
        this.targets = targets;
        this.publisher = publisher;
        this.eventFilter = eventFilter;
        this.publishSettings = publishSettings;
        this.filteringEnabled = filteringEnabled;
    }

    public void send(CellTenantKey key, BrokerEvent event) throws PublishException {
        CellTenant tenant = targets.getCellTenant(key)
                .orElseThrow(() -> new TenantNotFoundException("cell tenant " + key + " not found"));

        Queue queue = tenant.getDecoupleQueue();
        if (queue == null || !queue.hasTopic()) {
            throw new IncompleteConfigException("decouple queue of cell tenant " + key + " is not configured yet");
        }
        if (queue.getState() != State.READY) {
            throw new TenantNotFoundException(
                    "decouple queue of cell tenant " + key + " is not ready: state=" + queue.getState());
        }

        if (filteringEnabled && !eventFilter.anyTargetMatches(tenant, event)) {
            log.debug("No target matches event, dropping: tenant={}, eventId={}", key, event.getId());
            return;
        }

        publisher.publish(queue.getTopic(), event, publishSettings);
        log.debug("Event routed to decouple queue: tenant={}, topic={}, eventId={}", key, queue.getTopic(), event.getId());
    }
}
