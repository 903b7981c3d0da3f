package com.cellbroker.handler.processor;

import com.cellbroker.config.TargetsCache;
import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.event.RemainingHops;
import com.cellbroker.exception.DeliveryException;
import com.cellbroker.exception.ProcessingException;
import com.cellbroker.exception.PublishException;
import com.cellbroker.model.CellTenant;
import com.cellbroker.model.Target;
import com.cellbroker.model.TargetKey;
import com.cellbroker.queue.PublishSettings;
import com.cellbroker.queue.QueuePublisher;
import com.cellbroker.service.EventDeliveryClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Delivers an event to the target named in the context.
 *
 * FLOW:
 *   resolve tenant + target from the snapshot ── missing ──→ done (config is catching up)
 *          ↓
 *   POST a copy of the event (hop count stripped) to target.address
 *          ↓
 *   ┌── failed ─────────────────────────────┬── 2xx ──────────────────────────┐
 *   ↓                                       ↓                                 ↓
 *   retryOnFailure?                    no reply                         reply event
 *   yes → publish ORIGINAL event           ↓                          hop budget left?
 *         to target.retryQueue.topic   next processor                  no  → drop reply
 *   no  → ProcessingException                                          yes → POST reply to
 *                                                                            tenant.address
 *
 * A failed reply forward is handled like a failed delivery of the original event,
 * so the original is what gets retried.
 */
@Slf4j
public class DeliverProcessor extends BaseProcessor {

    private final TargetsCache targets;
    private final EventDeliveryClient deliveryClient;
    private final QueuePublisher retryPublisher;
    private final PublishSettings retryPublishSettings;
    private final boolean retryOnFailure;

    public DeliverProcessor(TargetsCache targets,
                            EventDeliveryClient deliveryClient,
                            QueuePublisher retryPublisher,
                            PublishSettings retryPublishSettings,
                            boolean retryOnFailure) {
        this.targets = targets;
        this.deliveryClient = deliveryClient;
        this.retryPublisher = retryPublisher;
        this.retryPublishSettings = retryPublishSettings;
        this.retryOnFailure = retryOnFailure;
    }

    @Override
    public void process(EventContext ctx, BrokerEvent event) throws ProcessingException {
        TargetKey targetKey = ctx.target()
                .orElseThrow(() -> new ProcessingException("no target key in " + ctx));

        Optional<CellTenant> tenant = targets.getCellTenant(ctx.getTenantKey());
        if (tenant.isEmpty()) {
            log.warn("Tenant no longer exists in the config: tenant={}", ctx.getTenantKey());
            return;
        }
        Optional<Target> target = targets.getTarget(targetKey);
        if (target.isEmpty()) {
            log.warn("Target no longer exists in the config: target={}", targetKey);
            return;
        }

        if (ctx.isExpired()) {
            throw new ProcessingException("deadline passed before delivery to " + targetKey);
        }

        // The hop count is local to the broker; targets never see it.
        // The original event stays untouched for the retry queue.
        BrokerEvent outgoing = event.copy();
        RemainingHops.delete(outgoing);
        OptionalInt replyHops = RemainingHops.forReply(event);

        Optional<BrokerEvent> reply;
        try {
            reply = deliveryClient.deliver(target.get().getAddress(), outgoing);
        } catch (DeliveryException e) {
            onFailure(target.get(), event, "target delivery failed", e);
            return;
        }

        if (reply.isPresent()) {
            if (replyHops.isEmpty()) {
                log.debug("Dropping reply based on remaining hops: target={}, eventId={}, replyId={}",
                        targetKey, event.getId(), reply.get().getId());
            } else {
                BrokerEvent replyEvent = reply.get();
                RemainingHops.delete(replyEvent);
                RemainingHops.set(replyEvent, replyHops.getAsInt());
                try {
                    deliveryClient.send(tenant.get().getAddress(), replyEvent);
                } catch (DeliveryException e) {
                    onFailure(target.get(), event, "delivery of replied event failed", e);
                    return;
                }
            }
        }

        next().process(ctx, event);
    }

    private void onFailure(Target target, BrokerEvent original, String what, DeliveryException cause)
            throws ProcessingException {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProcessingException(what + " (processing was cancelled): " + cause.getMessage(), cause);
        }
        if (!retryOnFailure) {
            throw new ProcessingException(what + ": " + cause.getMessage(), cause);
        }
        log.warn("{}, sending to retry queue: target={}, eventId={}, error={}",
                what, target.key(), original.getId(), cause.getMessage());
        sendToRetryTopic(target, original);
    }

    private void sendToRetryTopic(Target target, BrokerEvent original) throws ProcessingException {
        if (target.getRetryQueue() == null || !target.getRetryQueue().hasTopic()) {
            throw new ProcessingException("target " + target.key() + " has no retry topic");
        }
        try {
            retryPublisher.publish(target.getRetryQueue().getTopic(), original, retryPublishSettings);
        } catch (PublishException e) {
            throw new ProcessingException("failed to send event to retry topic: " + e.getMessage(), e);
        }
    }
}
