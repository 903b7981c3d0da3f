package com.cellbroker.handler.processor;

import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.TargetKey;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-event request data passed explicitly down the processor chain.
 *
 *   tenantKey → the tenant whose queue the event came from
 *   targetKey → set for retry handlers, and by the fan-out stage for each target
 *   deadline  → when the handler gives up on this event; null means no limit
 */
@Getter
public final class EventContext {

    private final CellTenantKey tenantKey;
    private final TargetKey targetKey;
    private final Instant deadline;

    private EventContext(CellTenantKey tenantKey, TargetKey targetKey, Instant deadline) {
        this.tenantKey = tenantKey;
        this.targetKey = targetKey;
        this.deadline = deadline;
    }

    public static EventContext forTenant(CellTenantKey tenantKey) {
        return new EventContext(Objects.requireNonNull(tenantKey, "tenantKey"), null, null);
    }

    public static EventContext forTarget(TargetKey targetKey) {
        Objects.requireNonNull(targetKey, "targetKey");
        return new EventContext(targetKey.getParentKey(), targetKey, null);
    }

    public EventContext withTarget(TargetKey targetKey) {
        return new EventContext(tenantKey, Objects.requireNonNull(targetKey, "targetKey"), deadline);
    }

    public EventContext withDeadline(Instant deadline) {
        return new EventContext(tenantKey, targetKey, deadline);
    }

    public Optional<TargetKey> target() {
        return Optional.ofNullable(targetKey);
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    @Override
    public String toString() {
        return "EventContext{tenant=" + tenantKey + ", target=" + targetKey + ", deadline=" + deadline + "}";
    }
}
