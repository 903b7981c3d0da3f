package com.cellbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A logical broker (or channel) and its targets.
 *
 * Events sent to a tenant are first published to its decouple queue, then fanned
 * out to every target whose filter matches. Replies from targets are sent back to
 * {@code address} so they re-enter the tenant as new events.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
@EqualsAndHashCode @ToString
public class CellTenant {

    private String id;

    @Builder.Default
    private CellTenantType type = CellTenantType.BROKER;

    private String namespace;
    private String name;
    private String address;
    private Queue decoupleQueue;

    @Builder.Default
    private State state = State.UNKNOWN;

    @Builder.Default
    private Map<String, Target> targets = new LinkedHashMap<>();

    @JsonIgnore
    public CellTenantKey key() {
        return new CellTenantKey(type, namespace, name);
    }

    /**
     * A tenant without a decouple topic cannot take traffic, whatever its state says.
     */
    @JsonIgnore
    public boolean isUsable() {
        return decoupleQueue != null && decoupleQueue.hasTopic();
    }
}
