package com.cellbroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A subscriber (trigger) under a {@link CellTenant}.
 *
 * Example:
 *   name             = "order-auditor"
 *   namespace        = "shop"
 *   cellTenantName   = "default"
 *   filterAttributes = {"type": "order.placed"}
 *   address          = "http://auditor.shop.svc/events"
 *
 * An empty filter map matches every event.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
@EqualsAndHashCode @ToString
public class Target {

    private String id;
    private String name;
    private String namespace;

    @Builder.Default
    private CellTenantType cellTenantType = CellTenantType.BROKER;

    private String cellTenantName;

    @Builder.Default
    private Map<String, String> filterAttributes = new LinkedHashMap<>();

    private Queue retryQueue;
    private String address;

    @Builder.Default
    private State state = State.UNKNOWN;

    @JsonIgnore
    public TargetKey key() {
        return new TargetKey(new CellTenantKey(cellTenantType, namespace, cellTenantName), name);
    }
}
