package com.cellbroker;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.model.CellTenant;
import com.cellbroker.model.CellTenantType;
import com.cellbroker.model.Queue;
import com.cellbroker.model.State;
import com.cellbroker.model.Target;
import com.cellbroker.model.TargetsConfig;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot and event builders shared by the tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Queue readyQueue(String topic) {
        return Queue.builder().topic(topic).subscription(topic + "-sub").state(State.READY).build();
    }

    public static Target target(String namespace, String tenantName, String name, String address,
                                Map<String, String> filter) {
        return Target.builder()
                .id("id-" + name)
                .name(name)
                .namespace(namespace)
                .cellTenantType(CellTenantType.BROKER)
                .cellTenantName(tenantName)
                .filterAttributes(new LinkedHashMap<>(filter))
                .retryQueue(readyQueue("retry-" + namespace + "-" + tenantName + "-" + name))
                .address(address)
                .state(State.READY)
                .build();
    }

    public static CellTenant tenant(String namespace, String name, String address, Target... targets) {
        Map<String, Target> byName = new LinkedHashMap<>();
        for (Target t : targets) {
            byName.put(t.getName(), t);
        }
        return CellTenant.builder()
                .id("id-" + namespace + "-" + name)
                .type(CellTenantType.BROKER)
                .namespace(namespace)
                .name(name)
                .address(address)
                .decoupleQueue(readyQueue("decouple-" + namespace + "-" + name))
                .state(State.READY)
                .targets(byName)
                .build();
    }

    public static TargetsConfig config(CellTenant... tenants) {
        Map<String, CellTenant> byKey = new LinkedHashMap<>();
        for (CellTenant t : tenants) {
            byKey.put(t.key().persistenceString(), t);
        }
        return TargetsConfig.builder().cellTenants(byKey).build();
    }

    public static BrokerEvent event(String id) {
        return BrokerEvent.builder()
                .id(id)
                .source("//orders/service")
                .type("order.placed")
                .datacontenttype("application/json")
                .data("{\"total\":42}".getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
