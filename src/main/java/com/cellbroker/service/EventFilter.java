package com.cellbroker.service;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.model.CellTenant;
import com.cellbroker.model.Target;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether an event is wanted by a target.
 *
 * A target's filterAttributes is a plain map of attribute name → exact value:
 *   {}                                       → matches every event
 *   {"type": "order.placed"}                 → matches any source, type must be "order.placed"
 *   {"type": "order.placed", "region": "eu"} → both must match; "region" is an extension
 *
 * Attributes the filter does not mention are ignored. An attribute the event does
 * not carry never matches.
 */
@Component
public class EventFilter {

    public boolean matches(Map<String, String> filterAttributes, BrokerEvent event) {
        if (filterAttributes == null || filterAttributes.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> filter : filterAttributes.entrySet()) {
            String actual = event.getAttribute(filter.getKey());
            if (actual == null || !actual.equals(filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether at least one target of the tenant wants the event. A tenant
     * without targets wants nothing.
     */
    public boolean anyTargetMatches(CellTenant tenant, BrokerEvent event) {
        if (tenant.getTargets() == null) {
            return false;
        }
        for (Target target : tenant.getTargets().values()) {
            if (matches(target.getFilterAttributes(), event)) {
                return true;
            }
        }
        return false;
    }
}
