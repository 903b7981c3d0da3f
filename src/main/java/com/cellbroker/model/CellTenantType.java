package com.cellbroker.model;

/**
 * Kind of logical broker a {@link CellTenant} represents.
 * BROKER   → a standalone broker with triggers
 * CHANNEL  → a channel with subscriptions
 */
public enum CellTenantType {
    UNKNOWN_CELL_TENANT_TYPE,
    BROKER,
    CHANNEL
}
