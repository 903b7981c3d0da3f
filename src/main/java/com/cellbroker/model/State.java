package com.cellbroker.model;

/**
 * Readiness of a tenant, target or queue as reported by the control plane.
 * Only READY queues accept ingress traffic.
 */
public enum State {
    UNKNOWN,
    READY,
    NOT_READY,
    FAILED
}
