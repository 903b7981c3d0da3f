package com.cellbroker.exception;

/**
 * The tenant is not in the current snapshot, or is not ready yet.
 *
 * Expected while a new tenant's config is still propagating; callers should treat
 * it as transient.
 */
public class TenantNotFoundException extends RuntimeException {

    public TenantNotFoundException(String message) {
        super(message);
    }
}
