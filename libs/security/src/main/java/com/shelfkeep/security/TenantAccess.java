package com.shelfkeep.security;

/** Outcome of a {@link TenantIsolationGuard} check. */
public enum TenantAccess {
    ALLOW,
    DENY;

    public boolean allowed() {
        return this == ALLOW;
    }
}
