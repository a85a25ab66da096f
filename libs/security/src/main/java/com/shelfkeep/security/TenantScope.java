package com.shelfkeep.security;

/**
 * Scope of a read query: either one tenant or every tenant.
 *
 * @param tenantId the tenant to restrict to, or {@code null} for a global scope
 */
public record TenantScope(String tenantId) {

    private static final TenantScope GLOBAL = new TenantScope(null);

    public static TenantScope global() {
        return GLOBAL;
    }

    public static TenantScope of(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        return new TenantScope(tenantId);
    }

    public boolean isGlobal() {
        return tenantId == null;
    }
}
