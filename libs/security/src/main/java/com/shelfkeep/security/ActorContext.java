package com.shelfkeep.security;

/**
 * Verified identity of whoever is calling into the lending registry.
 *
 * <p>Supplied by the upstream authorization layer once it has authenticated the caller; the
 * registry never issues or verifies credentials itself. A {@code null} tenant id marks a global
 * actor that is not associated with any tenant.
 *
 * @param memberId roster identifier of the actor
 * @param tenantId tenant the actor belongs to, or {@code null} for a global actor
 * @param role the actor's registry role
 */
public record ActorContext(String memberId, String tenantId, Role role) {

    /** Whether the actor is not associated with any tenant. */
    public boolean isGlobal() {
        return tenantId == null;
    }

    /** The scope of records this actor reads by default. */
    public TenantScope scope() {
        return isGlobal() ? TenantScope.global() : TenantScope.of(tenantId);
    }
}
