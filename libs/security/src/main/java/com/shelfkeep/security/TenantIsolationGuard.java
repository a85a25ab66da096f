package com.shelfkeep.security;

import java.util.Optional;

/**
 * Decides whether an actor may touch a record owned by a given tenant.
 * <p>
 * Rules:
 * <ul>
 *   <li>a tenant-scoped actor may act only on records of its own tenant</li>
 *   <li>a global {@link Role#SUPER_ADMIN} may act on records of any tenant</li>
 *   <li>a global actor with any other role is denied everything</li>
 * </ul>
 * Callers must report {@link TenantAccess#DENY} exactly like an absent record, so that the
 * existence of another tenant's records is never revealed.
 */
public final class TenantIsolationGuard {

    private TenantIsolationGuard() {
        // utility class
    }

    /**
     * Checks the actor against the tenant id of the record being accessed.
     *
     * @param actor            the verified actor
     * @param recordTenantId   tenant owning the record (may be {@code null} for global records)
     * @return {@link TenantAccess#ALLOW} or {@link TenantAccess#DENY}
     */
    public static TenantAccess check(ActorContext actor, String recordTenantId) {
        if (actor.isGlobal()) {
            return actor.role() == Role.SUPER_ADMIN ? TenantAccess.ALLOW : TenantAccess.DENY;
        }
        return actor.tenantId().equals(recordTenantId) ? TenantAccess.ALLOW : TenantAccess.DENY;
    }

    /**
     * Resolves the tenant new child records (loans, items) are created under.
     * <p>
     * Child records always belong to exactly one tenant, so a global actor cannot create them.
     *
     * @return the actor's tenant id, or empty when the actor is global
     */
    public static Optional<String> creationTenant(ActorContext actor) {
        return Optional.ofNullable(actor.tenantId());
    }
}
