package com.shelfkeep.security;

/**
 * Role check with hierarchy support.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the actor has the required role (directly or via hierarchy).
     * <p>
     * Example: a SUPER_ADMIN passes {@code hasRole(actor, TENANT_ADMIN)}.
     */
    public static boolean hasRole(ActorContext actor, Role required) {
        return actor.role() != null && actor.role().implies(required);
    }
}
