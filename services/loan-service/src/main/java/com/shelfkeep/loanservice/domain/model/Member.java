package com.shelfkeep.loanservice.domain.model;

import com.shelfkeep.security.Role;

/**
 * Roster entry as seen by the borrowing engine.
 *
 * @param id member identifier
 * @param tenantId owning tenant, or {@code null} for a global super-administrator
 * @param role roster role
 */
public record Member(String id, String tenantId, Role role) {}
