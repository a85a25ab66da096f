package com.shelfkeep.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Registry roles carried by every verified actor.
 * <p>
 * SUPER_ADMIN implies TENANT_ADMIN, which implies MEMBER.
 */
public enum Role {

    MEMBER("member"),
    TENANT_ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "super_admin"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns the set of roles that this role implies (inherits).
     * <ul>
     *   <li>SUPER_ADMIN implies TENANT_ADMIN, MEMBER</li>
     *   <li>TENANT_ADMIN implies MEMBER</li>
     *   <li>MEMBER implies nothing</li>
     * </ul>
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case SUPER_ADMIN -> EnumSet.of(TENANT_ADMIN, MEMBER);
            case TENANT_ADMIN -> EnumSet.of(MEMBER);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role
     * (either directly or through the hierarchy).
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by its canonical string value. The legacy value {@code "user"} is accepted
     * as an alias of {@link #MEMBER}.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if ("user".equals(value)) {
            return Optional.of(MEMBER);
        }
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Jackson entry point for the role carried in the actor header.
     *
     * @throws IllegalArgumentException if the value names no role
     */
    @JsonCreator
    public static Role fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
