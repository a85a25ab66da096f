package com.shelfkeep.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates that an {@link ActorContext} received from the authorization layer is well-formed.
 * <p>
 * Returns all errors at once rather than failing on the first one.
 */
public final class ActorContextValidator {

    private ActorContextValidator() {
        // utility class
    }

    /**
     * Validates the actor context.
     *
     * @param actor the actor context to validate (may be null)
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(ActorContext actor) {
        if (actor == null) {
            return SecurityValidationResult.fail(List.of("actor must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(actor.memberId())) {
            errors.add("memberId must not be null or blank");
        }
        if (actor.tenantId() != null && actor.tenantId().isBlank()) {
            errors.add("tenantId must be null (global) or non-blank");
        }
        if (actor.role() == null) {
            errors.add("role must not be null");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
