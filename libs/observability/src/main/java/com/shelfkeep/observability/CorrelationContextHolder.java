package com.shelfkeep.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Request-scoped {@link CorrelationContext} of the registry, mirrored into the SLF4J MDC.
 * <p>
 * A request goes through two stages: the web filter opens a context carrying only the
 * correlation id, and once the actor header has been verified {@link #bindActor} adds the acting
 * tenant and member. A global actor has no tenant, so its {@code tenantId} MDC key is removed.
 * Pool threads start without a context.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Replaces the current thread's context.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        for (String key : CorrelationContext.MDC_KEYS) {
            String value = context.mdcValue(key);
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }

    /**
     * Binds the verified actor to the open request context. Does nothing outside a request,
     * where there is no correlation id to attach the actor to.
     *
     * @param tenantId tenant of the actor, or {@code null} for a global actor
     * @param memberId roster id of the actor
     */
    public static void bindActor(String tenantId, String memberId) {
        CorrelationContext current = CURRENT.get();
        if (current != null) {
            set(current.withActor(tenantId, memberId));
        }
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** Ends the request context and removes its MDC keys. */
    public static void clear() {
        CURRENT.remove();
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
