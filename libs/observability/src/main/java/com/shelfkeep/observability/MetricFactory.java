package com.shelfkeep.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that all carry a {@code service} tag.
 * <p>
 * The tenant of the current {@link CorrelationContextHolder} is added as a {@code tenant} tag
 * when one is bound, so loan activity can be segmented per tenant.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tenant tag value used for global actors and unbound threads. */
    public static final String GLOBAL_TENANT = "global";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns the counter with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "shelfkeep.loans.borrowed")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and tags, registering it on first use.
     *
     * @param name        metric name (e.g., "shelfkeep.loans.operation")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        String tenant = CorrelationContextHolder.get()
                .map(CorrelationContext::tenantId)
                .orElse(null);
        Tags tags = Tags.of(TAG_SERVICE, serviceName, TAG_TENANT, tenant != null ? tenant : GLOBAL_TENANT);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
