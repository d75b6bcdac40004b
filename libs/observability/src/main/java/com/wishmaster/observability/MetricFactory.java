package com.wishmaster.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that always carry a {@code service} tag.
 * <p>
 * Meters are registered idempotently by the underlying {@link MeterRegistry}: asking twice
 * for the same name and tags returns the same meter, so callers may look meters up per
 * request instead of caching them.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
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
     * Creates (or looks up) a counter with the service tag.
     *
     * @param name        metric name (e.g., "wishmaster.authentication")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a timer with the service tag.
     *
     * @param name        metric name (e.g., "wishmaster.permission.resolution")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     * @return the timer
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
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
