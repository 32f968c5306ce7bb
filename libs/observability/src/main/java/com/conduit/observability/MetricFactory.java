package com.conduit.observability;

import io.micrometer.core.instrument.LongTaskTimer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for the Micrometer meters used by the RPC layer.
 * <p>
 * Registration is idempotent: asking twice for the same name and tags returns the meter already
 * held by the registry, so interceptors can look meters up per call without coordinating with
 * each other.
 */
public final class MetricFactory {

    private final MeterRegistry registry;

    /**
     * Creates a MetricFactory bound to the given registry.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     */
    public MetricFactory(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Creates or looks up a timer (histogram of durations).
     *
     * @param name        metric name (e.g., "grpc.server.lag")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(Tags.of(tags))
                .register(registry);
    }

    /**
     * Creates or looks up a long task timer. Its {@code activeTasks()} is the number of samples
     * started and not yet stopped, which makes it a gauge of work in flight.
     *
     * @param name        metric name (e.g., "grpc.client.inflight")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public LongTaskTimer longTaskTimer(String name, String description, String... tags) {
        return LongTaskTimer.builder(name)
                .description(description)
                .tags(Tags.of(tags))
                .register(registry);
    }
}
