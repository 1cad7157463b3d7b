package com.reflex.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry a {@code component} tag.
 *
 * <p>Meter names share the {@code reflex.} prefix; the component tag tells the supervisor, mesh and
 * view manager apart when they share one registry.
 */
public final class MetricFactory {

    /** Tag key identifying the emitting component. */
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;
    private final String component;

    /**
     * @param registry the meter registry (Prometheus in the service, simple in tests)
     * @param component logical component name included on every meter
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /** A factory backed by a private {@link SimpleMeterRegistry}, for callers that export nothing. */
    public static MetricFactory standalone(String component) {
        return new MetricFactory(new SimpleMeterRegistry(), component);
    }

    /** @param tags additional tags as key-value pairs */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    /** @param tags additional tags as key-value pairs */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    /**
     * Registers a gauge that samples the supplier whenever it is read. The supplier must be cheap and
     * thread-safe.
     */
    public void gauge(String name, String description, Supplier<Number> supplier, String... tags) {
        Gauge.builder(name, supplier).description(description).tags(baseTags(tags)).register(registry);
    }

    /** Returns a factory on the same registry for another component. */
    public MetricFactory forComponent(String otherComponent) {
        return new MetricFactory(registry, otherComponent);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
