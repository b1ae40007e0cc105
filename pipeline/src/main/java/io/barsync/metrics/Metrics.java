package io.barsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/** Registry wrapper that prefixes every metric with a component name. */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry) { this(registry, ""); }

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix == null ? "" : prefix;
    }

    public MetricRegistry registry() { return registry; }

    public Metrics scoped(String name) { return new Metrics(registry, qualify(name)); }

    public Counter counter(String name) { return registry.counter(qualify(name)); }
    public Meter meter(String name) { return registry.meter(qualify(name)); }
    public Timer timer(String name) { return registry.timer(qualify(name)); }

    private String qualify(String name) { return prefix.isEmpty() ? name : MetricRegistry.name(prefix, name); }
}
