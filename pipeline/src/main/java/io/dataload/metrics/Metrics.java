package io.dataload.metrics;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Objects;

/**
 * Thin facade over a Dropwizard {@link MetricRegistry} shared by producers and clients of one run.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics backed by a private registry, for callers that do not report them. */
    public static Metrics detached() { return new Metrics(new MetricRegistry()); }

    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }
}
