package io.gridflow.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Registers the gauge once; later calls with the same name keep the first supplier. */
    @SuppressWarnings("unchecked")
    public <T> Gauge<T> gauge(String name, Gauge<T> supplier) {
        return (Gauge<T>) registry.gauge(name, () -> supplier);
    }
}
