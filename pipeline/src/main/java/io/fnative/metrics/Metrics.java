package io.fnative.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;
    private final Map<String, Gauge<?>> ownGauges = new ConcurrentHashMap<>();

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public MetricRegistry registry() { return registry; }
    public String name(String suffix) { return MetricRegistry.name(prefix, suffix); }

    public Counter counter(String suffix) { return registry.counter(name(suffix)); }
    public Meter meter(String suffix) { return registry.meter(name(suffix)); }
    public Timer timer(String suffix) { return registry.timer(name(suffix)); }

    /**
     * Registers a gauge under this prefix. The latest registration wins: a gauge already under the
     * name, from this or another instance with the same prefix, is replaced.
     */
    public <V> void gauge(String suffix, Supplier<V> value) {
        String n = name(suffix);
        Gauge<V> gauge = value::get;
        synchronized (registry) {
            registry.remove(n);
            registry.register(n, gauge);
        }
        ownGauges.put(n, gauge);
    }

    /** Removes the gauge only while it is still the one this instance registered. */
    public void removeGauge(String suffix) {
        String n = name(suffix);
        Gauge<?> mine = ownGauges.remove(n);
        if (mine == null) return;
        synchronized (registry) {
            registry.removeMatching((name, metric) -> name.equals(n) && metric == mine);
        }
    }
}
