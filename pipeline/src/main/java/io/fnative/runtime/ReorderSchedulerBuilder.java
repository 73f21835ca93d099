package io.fnative.runtime;

import com.codahale.metrics.MetricRegistry;
import io.fnative.config.SchedulerConfig;
import io.fnative.core.WorkSource;
import io.fnative.metrics.Metrics;

import java.util.Objects;

public class ReorderSchedulerBuilder<T> {
    private WorkSource<T> source;
    private SchedulerConfig config = SchedulerConfig.defaults();
    private boolean cancelInFlight = false;
    private String name = "scheduler";
    private MetricRegistry metricRegistry = new MetricRegistry();

    public ReorderSchedulerBuilder<T> source(WorkSource<T> s) { this.source = s; return this; }
    public ReorderSchedulerBuilder<T> config(SchedulerConfig c) { this.config = Objects.requireNonNull(c, "config"); return this; }
    public ReorderSchedulerBuilder<T> prefetch(int p) { this.config = config.withPrefetch(p); return this; }
    public ReorderSchedulerBuilder<T> backlog(int b) { this.config = config.withBacklog(b); return this; }
    public ReorderSchedulerBuilder<T> cancelInFlight(boolean c) { this.cancelInFlight = c; return this; }
    public ReorderSchedulerBuilder<T> name(String n) { this.name = Objects.requireNonNull(n, "name"); return this; }
    public ReorderSchedulerBuilder<T> metrics(MetricRegistry r) { this.metricRegistry = Objects.requireNonNull(r, "metrics"); return this; }

    /**
     * @throws IllegalArgumentException when no prefetch was given and the source reports no workers
     */
    public ReorderScheduler<T> build() {
        Objects.requireNonNull(source, "source");
        return new ReorderScheduler<>(source, config, cancelInFlight, new Metrics(metricRegistry, name));
    }
}
