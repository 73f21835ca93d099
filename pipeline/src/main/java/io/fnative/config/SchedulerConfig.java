package io.fnative.config;

/**
 * Prefetch and backlog limits of a reorder scheduler. Zero or negative prefetch and negative
 * backlog mean "unspecified" and resolve against the work source at construction time.
 */
public record SchedulerConfig(int prefetch, int backlog) {
    public static final int UNSPECIFIED_PREFETCH = 0;
    public static final int UNSPECIFIED_BACKLOG = -1;
    public static final int BACKLOG_FACTOR = 3;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(UNSPECIFIED_PREFETCH, UNSPECIFIED_BACKLOG);
    }

    public static SchedulerConfig fromEnv() {
        int prefetch = Integer.parseInt(System.getProperty("fnative.prefetch", System.getenv().getOrDefault("FNATIVE_PREFETCH", String.valueOf(UNSPECIFIED_PREFETCH))));
        int backlog = Integer.parseInt(System.getProperty("fnative.backlog", System.getenv().getOrDefault("FNATIVE_BACKLOG", String.valueOf(UNSPECIFIED_BACKLOG))));
        return new SchedulerConfig(prefetch, backlog);
    }

    public SchedulerConfig withPrefetch(int p) { return new SchedulerConfig(p, backlog); }
    public SchedulerConfig withBacklog(int b) { return new SchedulerConfig(prefetch, b); }

    /**
     * @throws IllegalArgumentException when prefetch is unspecified and the source reports no workers
     */
    public int effectivePrefetch(int workerCount) {
        if (prefetch > 0) return prefetch;
        if (workerCount <= 0) {
            throw new IllegalArgumentException("work source reports " + workerCount + " workers and no prefetch was given");
        }
        return workerCount;
    }

    public int effectiveBacklog(int effectivePrefetch) {
        if (backlog < 0) return effectivePrefetch * BACKLOG_FACTOR;
        return Math.max(backlog, effectivePrefetch);
    }
}
