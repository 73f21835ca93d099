package io.fnative.source;

import io.fnative.core.IndexedTask;
import io.fnative.core.WorkSource;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongPredicate;

/**
 * Runs an {@link IndexedTask} on a fixed pool of daemon worker threads owned by this source.
 * Every handle completes: with the task's value, with whatever it threw (errors included), or with
 * a {@link CancellationException} when the source is closed first.
 */
public class ExecutorWorkSource<T> implements WorkSource<T> {
    private static final AtomicInteger POOLS = new AtomicInteger();

    private final IndexedTask<T> task;
    private final LongPredicate hasIndex;
    private final long length;
    private final int threads;
    private final ExecutorService pool;
    private final Set<CompletableFuture<T>> open = ConcurrentHashMap.newKeySet();

    private ExecutorWorkSource(IndexedTask<T> task, LongPredicate hasIndex, long length, int threads) {
        this.task = Objects.requireNonNull(task, "task");
        this.hasIndex = Objects.requireNonNull(hasIndex, "hasIndex");
        this.length = length;
        this.threads = Math.max(1, threads);
        int poolId = POOLS.incrementAndGet();
        AtomicInteger workerId = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(this.threads, r -> {
            Thread t = new Thread(r, "fnative-" + poolId + "-worker-" + workerId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Source of exactly {@code length} indices, 0 to length - 1. */
    public static <T> ExecutorWorkSource<T> bounded(IndexedTask<T> task, long length, int threads) {
        if (length < 0) throw new IllegalArgumentException("length must be >= 0: " + length);
        return new ExecutorWorkSource<>(task, i -> i < length, length, threads);
    }

    /** Open-ended source; the sequence ends at the first index {@code hasIndex} rejects. */
    public static <T> ExecutorWorkSource<T> probing(IndexedTask<T> task, LongPredicate hasIndex, int threads) {
        return new ExecutorWorkSource<>(task, hasIndex, -1, threads);
    }

    @Override
    public int workerCount() { return threads; }

    @Override
    public OptionalLong length() { return length < 0 ? OptionalLong.empty() : OptionalLong.of(length); }

    @Override
    public Optional<CompletionStage<T>> submit(long index) {
        if (!hasIndex.test(index)) return Optional.empty();
        CompletableFuture<T> result = new CompletableFuture<>();
        open.add(result);
        result.whenComplete((v, e) -> open.remove(result));
        try {
            pool.execute(() -> {
                if (result.isDone()) return; // cancelled before it started
                try {
                    result.complete(task.compute(index));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new CancellationException("work source closed before index " + index + " ran"));
        }
        return Optional.of(result);
    }

    /** Stops the workers and fails every handle that has not completed yet. */
    @Override
    public void close() {
        pool.shutdownNow();
        for (CompletableFuture<T> f : open) {
            f.completeExceptionally(new CancellationException("work source closed"));
        }
    }
}
