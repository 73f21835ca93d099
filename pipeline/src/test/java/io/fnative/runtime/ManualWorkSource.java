package io.fnative.runtime;

import io.fnative.core.WorkSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Work source whose handles are completed by the test.
 */
class ManualWorkSource<T> implements WorkSource<T> {
    private final int workers;
    private final long length;
    final Map<Long, CompletableFuture<T>> handles = new ConcurrentHashMap<>();
    final List<Long> submitted = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakRunning = new AtomicInteger();

    ManualWorkSource(int workers, long length) {
        this.workers = workers;
        this.length = length;
    }

    @Override public int workerCount() { return workers; }

    @Override public OptionalLong length() { return length < 0 ? OptionalLong.empty() : OptionalLong.of(length); }

    @Override
    public Optional<CompletionStage<T>> submit(long index) {
        if (length >= 0 && index >= length) return Optional.empty();
        submitted.add(index);
        peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        CompletableFuture<T> f = new CompletableFuture<>();
        handles.put(index, f);
        return Optional.of(f);
    }

    void complete(long index, T value) {
        running.decrementAndGet();
        handles.get(index).complete(value);
    }

    void fail(long index, Exception e) {
        running.decrementAndGet();
        handles.get(index).completeExceptionally(e);
    }

    int submitCount() { return submitted.size(); }
    int peakRunning() { return peakRunning.get(); }
}
