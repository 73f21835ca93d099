package io.fnative.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.fnative.config.SchedulerConfig;
import io.fnative.core.Delivery;
import io.fnative.core.WorkSource;
import io.fnative.error.ComputationException;
import io.fnative.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pulls index-keyed results from a {@link WorkSource} and hands them to a single consumer in
 * strictly increasing index order.
 * <p>
 * At most {@code prefetch} units are running at once and at most {@code backlog} units (running or
 * completed but not yet delivered) are held in the reorder buffer. Completions arrive on the
 * source's threads in any order; {@link #next()} blocks until the unit at the delivery cursor has
 * completed. The first failure stops admission of new work; units before the failing index are
 * still delivered, the failure is delivered when the cursor reaches it, and everything after it
 * is discarded.
 * <p>
 * Single pass: once {@link #next()} has returned done, every further call returns done and a fresh
 * {@link #iterator()} is empty. Build a new scheduler to iterate a source again.
 */
public class ReorderScheduler<T> implements Iterable<T>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReorderScheduler.class);

    private final WorkSource<T> source;
    private final int prefetch;
    private final int backlog;
    private final boolean cancelInFlight;

    private final Metrics metrics;
    private final Meter submittedMeter;
    private final Meter completedMeter;
    private final Meter failedMeter;
    private final Meter deliveredMeter;
    private final Counter discardedCounter;
    private final Timer waitTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<Long, Pending<T>> reorder = new HashMap<>();

    private long length = -1; // -1 while unknown
    private long nextIndex;
    private long cursor;
    private int outstanding;
    private int peakOutstanding;
    private int peakBuffered;
    private boolean started;
    private boolean terminal;
    private boolean failureSeen;
    private boolean finished;
    private boolean closed;
    private boolean admitting;

    public ReorderScheduler(WorkSource<T> source, SchedulerConfig config, boolean cancelInFlight, Metrics metrics) {
        this.source = Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        this.prefetch = config.effectivePrefetch(source.workerCount());
        this.backlog = config.effectiveBacklog(prefetch);
        this.cancelInFlight = cancelInFlight;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.submittedMeter = metrics.meter("submitted");
        this.completedMeter = metrics.meter("completed");
        this.failedMeter = metrics.meter("failed");
        this.deliveredMeter = metrics.meter("delivered");
        this.discardedCounter = metrics.counter("discarded");
        this.waitTimer = metrics.timer("next.wait");
    }

    /**
     * Reads the source length and submits the first window of work. Idempotent; no-op once closed.
     */
    public void start() {
        lock.lock();
        try {
            if (started || closed) return;
            started = true;
            OptionalLong len = source.length();
            length = len.isPresent() ? Math.max(0, len.getAsLong()) : -1;
            metrics.gauge("outstanding", this::outstanding);
            metrics.gauge("buffered", this::buffered);
            log.debug("starting: prefetch={} backlog={} length={}", prefetch, backlog, len.isPresent() ? length : "unknown");
            admit();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the unit at the delivery cursor has completed and returns it. Returns a failure
     * for the first failing index, and done once the sequence is exhausted, after a failure has
     * been delivered, or after {@link #close()}.
     */
    public Delivery<T> next() throws InterruptedException {
        start();
        lock.lock();
        Timer.Context waiting = null;
        try {
            while (true) {
                if (finished) return Delivery.done();
                Pending<T> p = reorder.get(cursor);
                if (p == null) {
                    if (terminal || (length >= 0 && cursor >= length)) {
                        log.debug("sequence ended after {} deliveries", cursor);
                        finish();
                        return Delivery.done();
                    }
                    admit();
                    if (terminal || reorder.containsKey(cursor)) continue;
                } else if (p.done) {
                    reorder.remove(cursor);
                    if (p.error != null) {
                        ComputationException e = new ComputationException(cursor, p.error);
                        finish();
                        return Delivery.failure(e);
                    }
                    long index = cursor++;
                    deliveredMeter.mark();
                    admit();
                    changed.signalAll();
                    return Delivery.value(index, p.value);
                }
                if (waiting == null) waiting = waitTimer.time();
                changed.await();
            }
        } finally {
            if (waiting != null) waiting.stop();
            lock.unlock();
        }
    }

    /**
     * Stops admission and drops every buffered and running unit. Running units are not aborted
     * unless the scheduler was built with {@code cancelInFlight}; their results are ignored.
     * Safe to call repeatedly and concurrently with {@link #next()}.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            int dropped = reorder.size();
            finish();
            log.debug("closed at cursor {}: dropped {} buffered, {} still running", cursor, dropped, outstanding);
        } finally {
            lock.unlock();
        }
        metrics.removeGauge("outstanding");
        metrics.removeGauge("buffered");
    }

    /**
     * Values in index order. A failure is thrown as {@link ComputationException}; the scheduler is
     * closed when the iteration ends either way. All iterators share the one delivery cursor.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private Delivery<T> pending;

            @Override
            public boolean hasNext() {
                if (pending == null) {
                    try {
                        pending = ReorderScheduler.this.next();
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        pending = Delivery.done();
                    }
                }
                if (pending.isFailure()) {
                    ComputationException e = pending.error();
                    pending = Delivery.done();
                    close();
                    throw e;
                }
                if (pending.isDone()) {
                    close();
                    return false;
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                T value = pending.value();
                pending = null;
                return value;
            }
        };
    }

    public int prefetch() { return prefetch; }
    public int backlog() { return backlog; }

    public int outstanding() {
        lock.lock();
        try { return outstanding; } finally { lock.unlock(); }
    }

    public int buffered() {
        lock.lock();
        try { return reorder.size(); } finally { lock.unlock(); }
    }

    public int peakOutstanding() {
        lock.lock();
        try { return peakOutstanding; } finally { lock.unlock(); }
    }

    public int peakBuffered() {
        lock.lock();
        try { return peakBuffered; } finally { lock.unlock(); }
    }

    public long cursor() {
        lock.lock();
        try { return cursor; } finally { lock.unlock(); }
    }

    public boolean isTerminal() {
        lock.lock();
        try { return terminal; } finally { lock.unlock(); }
    }

    // Caller holds the lock. A stage that is already complete runs its callback on this thread,
    // which re-enters here; the nested call returns and this loop takes the freed slot.
    private void admit() {
        if (admitting) return;
        admitting = true;
        try {
            while (!terminal && outstanding < prefetch && reorder.size() < backlog) {
                long index = nextIndex;
                if (length >= 0 && index >= length) {
                    exhausted();
                    break;
                }
                Optional<CompletionStage<T>> handle;
                try {
                    handle = source.submit(index);
                } catch (RuntimeException e) {
                    Pending<T> p = new Pending<>(index, null);
                    p.fail(e);
                    nextIndex++;
                    reorder.put(index, p);
                    track();
                    failed(index, e);
                    break;
                }
                if (handle.isEmpty()) {
                    exhausted();
                    break;
                }
                Pending<T> p = new Pending<>(index, handle.get());
                nextIndex++;
                outstanding++;
                reorder.put(index, p);
                track();
                submittedMeter.mark();
                handle.get().whenComplete((value, error) -> onComplete(p, value, error));
            }
        } finally {
            admitting = false;
        }
    }

    private void onComplete(Pending<T> p, T value, Throwable error) {
        lock.lock();
        try {
            outstanding--;
            completedMeter.mark();
            if (p.discarded) return;
            if (error != null) {
                Throwable cause = unwrap(error);
                p.fail(cause);
                failed(p.index, cause);
            } else {
                p.succeed(value);
                admit();
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void failed(long index, Throwable cause) {
        failedMeter.mark();
        terminal = true;
        if (!failureSeen) {
            failureSeen = true;
            log.warn("index {} failed; no further work will be submitted", index, cause);
        }
    }

    private void exhausted() {
        if (terminal) return;
        terminal = true;
        log.debug("work source exhausted after {} submissions", nextIndex);
    }

    private void finish() {
        if (finished) return;
        finished = true;
        terminal = true;
        for (Pending<T> p : reorder.values()) {
            p.discarded = true;
            discardedCounter.inc();
            if (cancelInFlight && !p.done && p.handle instanceof Future<?> f) {
                f.cancel(false);
            }
        }
        reorder.clear();
        changed.signalAll();
    }

    private void track() {
        peakOutstanding = Math.max(peakOutstanding, outstanding);
        peakBuffered = Math.max(peakBuffered, reorder.size());
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    static final class Pending<T> {
        final long index;
        final CompletionStage<T> handle; // null when submission itself failed
        boolean done;
        boolean discarded;
        T value;
        Throwable error;

        Pending(long index, CompletionStage<T> handle) {
            this.index = index;
            this.handle = handle;
        }

        void succeed(T v) { this.value = v; this.done = true; }
        void fail(Throwable e) { this.error = e; this.done = true; }
    }
}
