package io.fnative.source;

import io.fnative.core.WorkSource;
import io.fnative.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Re-submits failed indices to the wrapped source according to a {@link RetryPolicy}. The handle
 * returned for an index completes with the first successful attempt or the last failure.
 * The wrapped source must accept an index being submitted again.
 */
public class RetryingWorkSource<T> implements WorkSource<T> {
    private static final Logger log = LoggerFactory.getLogger(RetryingWorkSource.class);
    private static final ScheduledExecutorService BACKOFF = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "fnative-retry-backoff");
        t.setDaemon(true);
        return t;
    });

    private final WorkSource<T> delegate;
    private final RetryPolicy policy;

    public RetryingWorkSource(WorkSource<T> delegate, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public int workerCount() { return delegate.workerCount(); }

    @Override
    public OptionalLong length() { return delegate.length(); }

    @Override
    public Optional<CompletionStage<T>> submit(long index) {
        Optional<CompletionStage<T>> first = delegate.submit(index);
        if (first.isEmpty()) return Optional.empty();
        CompletableFuture<T> result = new CompletableFuture<>();
        watch(index, first.get(), 1, result);
        return Optional.of(result);
    }

    private void watch(long index, CompletionStage<T> stage, int attempt, CompletableFuture<T> result) {
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (result.isDone() || !policy.shouldRetry(attempt, cause)) {
                result.completeExceptionally(cause);
                return;
            }
            long backoff = policy.backoffMillis(attempt);
            log.debug("index {} failed on attempt {} ({}), retrying in {}ms", index, attempt, cause.toString(), backoff);
            BACKOFF.schedule(() -> resubmit(index, attempt + 1, result), backoff, TimeUnit.MILLISECONDS);
        });
    }

    private void resubmit(long index, int attempt, CompletableFuture<T> result) {
        if (result.isDone()) return; // cancelled while backing off
        try {
            Optional<CompletionStage<T>> next = delegate.submit(index);
            if (next.isEmpty()) {
                result.completeExceptionally(new IllegalStateException("index " + index + " no longer available for retry"));
                return;
            }
            watch(index, next.get(), attempt, result);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    @Override
    public void close() {
        delegate.close();
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
