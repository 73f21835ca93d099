package io.fnative.retry;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * Retries failures the {@code retryable} predicate accepts, up to {@code maxAttempts} attempts in
 * total, waiting {@code baseMillis * 2^(attempt-1)} capped at {@code maxMillis} between attempts.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final Predicate<Throwable> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, ExponentialBackoffRetryPolicy::transientFailure);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, Predicate<Throwable> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    /** Policy allowing {@code retries} extra attempts after the first. */
    public static ExponentialBackoffRetryPolicy withRetries(int retries, long baseMillis, long maxMillis) {
        return new ExponentialBackoffRetryPolicy(retries + 1, baseMillis, maxMillis);
    }

    /**
     * Everything except cancellation and failures that repeat for the same input: bad arguments and
     * arithmetic failures.
     */
    public static boolean transientFailure(Throwable error) {
        return !(error instanceof CancellationException
                || error instanceof IllegalArgumentException
                || error instanceof ArithmeticException);
    }

    public int maxAttempts() { return maxAttempts; }

    @Override
    public boolean shouldRetry(int attempt, Throwable error) {
        return attempt < maxAttempts && retryable.test(error);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, attempt - 1));
        return Math.min(delay, maxMillis);
    }
}
