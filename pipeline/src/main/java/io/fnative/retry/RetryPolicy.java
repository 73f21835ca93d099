package io.fnative.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Throwable error);
    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Throwable error) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
