package io.fnative.core;

/**
 * Computes the unit of work for one index. Runs on a worker thread of the owning source.
 */
@FunctionalInterface
public interface IndexedTask<T> {
    T compute(long index) throws Exception;
}
