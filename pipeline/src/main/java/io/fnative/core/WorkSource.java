package io.fnative.core;

import java.io.Closeable;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletionStage;

/**
 * A WorkSource computes index-keyed units of work asynchronously on its own workers.
 * Completion is pushed through the returned stage; callers register with {@code whenComplete}.
 */
public interface WorkSource<T> extends Closeable {
    /**
     * Parallelism the source can sustain, used as the default prefetch window.
     */
    int workerCount();

    /**
     * Begin computing {@code index}. Return empty when there is no such index; the caller treats
     * that as the end of the sequence. Indices are requested in strictly increasing order.
     */
    Optional<CompletionStage<T>> submit(long index);

    /**
     * Total number of indices if known up front, empty for open-ended sources.
     */
    default OptionalLong length() { return OptionalLong.empty(); }

    @Override
    default void close() {}
}
