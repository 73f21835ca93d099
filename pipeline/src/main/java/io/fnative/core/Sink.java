package io.fnative.core;

import java.io.Closeable;

/**
 * Sink consumes delivered values in strictly increasing index order.
 */
public interface Sink<T> extends Closeable {
    void accept(long index, T value) throws Exception;

    @Override
    default void close() {}
}
